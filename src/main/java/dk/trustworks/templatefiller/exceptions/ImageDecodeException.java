package dk.trustworks.templatefiller.exceptions;

import dk.trustworks.templatefiller.utils.word.ImageFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when image data for one or more {@code IMAGE_*} placeholders could not be
 * decoded or embedded.
 */
public class ImageDecodeException extends TemplateFillException {

    private final List<String> tokens = new ArrayList<>();
    private final String reason;

    public ImageDecodeException(String token, String reason) {
        super(400, "Failed to decode image " + token + ": " + reason);
        this.tokens.add(token);
        this.reason = reason;
    }

    public ImageDecodeException(String token, String reason, Throwable cause) {
        super(400, "Failed to decode image " + token + ": " + reason, cause);
        this.tokens.add(token);
        this.reason = reason;
    }

    public ImageDecodeException(List<ImageFailure> failures) {
        super(400, buildMessage(failures));
        for (ImageFailure failure : failures) {
            tokens.add(failure.token());
        }
        this.reason = failures.isEmpty() ? null : failures.get(0).reason();
    }

    /** The first offending placeholder. */
    public String getToken() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public List<String> getTokens() {
        return new ArrayList<>(tokens);
    }

    private static String buildMessage(List<ImageFailure> failures) {
        if (failures.isEmpty()) {
            return "Failed to decode image";
        }
        ImageFailure first = failures.get(0);
        StringBuilder message = new StringBuilder("Failed to decode image ")
                .append(first.token())
                .append(": ")
                .append(first.reason());
        if (failures.size() > 1) {
            message.append(" (").append(failures.size() - 1).append(" more)");
        }
        return message.toString();
    }
}
