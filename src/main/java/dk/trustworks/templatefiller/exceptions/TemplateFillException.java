package dk.trustworks.templatefiller.exceptions;

import java.util.List;

/**
 * Base exception for template fill operations. Carries the HTTP status it maps to.
 */
public class TemplateFillException extends RuntimeException {

    private final int status;

    public TemplateFillException(int status, String message) {
        super(message);
        this.status = status;
    }

    public TemplateFillException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Placeholder names the failure concerns, empty when it concerns none.
     */
    public List<String> getTokens() {
        return List.of();
    }
}
