package dk.trustworks.templatefiller.utils.word;

import dk.trustworks.templatefiller.exceptions.ImageDecodeException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-fill state: the caller's maps, decoded images and the running counts for the
 * {@link FillReport}. Created for one fill and discarded afterwards.
 */
public class FillContext {

    private final Map<String, String> values;
    private final Map<String, String> images;
    private final ImageDecoder imageDecoder;

    private final Map<String, Optional<DecodedImage>> decoded = new HashMap<>();
    private final Set<String> unresolved = new LinkedHashSet<>();
    private final List<ImageFailure> imageFailures = new ArrayList<>();
    private int valuesReplaced;
    private int imagesInserted;
    private int sectionsExpanded;

    public FillContext(Map<String, String> values, Map<String, String> images, ImageDecoder imageDecoder) {
        this.values = values != null ? values : Map.of();
        this.images = images != null ? images : Map.of();
        this.imageDecoder = imageDecoder;
    }

    public Map<String, String> values() {
        return values;
    }

    public Map<String, String> images() {
        return images;
    }

    /** Value for a placeholder; a {@code null} entry fills as empty text. */
    public String value(String name) {
        String value = values.get(name);
        return value != null ? value : "";
    }

    /**
     * Decodes an image token once per fill. A failure is recorded the first time and the
     * token is reported as not fillable from then on.
     */
    public Optional<DecodedImage> image(String token) {
        return decoded.computeIfAbsent(token, name -> {
            try {
                return Optional.of(imageDecoder.decode(name, images.get(name)));
            } catch (ImageDecodeException e) {
                imageFailed(name, e.getReason());
                return Optional.empty();
            }
        });
    }

    public void unresolved(String name) {
        unresolved.add(name);
    }

    public void imageFailed(String token, String reason) {
        imageFailures.add(new ImageFailure(token, reason));
    }

    public void valueReplaced() {
        valuesReplaced++;
    }

    public void imageInserted() {
        imagesInserted++;
    }

    public void sectionExpanded() {
        sectionsExpanded++;
    }

    public FillReport report() {
        return new FillReport(valuesReplaced, imagesInserted, sectionsExpanded, unresolved, imageFailures);
    }
}
