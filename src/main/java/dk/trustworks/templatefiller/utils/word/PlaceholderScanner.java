package dk.trustworks.templatefiller.utils.word;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {{NAME}} placeholders in a paragraph's logical text and classifies them.
 *
 * <p>Placeholder names consist of uppercase letters, digits and underscores. Classification
 * precedence:
 * <ol>
 *   <li>a structured token name is {@link PlaceholderKind#STRUCTURED} when the value map holds it</li>
 *   <li>an {@code IMAGE_} name present in the image map is {@link PlaceholderKind#IMAGE}</li>
 *   <li>a name present in the value map is {@link PlaceholderKind#VALUE}</li>
 *   <li>anything else is {@link PlaceholderKind#UNRESOLVED} and stays in the document as is</li>
 * </ol>
 */
public class PlaceholderScanner {

    public static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([A-Z0-9_]+)\\}\\}");

    public static final String IMAGE_PREFIX = "IMAGE_";

    /**
     * Returns the non-overlapping placeholders of {@code text} in ascending start order.
     */
    public List<PlaceholderMatch> scan(String text, Map<String, String> values, Map<String, String> images) {
        List<PlaceholderMatch> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matches;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1);
            matches.add(new PlaceholderMatch(name, matcher.start(), matcher.end(), classify(name, values, images)));
        }
        return matches;
    }

    public PlaceholderKind classify(String name, Map<String, String> values, Map<String, String> images) {
        if (StructuredToken.fromName(name).isPresent()) {
            return values.containsKey(name) ? PlaceholderKind.STRUCTURED : PlaceholderKind.UNRESOLVED;
        }
        if (name.startsWith(IMAGE_PREFIX) && images.containsKey(name)) {
            return PlaceholderKind.IMAGE;
        }
        if (values.containsKey(name)) {
            return PlaceholderKind.VALUE;
        }
        return PlaceholderKind.UNRESOLVED;
    }
}
