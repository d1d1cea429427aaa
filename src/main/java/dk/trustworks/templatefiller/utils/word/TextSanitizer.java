package dk.trustworks.templatefiller.utils.word;

import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Normalizes generated text before it is split into lines or blocks.
 *
 * <ul>
 *   <li>line endings become {@code \n}</li>
 *   <li>runs of two or more spaces become one space (tabs are kept)</li>
 *   <li>every line is stripped of leading and trailing whitespace</li>
 *   <li>runs of three or more newlines become exactly two</li>
 *   <li>the whole text is stripped</li>
 * </ul>
 */
public final class TextSanitizer {

    private static final Pattern MULTI_SPACE = Pattern.compile(" {2,}");
    private static final Pattern MULTI_NEWLINE = Pattern.compile("\n{3,}");

    private TextSanitizer() {
    }

    public static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = normalizeLineEndings(raw);
        text = MULTI_SPACE.matcher(text).replaceAll(" ");
        text = Stream.of(text.split("\n", -1))
                .map(String::strip)
                .collect(Collectors.joining("\n"));
        text = MULTI_NEWLINE.matcher(text).replaceAll("\n\n");
        return text.strip();
    }

    static String normalizeLineEndings(String raw) {
        return raw.replace("\r\n", "\n").replace('\r', '\n');
    }
}
