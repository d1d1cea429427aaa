package dk.trustworks.templatefiller.utils.word;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the sponsor block mini-language: one output paragraph per line, blank lines
 * become spacers and short label-like lines become bold headers.
 *
 * <p>A non-blank line is a {@link LineKind#HEADER} when all of these hold:
 * <ul>
 *   <li>it is shorter than 80 characters</li>
 *   <li>it does not end in '.', '!' or '?'</li>
 *   <li>it contains at least one uppercase letter</li>
 *   <li>the next non-blank line is at least 1.5 times longer, or starts with a lowercase letter</li>
 * </ul>
 * Otherwise it is {@link LineKind#BODY}.
 */
public class SponsorBlockParser {

    static final int MAX_HEADER_LENGTH = 80;
    static final double FOLLOWING_LINE_RATIO = 1.5;

    public List<SponsorLine> parse(String raw) {
        String text = TextSanitizer.sanitize(raw);
        List<SponsorLine> lines = new ArrayList<>();
        if (text.isEmpty()) {
            return lines;
        }
        List<String> split = List.of(text.split("\n", -1));
        for (int i = 0; i < split.size(); i++) {
            lines.add(new SponsorLine(split.get(i), classify(split, i)));
        }
        return lines;
    }

    public static LineKind classify(List<String> lines, int index) {
        String line = lines.get(index);
        if (line.isBlank()) {
            return LineKind.BLANK;
        }
        return looksLikeHeader(line.strip(), nextNonBlank(lines, index)) ? LineKind.HEADER : LineKind.BODY;
    }

    static boolean looksLikeHeader(String line, String next) {
        if (line.length() >= MAX_HEADER_LENGTH) {
            return false;
        }
        char last = line.charAt(line.length() - 1);
        if (last == '.' || last == '!' || last == '?') {
            return false;
        }
        if (line.chars().noneMatch(Character::isUpperCase)) {
            return false;
        }
        if (next == null) {
            return false;
        }
        return next.length() >= FOLLOWING_LINE_RATIO * line.length() || Character.isLowerCase(next.charAt(0));
    }

    private static String nextNonBlank(List<String> lines, int index) {
        for (int i = index + 1; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                return lines.get(i).strip();
            }
        }
        return null;
    }
}
