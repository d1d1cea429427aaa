package dk.trustworks.templatefiller.utils.word;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the risk/mitigant mini-language.
 *
 * <p>The text is split on blank lines into blocks. A block is {@code RISK_NAME<TAB>MITIGANT};
 * without a tab, a first line of the form {@code <short capitalized label><2+ spaces><rest>}
 * is accepted instead. Anything else is a plain block.
 *
 * <p>Space collapsing during sanitization would erase the label gap, so label gaps are
 * turned into tabs on the raw text first.
 */
public class RiskBlockParser {

    static final int MAX_LABEL_LENGTH = 60;

    private static final Pattern LABEL_LINE =
            Pattern.compile("^([A-Z][A-Za-z0-9&/'(),\\-]*(?: [A-Za-z0-9&/'(),\\-]+){0,7}) {2,}(\\S.*)$");
    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\n{2,}");

    public List<RiskBlock> parse(String raw) {
        String text = TextSanitizer.sanitize(markLabelGaps(raw));
        List<RiskBlock> blocks = new ArrayList<>();
        if (text.isEmpty()) {
            return blocks;
        }
        for (String block : BLOCK_SEPARATOR.split(text)) {
            if (!block.isBlank()) {
                blocks.add(parseBlock(block));
            }
        }
        return blocks;
    }

    static RiskBlock parseBlock(String block) {
        int tab = block.indexOf('\t');
        if (tab > 0) {
            String name = joinLines(block.substring(0, tab));
            String mitigant = joinLines(block.substring(tab + 1).replace('\t', ' '));
            if (!name.isEmpty() && !mitigant.isEmpty()) {
                return RiskBlock.risk(name, mitigant);
            }
        }
        return RiskBlock.plain(joinLines(block));
    }

    /**
     * Replaces the label gap of every block's first line with a tab, when that line has
     * no tab of its own and its label is short enough.
     */
    static String markLabelGaps(String raw) {
        if (raw == null) {
            return null;
        }
        String[] lines = TextSanitizer.normalizeLineEndings(raw).split("\n", -1);
        boolean blockStart = true;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                blockStart = true;
                continue;
            }
            if (blockStart && line.indexOf('\t') < 0) {
                Matcher matcher = LABEL_LINE.matcher(line.strip());
                if (matcher.matches() && matcher.group(1).length() <= MAX_LABEL_LENGTH) {
                    lines[i] = matcher.group(1) + "\t" + matcher.group(2);
                }
            }
            blockStart = false;
        }
        return String.join("\n", lines);
    }

    private static String joinLines(String text) {
        return text.replace('\n', ' ').strip();
    }
}
