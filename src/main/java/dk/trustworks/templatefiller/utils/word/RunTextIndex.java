package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;

import java.util.ArrayList;
import java.util.List;

/**
 * Character map of one paragraph: the logical text (all {@code w:t} texts of all runs
 * concatenated in order) and, for every character of it, the run, the {@code w:t}
 * element inside that run and the offset inside that element.
 *
 * <p>The index is a snapshot. Any edit of the paragraph's runs makes it stale, so it is
 * rebuilt with {@link #build(XWPFParagraph)} after every splice, never patched.
 */
public final class RunTextIndex {

    private final List<XWPFRun> runs;
    private final List<List<CTText>> elements;
    private final List<List<String>> elementTexts;
    private final String text;
    private final int[] runIndex;
    private final int[] textIndex;
    private final int[] textOffset;

    private RunTextIndex(List<XWPFRun> runs, List<List<CTText>> elements, List<List<String>> elementTexts,
                         String text, int[] runIndex, int[] textIndex, int[] textOffset) {
        this.runs = runs;
        this.elements = elements;
        this.elementTexts = elementTexts;
        this.text = text;
        this.runIndex = runIndex;
        this.textIndex = textIndex;
        this.textOffset = textOffset;
    }

    public static RunTextIndex build(XWPFParagraph paragraph) {
        List<XWPFRun> runs = new ArrayList<>(paragraph.getRuns());
        List<List<CTText>> elements = new ArrayList<>(runs.size());
        List<List<String>> elementTexts = new ArrayList<>(runs.size());
        StringBuilder text = new StringBuilder();
        for (XWPFRun run : runs) {
            CTR ctr = run.getCTR();
            List<CTText> runElements = new ArrayList<>();
            List<String> runTexts = new ArrayList<>();
            for (int t = 0; t < ctr.sizeOfTArray(); t++) {
                CTText element = ctr.getTArray(t);
                String value = RunText.valueOf(element);
                runElements.add(element);
                runTexts.add(value);
                text.append(value);
            }
            elements.add(runElements);
            elementTexts.add(runTexts);
        }

        int[] runIndex = new int[text.length()];
        int[] textIndex = new int[text.length()];
        int[] textOffset = new int[text.length()];
        int position = 0;
        for (int r = 0; r < runs.size(); r++) {
            List<String> runTexts = elementTexts.get(r);
            for (int t = 0; t < runTexts.size(); t++) {
                int length = runTexts.get(t).length();
                for (int offset = 0; offset < length; offset++) {
                    runIndex[position] = r;
                    textIndex[position] = t;
                    textOffset[position] = offset;
                    position++;
                }
            }
        }
        return new RunTextIndex(runs, elements, elementTexts, text.toString(), runIndex, textIndex, textOffset);
    }

    /** The paragraph's logical text. */
    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /** Index (in the paragraph's run list) of the run holding the given character. */
    public int runIndexAt(int charIndex) {
        checkBounds(charIndex);
        return runIndex[charIndex];
    }

    /** Index of the {@code w:t} element, among its run's {@code w:t} elements, holding the given character. */
    public int textIndexAt(int charIndex) {
        checkBounds(charIndex);
        return textIndex[charIndex];
    }

    /** Offset of the given character inside its {@code w:t} element. */
    public int offsetAt(int charIndex) {
        checkBounds(charIndex);
        return textOffset[charIndex];
    }

    public int runCount() {
        return runs.size();
    }

    public XWPFRun run(int index) {
        return runs.get(index);
    }

    /** Text of the run as it was when the index was built. */
    public String runText(int index) {
        return String.join("", elementTexts.get(index));
    }

    public int textCount(int run) {
        return elements.get(run).size();
    }

    CTText textElement(int run, int text) {
        return elements.get(run).get(text);
    }

    /** Text of a {@code w:t} element as it was when the index was built. */
    String elementText(int run, int text) {
        return elementTexts.get(run).get(text);
    }

    private void checkBounds(int charIndex) {
        if (charIndex < 0 || charIndex >= text.length()) {
            throw new IndexOutOfBoundsException("Character index " + charIndex + " outside [0, " + text.length() + ")");
        }
    }
}
