package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces a span of a paragraph's logical text in place, across run boundaries.
 *
 * <p>Edits are made on the {@code w:t} elements the span covers: the element holding the
 * span start keeps its head and receives the replacement, the element holding the span
 * end keeps its tail, and every element in between is emptied. Runs are never removed,
 * and sibling {@code w:tab}, {@code w:br} and {@code w:drawing} elements stay where they
 * are. Line breaks and tabs in the replacement become {@code w:br} and {@code w:tab}.
 */
public class RunSplicer {

    /**
     * @param index       fresh index of the paragraph being edited; stale after this call
     * @param start       span start in logical-text coordinates (inclusive)
     * @param end         span end (exclusive)
     * @param replacement text to put in place of the span, empty to delete it
     */
    public SpliceResult splice(RunTextIndex index, int start, int end, String replacement) {
        if (start < 0 || end > index.length() || start >= end) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for text of length " + index.length());
        }
        String text = replacement != null ? replacement : "";

        int firstRun = index.runIndexAt(start);
        int firstText = index.textIndexAt(start);
        int startOffset = index.offsetAt(start);
        int lastRun = index.runIndexAt(end - 1);
        int lastText = index.textIndexAt(end - 1);
        int endOffset = index.offsetAt(end - 1) + 1;

        String firstValue = index.elementText(firstRun, firstText);
        String head = firstValue.substring(0, startOffset);
        String tail;
        if (firstRun == lastRun && firstText == lastText) {
            tail = firstValue.substring(endOffset);
        } else {
            tail = "";
            for (int r = firstRun; r <= lastRun; r++) {
                int from = r == firstRun ? firstText + 1 : 0;
                int to = r == lastRun ? lastText : index.textCount(r);
                for (int t = from; t < to; t++) {
                    RunText.set(index.textElement(r, t), "");
                }
            }
            RunText.set(index.textElement(lastRun, lastText), index.elementText(lastRun, lastText).substring(endOffset));
        }

        CTText receiving = index.textElement(firstRun, firstText);
        int added = RunText.write(receiving, head, text, tail);

        XWPFRun run = index.run(firstRun);
        int textIndex = firstText + added;
        int offset = RunText.valueOf(run.getCTR().getTArray(textIndex)).length() - tail.length();

        List<XWPFRun> edited = new ArrayList<>();
        for (int r = firstRun; r <= lastRun; r++) {
            edited.add(index.run(r));
        }
        return new SpliceResult(run, firstRun, textIndex, offset, edited);
    }
}
