package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.List;

/**
 * Outcome of one splice.
 *
 * @param run                    the run that received the replacement text
 * @param runIndex               position of that run in the paragraph's run list
 * @param textIndex              {@code w:t} element of that run where the replacement ends
 * @param offsetAfterReplacement offset in that element right after the replacement
 * @param editedRuns             every run whose text the splice changed, in paragraph order
 */
public record SpliceResult(XWPFRun run, int runIndex, int textIndex, int offsetAfterReplacement,
                           List<XWPFRun> editedRuns) {

    public SpliceResult {
        editedRuns = List.copyOf(editedRuns);
    }
}
