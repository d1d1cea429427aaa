package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.Collection;

/**
 * Applies the template's canonical formatting to runs and paragraphs the engine wrote.
 */
public class RunFormatter {

    private final String fontFamily;
    private final int fontSize;
    private final int hangingIndentTwips;

    public RunFormatter(TemplateLayout layout) {
        this.fontFamily = layout.fontFamily();
        this.fontSize = layout.fontSize();
        this.hangingIndentTwips = layout.hangingIndentTwips();
    }

    /**
     * Normalizes runs that received substituted values: body font and size, never bold.
     */
    public void applyValueFormatting(Collection<XWPFRun> runs) {
        for (XWPFRun run : runs) {
            styleRun(run, false);
        }
    }

    public void styleRun(XWPFRun run, boolean bold) {
        run.setFontFamily(fontFamily);
        run.setFontSize(fontSize);
        run.setBold(bold);
    }

    /** Single line spacing, nothing after. */
    public void applySingleSpacing(XWPFParagraph paragraph) {
        paragraph.setSpacingBetween(1.0, LineSpacingRule.AUTO);
        paragraph.setSpacingAfter(0);
    }

    /** Hanging indent where the first line starts at the margin, and full justification. */
    public void applyHangingIndent(XWPFParagraph paragraph) {
        paragraph.setIndentationLeft(hangingIndentTwips);
        paragraph.setIndentationHanging(hangingIndentTwips);
        paragraph.setAlignment(ParagraphAlignment.BOTH);
    }
}
