package dk.trustworks.templatefiller.utils.word;

import lombok.extern.jbosslog.JBossLog;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.List;

/**
 * Expands a structured placeholder into a chain of paragraphs.
 *
 * <p>The placeholder's own paragraph becomes the first output paragraph: its runs are
 * removed and rewritten, but the paragraph object and its properties stay, so anything
 * referring to it remains valid. Further paragraphs are inserted directly after it, in
 * output order. The structured token owns its whole paragraph.
 */
@JBossLog
public class StructuredSectionExpander {

    private final SponsorBlockParser sponsorParser;
    private final RiskBlockParser riskParser;
    private final RunFormatter formatter;
    private final ParagraphInserter inserter;

    public StructuredSectionExpander(SponsorBlockParser sponsorParser, RiskBlockParser riskParser,
                                     RunFormatter formatter, ParagraphInserter inserter) {
        this.sponsorParser = sponsorParser;
        this.riskParser = riskParser;
        this.formatter = formatter;
        this.inserter = inserter;
    }

    /**
     * @return the number of paragraphs the token now occupies, including the original one
     */
    public int expand(XWPFParagraph paragraph, StructuredToken token, String value) {
        clearRuns(paragraph);
        int produced = switch (token) {
            case SPONSOR_BACKGROUND -> writeSponsorBlock(paragraph, sponsorParser.parse(value));
            case RISKS_AND_MITIGANTS -> writeRiskBlocks(paragraph, riskParser.parse(value));
        };
        log.debugf("Expanded %s into %d paragraphs", token, produced);
        return produced;
    }

    private int writeSponsorBlock(XWPFParagraph first, List<SponsorLine> lines) {
        formatter.applySingleSpacing(first);
        XWPFParagraph current = first;
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                current = inserter.insertAfter(current);
                formatter.applySingleSpacing(current);
            }
            SponsorLine line = lines.get(i);
            if (line.kind() != LineKind.BLANK) {
                XWPFRun run = current.createRun();
                RunText.write(run, line.text());
                formatter.styleRun(run, line.kind() == LineKind.HEADER);
            }
        }
        return Math.max(lines.size(), 1);
    }

    private int writeRiskBlocks(XWPFParagraph first, List<RiskBlock> blocks) {
        XWPFParagraph current = first;
        int produced = 1;
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                current = inserter.insertAfter(current);
                current = inserter.insertAfter(current);
                produced += 2;
            }
            writeRiskBlock(current, blocks.get(i));
        }
        return produced;
    }

    private void writeRiskBlock(XWPFParagraph paragraph, RiskBlock block) {
        if (block.isPlain()) {
            XWPFRun run = paragraph.createRun();
            RunText.write(run, block.plainText());
            formatter.styleRun(run, false);
            return;
        }
        XWPFRun name = paragraph.createRun();
        RunText.write(name, block.riskName());
        formatter.styleRun(name, true);

        XWPFRun tab = paragraph.createRun();
        tab.addTab();
        formatter.styleRun(tab, false);

        XWPFRun mitigant = paragraph.createRun();
        RunText.write(mitigant, block.mitigant());
        formatter.styleRun(mitigant, false);

        formatter.applyHangingIndent(paragraph);
    }

    private static void clearRuns(XWPFParagraph paragraph) {
        for (int i = paragraph.getRuns().size() - 1; i >= 0; i--) {
            paragraph.removeRun(i);
        }
    }
}
