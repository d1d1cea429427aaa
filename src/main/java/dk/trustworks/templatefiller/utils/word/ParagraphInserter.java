package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.xwpf.usermodel.IBody;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.xmlbeans.XmlCursor;

/**
 * Inserts a new paragraph directly after an existing one, in the same container
 * (document body, table cell, header or footer).
 */
public class ParagraphInserter {

    public XWPFParagraph insertAfter(XWPFParagraph anchor) {
        IBody body = anchor.getBody();
        XWPFParagraph created;
        XmlCursor cursor = anchor.getCTP().newCursor();
        try {
            created = cursor.toNextSibling() ? body.insertNewParagraph(cursor) : append(body);
        } finally {
            cursor.dispose();
        }
        if (created == null) {
            throw new IllegalStateException("Could not insert a paragraph into " + body.getPartType());
        }
        if (anchor.getStyle() != null) {
            created.setStyle(anchor.getStyle());
        }
        return created;
    }

    private XWPFParagraph append(IBody body) {
        if (body instanceof XWPFTableCell cell) {
            return cell.addParagraph();
        }
        if (body instanceof XWPFHeaderFooter headerFooter) {
            return headerFooter.createParagraph();
        }
        if (body instanceof XWPFDocument document) {
            return document.createParagraph();
        }
        return null;
    }
}
