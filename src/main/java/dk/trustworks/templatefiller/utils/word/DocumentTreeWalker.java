package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.ooxml.POIXMLDocumentPart;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTHdrFtrRef;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STHdrFtr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Visits every paragraph of a document that can hold a placeholder.
 *
 * <p>Order: body paragraphs, body tables (row by row, cell by cell, each cell's paragraphs
 * before its nested tables), then the header variants (default, first page, even page) and
 * footer variants of each section in document order. Header and footer parts no section
 * refers to are visited last. No part is visited twice.
 *
 * <p>Every paragraph list is copied before iteration, so paragraphs the visitor inserts
 * are not visited.
 */
public class DocumentTreeWalker {

    private static final List<STHdrFtr.Enum> VARIANT_ORDER = List.of(STHdrFtr.DEFAULT, STHdrFtr.FIRST, STHdrFtr.EVEN);

    public void walk(XWPFDocument document, Consumer<XWPFParagraph> visitor) {
        List<XWPFHeaderFooter> headerFooters = headerFootersInSectionOrder(document);

        visitParagraphs(document.getParagraphs(), visitor);
        visitTables(document.getTables(), visitor);

        for (XWPFHeaderFooter headerFooter : headerFooters) {
            visitParagraphs(headerFooter.getParagraphs(), visitor);
            visitTables(headerFooter.getTables(), visitor);
        }
    }

    /**
     * Header and footer parts in visiting order, each part once.
     */
    List<XWPFHeaderFooter> headerFootersInSectionOrder(XWPFDocument document) {
        Set<XWPFHeaderFooter> ordered = Collections.newSetFromMap(new IdentityHashMap<>());
        List<XWPFHeaderFooter> result = new ArrayList<>();

        for (CTSectPr section : sections(document)) {
            for (XWPFHeaderFooter part : variants(document, Arrays.asList(section.getHeaderReferenceArray()))) {
                if (ordered.add(part)) {
                    result.add(part);
                }
            }
            for (XWPFHeaderFooter part : variants(document, Arrays.asList(section.getFooterReferenceArray()))) {
                if (ordered.add(part)) {
                    result.add(part);
                }
            }
        }

        List<XWPFHeaderFooter> unreferenced = new ArrayList<>();
        unreferenced.addAll(document.getHeaderList());
        unreferenced.addAll(document.getFooterList());
        for (XWPFHeaderFooter part : unreferenced) {
            if (ordered.add(part)) {
                result.add(part);
            }
        }
        return result;
    }

    private static List<CTSectPr> sections(XWPFDocument document) {
        List<CTSectPr> sections = new ArrayList<>();
        for (XWPFParagraph paragraph : document.getParagraphs()) {
            if (paragraph.getCTP().isSetPPr() && paragraph.getCTP().getPPr().isSetSectPr()) {
                sections.add(paragraph.getCTP().getPPr().getSectPr());
            }
        }
        if (document.getDocument().getBody().isSetSectPr()) {
            sections.add(document.getDocument().getBody().getSectPr());
        }
        return sections;
    }

    private static List<XWPFHeaderFooter> variants(XWPFDocument document, List<CTHdrFtrRef> references) {
        Map<STHdrFtr.Enum, XWPFHeaderFooter> byType = new LinkedHashMap<>();
        for (CTHdrFtrRef reference : references) {
            STHdrFtr.Enum type = reference.getType() != null ? reference.getType() : STHdrFtr.DEFAULT;
            POIXMLDocumentPart part = document.getRelationById(reference.getId());
            if (part instanceof XWPFHeader || part instanceof XWPFFooter) {
                byType.putIfAbsent(type, (XWPFHeaderFooter) part);
            }
        }
        List<XWPFHeaderFooter> parts = new ArrayList<>();
        for (STHdrFtr.Enum type : VARIANT_ORDER) {
            XWPFHeaderFooter part = byType.get(type);
            if (part != null) {
                parts.add(part);
            }
        }
        return parts;
    }

    private void visitParagraphs(List<XWPFParagraph> paragraphs, Consumer<XWPFParagraph> visitor) {
        for (XWPFParagraph paragraph : new ArrayList<>(paragraphs)) {
            visitor.accept(paragraph);
        }
    }

    private void visitTables(List<XWPFTable> tables, Consumer<XWPFParagraph> visitor) {
        for (XWPFTable table : new ArrayList<>(tables)) {
            for (XWPFTableRow row : table.getRows()) {
                for (XWPFTableCell cell : row.getTableCells()) {
                    visitParagraphs(cell.getParagraphs(), visitor);
                    visitTables(cell.getTables(), visitor);
                }
            }
        }
    }
}
