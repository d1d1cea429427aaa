package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static dk.trustworks.templatefiller.documentservice.utils.TestDocuments.paragraph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DocumentTreeWalker")
class DocumentTreeWalkerTest {

    private final DocumentTreeWalker walker = new DocumentTreeWalker();

    @Test
    @DisplayName("Body, then tables with nested tables, then headers, then footers")
    void walk_visitsInDocumentOrder() {
        // Given
        XWPFDocument document = new XWPFDocument();
        paragraph(document.createFooter(HeaderFooterType.DEFAULT), "footer");
        paragraph(document.createHeader(HeaderFooterType.DEFAULT), "header");
        XWPFTable table = document.createTable(1, 2);
        XWPFTableCell first = table.getRow(0).getCell(0);
        paragraph(first, "cell 1");
        XWPFTable nested = new XWPFTable(first.getCTTc().addNewTbl(), first, 1, 1);
        first.insertTable(first.getTables().size(), nested);
        paragraph(nested.getRow(0).getCell(0), "nested");
        paragraph(table.getRow(0).getCell(1), "cell 2");
        paragraph(document, "body 1");
        paragraph(document, "body 2");

        // When
        List<String> visited = visitedTexts(document);

        // Then
        assertEquals(List.of("body 1", "body 2", "cell 1", "nested", "cell 2", "header", "footer"), visited);
    }

    @Test
    @DisplayName("Header variants: default before first page before even page")
    void walk_headerVariantsInFixedOrder() {
        // Given
        XWPFDocument document = new XWPFDocument();
        paragraph(document.createHeader(HeaderFooterType.EVEN), "even");
        paragraph(document.createHeader(HeaderFooterType.FIRST), "first");
        paragraph(document.createHeader(HeaderFooterType.DEFAULT), "default");

        // When
        List<String> visited = visitedTexts(document);

        // Then
        assertEquals(List.of("default", "first", "even"), visited);
    }

    @Test
    @DisplayName("Paragraphs inserted while walking are not visited")
    void walk_insertedParagraphs_notVisited() {
        // Given
        XWPFDocument document = new XWPFDocument();
        paragraph(document, "one");
        paragraph(document, "two");
        ParagraphInserter inserter = new ParagraphInserter();
        List<XWPFParagraph> visited = new ArrayList<>();

        // When
        walker.walk(document, p -> {
            visited.add(p);
            inserter.insertAfter(p);
        });

        // Then
        assertEquals(2, visited.size());
        assertEquals(4, document.getParagraphs().size());
    }

    @Test
    @DisplayName("Every header and footer part is visited exactly once")
    void headerFootersInSectionOrder_noDuplicates() {
        // Given
        XWPFDocument document = new XWPFDocument();
        document.createHeader(HeaderFooterType.DEFAULT);
        document.createFooter(HeaderFooterType.DEFAULT);
        document.createFooter(HeaderFooterType.FIRST);

        // When / Then
        assertEquals(3, walker.headerFootersInSectionOrder(document).size());
    }

    private List<String> visitedTexts(XWPFDocument document) {
        List<String> texts = new ArrayList<>();
        walker.walk(document, p -> {
            String text = RunTextIndex.build(p).text();
            if (!text.isEmpty()) {
                texts.add(text);
            }
        });
        return texts;
    }
}
