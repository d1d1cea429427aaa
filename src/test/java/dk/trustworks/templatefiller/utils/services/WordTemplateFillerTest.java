package dk.trustworks.templatefiller.utils.services;

import dk.trustworks.templatefiller.exceptions.InvalidTemplateException;
import dk.trustworks.templatefiller.utils.word.FillReport;
import dk.trustworks.templatefiller.utils.word.FillResult;
import dk.trustworks.templatefiller.utils.word.TemplateLayout;
import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.drawingml.x2006.wordprocessingDrawing.CTInline;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static dk.trustworks.templatefiller.documentservice.utils.AssertionHelpers.*;
import static dk.trustworks.templatefiller.documentservice.utils.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for WordTemplateFiller: template bytes in, document bytes out.
 */
@DisplayName("WordTemplateFiller")
class WordTemplateFillerTest {

    private final WordTemplateFiller filler = new WordTemplateFiller(TemplateLayout.defaults());

    // =========================================================================
    // VALUE PLACEHOLDERS
    // =========================================================================

    @Nested
    @DisplayName("Value placeholders")
    class ValueTests {

        @Test
        @DisplayName("Placeholders split across runs are replaced")
        void fillDocument_splitPlaceholders_replaced() {
            // Given
            byte[] template = docxWithParagraph("Loan: {{LOAN", "_AMOUNT}} closing {{DA", "TE}}");
            Map<String, String> values = Map.of("LOAN_AMOUNT", "$1,000,000", "DATE", "Jan 2025");

            // When
            FillResult result = filler.fillDocument(template, values, Map.of());

            // Then
            XWPFDocument filled = open(result.document());
            assertEquals(List.of("Loan: $1,000,000 closing Jan 2025"), paragraphTexts(filled));
            assertEquals(2, result.report().valuesReplaced());
            assertTrue(result.report().unresolved().isEmpty());
        }

        @Test
        @DisplayName("Runs receiving values get the body font and are not bold")
        void fillDocument_receivingRuns_formatted() {
            // Given
            XWPFDocument document = new XWPFDocument();
            XWPFParagraph p = paragraph(document, "Sponsor: ", "{{SPONSOR_NAME}}");
            p.getRuns().get(1).setBold(true);
            p.getRuns().get(1).setFontFamily("Arial");

            // When
            FillResult result = filler.fillDocument(toBytes(document), Map.of("SPONSOR_NAME", "Acme LLC"), Map.of());

            // Then
            XWPFParagraph filled = open(result.document()).getParagraphs().get(0);
            assertRunTexts(filled, "Sponsor: ", "Acme LLC");
            assertBodyFormatting(filled.getRuns().get(1), false);
        }

        @Test
        @DisplayName("Multi-line value → line breaks written as w:br")
        void fillDocument_multiLineValue_breaksWritten() {
            // Given
            byte[] template = docxWithParagraph("Address: {{ADDRESS}}");

            // When
            FillResult result = filler.fillDocument(template, Map.of("ADDRESS", "1 Main St\nNew York, NY 10001"), Map.of());

            // Then
            XWPFRun run = open(result.document()).getParagraphs().get(0).getRuns().get(0);
            assertEquals(1, run.getCTR().sizeOfBrArray());
            assertEquals("Address: 1 Main St\nNew York, NY 10001", run.text());
        }

        @Test
        @DisplayName("Tab before the placeholder in the same run stays in front of the value")
        void fillDocument_tabInTemplateRun_layoutKept() {
            // Given
            XWPFDocument document = new XWPFDocument();
            XWPFRun run = document.createParagraph().createRun();
            run.setText("Borrower:");
            run.addTab();
            run.setText("{{BORROWER}}");

            // When
            FillResult result = filler.fillDocument(toBytes(document), Map.of("BORROWER", "Acme LLC"), Map.of());

            // Then
            XWPFRun filled = open(result.document()).getParagraphs().get(0).getRuns().get(0);
            assertEquals("Borrower:\tAcme LLC", filled.text());
        }

        @Test
        @DisplayName("Null value → placeholder removed")
        void fillDocument_nullValue_empty() {
            Map<String, String> values = new HashMap<>();
            values.put("NOTE", null);

            FillResult result = filler.fillDocument(docxWithParagraph("[{{NOTE}}]"), values, Map.of());

            assertEquals(List.of("[]"), paragraphTexts(open(result.document())));
        }

        @Test
        @DisplayName("Values in headers, footers and table cells are replaced")
        void fillDocument_headersFootersTables_replaced() {
            // Given
            XWPFDocument document = new XWPFDocument();
            paragraph(document.createHeader(HeaderFooterType.DEFAULT), "Deal: {{DEAL_", "NAME}}");
            paragraph(document.createFooter(HeaderFooterType.DEFAULT), "{{DEAL_NAME}} confidential");
            XWPFTable table = document.createTable(1, 1);
            paragraph(table.getRow(0).getCell(0), "{{LOAN_AMOUNT}}");

            // When
            FillResult result = filler.fillDocument(toBytes(document),
                    Map.of("DEAL_NAME", "Harbor Point", "LOAN_AMOUNT", "$5,000,000"), Map.of());

            // Then
            XWPFDocument filled = open(result.document());
            assertTrue(paragraphTexts(filled.getHeaderList().get(0)).contains("Deal: Harbor Point"));
            assertTrue(paragraphTexts(filled.getFooterList().get(0)).contains("Harbor Point confidential"));
            assertEquals("$5,000,000", filled.getTables().get(0).getRow(0).getCell(0).getText());
            assertEquals(3, result.report().valuesReplaced());
        }
    }

    // =========================================================================
    // UNRESOLVED PLACEHOLDERS
    // =========================================================================

    @Nested
    @DisplayName("Unresolved placeholders")
    class UnresolvedTests {

        @Test
        @DisplayName("Empty maps leave the text unchanged")
        void fillDocument_emptyMaps_textUnchanged() {
            // Given
            byte[] template = docxWithParagraph("Dear {{NA", "ME}}, see {{MISSING}} and {{IMAGE_SITE_PLAN}}");

            // When
            FillResult result = filler.fillDocument(template, Map.of(), Map.of());

            // Then
            assertEquals(List.of("Dear {{NAME}}, see {{MISSING}} and {{IMAGE_SITE_PLAN}}"),
                    paragraphTexts(open(result.document())));
            assertEquals(List.of("NAME", "MISSING", "IMAGE_SITE_PLAN"), List.copyOf(result.report().unresolved()));
        }

        @Test
        @DisplayName("Partial fill keeps the placeholders without a value")
        void fillDocument_partialValues_keepsRest() {
            FillResult result = filler.fillDocument(docxWithParagraph("{{A}}-{{B}}"), Map.of("A", "1"), Map.of());

            assertEquals(List.of("1-{{B}}"), paragraphTexts(open(result.document())));
            assertEquals(List.of("B"), List.copyOf(result.report().unresolved()));
        }
    }

    // =========================================================================
    // STRUCTURED PLACEHOLDERS
    // =========================================================================

    @Nested
    @DisplayName("Structured placeholders")
    class StructuredTests {

        @Test
        @DisplayName("Risks expand into two risk paragraphs and one spacer")
        void fillDocument_risks_expanded() {
            // Given
            byte[] template = docxWithParagraph("{{RISKS_AND_MITIGANTS}}");
            String risks = "Market Risk\tRates may rise.\n\nConstruction Risk\tDelays possible.";

            // When
            FillResult result = filler.fillDocument(template, Map.of("RISKS_AND_MITIGANTS", risks), Map.of());

            // Then
            XWPFDocument filled = open(result.document());
            List<XWPFParagraph> paragraphs = filled.getParagraphs();
            assertEquals(3, paragraphs.size());
            assertRunTexts(paragraphs.get(0), "Market Risk", "", "Rates may rise.");
            assertTrue(paragraphs.get(1).getRuns().isEmpty());
            assertRunTexts(paragraphs.get(2), "Construction Risk", "", "Delays possible.");
            assertTrue(paragraphs.get(2).getRuns().get(0).isBold());
            assertFalse(paragraphs.get(2).getRuns().get(2).isBold());
            assertEquals(1, result.report().sectionsExpanded());
        }

        @Test
        @DisplayName("Sponsor background inside a table cell expands in the cell")
        void fillDocument_sponsorInCell_expanded() {
            // Given
            XWPFDocument document = new XWPFDocument();
            paragraph(document, "Intro {{DEAL_NAME}}");
            XWPFTable table = document.createTable(1, 1);
            paragraph(table.getRow(0).getCell(0), "{{SPONSOR_", "BACKGROUND}}");

            // When
            FillResult result = filler.fillDocument(toBytes(document),
                    Map.of("DEAL_NAME", "Harbor Point", "SPONSOR_BACKGROUND", "Overview\nthe sponsor is a family office"),
                    Map.of());

            // Then
            XWPFDocument filled = open(result.document());
            assertEquals(List.of("Intro Harbor Point"), paragraphTexts(filled));
            assertEquals(List.of("Overview", "the sponsor is a family office"),
                    paragraphTexts(filled.getTables().get(0).getRow(0).getCell(0)));
        }

        @Test
        @DisplayName("Structured placeholder without a value stays verbatim")
        void fillDocument_structuredWithoutValue_unresolved() {
            FillResult result = filler.fillDocument(docxWithParagraph("{{SPONSOR_BACKGROUND}}"), Map.of(), Map.of());

            assertEquals(List.of("{{SPONSOR_BACKGROUND}}"), paragraphTexts(open(result.document())));
            assertTrue(result.report().unresolved().contains("SPONSOR_BACKGROUND"));
        }
    }

    // =========================================================================
    // IMAGE PLACEHOLDERS
    // =========================================================================

    @Nested
    @DisplayName("Image placeholders")
    class ImageTests {

        @Test
        @DisplayName("Image is inserted at the placeholder with its preferred width")
        void fillDocument_image_insertedInPlace() {
            // Given
            byte[] template = docxWithParagraph("Before {{IMAGE_SITE", "_PLAN}} after");

            // When
            FillResult result = filler.fillDocument(template, Map.of(),
                    Map.of("IMAGE_SITE_PLAN", pngBase64(200, 100)));

            // Then
            XWPFDocument filled = open(result.document());
            XWPFParagraph p = filled.getParagraphs().get(0);
            assertEquals("Before  after", String.join("", runTexts(p)));
            assertNoPlaceholders(p.getText());
            assertEquals(1, filled.getAllPictures().size());

            XWPFRun pictureRun = p.getRuns().get(0);
            assertEquals("Before ", runTexts(p).get(0));
            assertEquals(1, pictureRun.getEmbeddedPictures().size());
            CTInline inline = pictureRun.getCTR().getDrawingArray(0).getInlineArray(0);
            assertEquals(5029200L, inline.getExtent().getCx());
            assertEquals(2514600L, inline.getExtent().getCy());
            assertEquals(1, result.report().imagesInserted());
        }

        @Test
        @DisplayName("Text after the placeholder in the same run follows the picture")
        void fillDocument_imageWithTail_tailMovedAfterPicture() {
            // Given
            XWPFDocument document = new XWPFDocument();
            XWPFParagraph p = paragraph(document, "A {{IMAGE_AERIAL_MAP}} B");
            p.getRuns().get(0).setItalic(true);

            // When
            FillResult result = filler.fillDocument(toBytes(document), Map.of(),
                    Map.of("IMAGE_AERIAL_MAP", pngBase64(50, 50)));

            // Then
            XWPFParagraph filled = open(result.document()).getParagraphs().get(0);
            assertRunTexts(filled, "A ", " B");
            assertEquals(1, filled.getRuns().get(0).getEmbeddedPictures().size());
            assertTrue(filled.getRuns().get(1).isItalic(), "Tail run keeps the run properties");
        }

        @Test
        @DisplayName("Tab and text after the placeholder follow the picture")
        void fillDocument_imageFollowedByTab_tabMovedAfterPicture() {
            // Given
            XWPFDocument document = new XWPFDocument();
            XWPFRun run = document.createParagraph().createRun();
            run.setText("{{IMAGE_SITE_PLAN}}");
            run.addTab();
            run.setText("Source: county GIS");

            // When
            FillResult result = filler.fillDocument(toBytes(document), Map.of(),
                    Map.of("IMAGE_SITE_PLAN", pngBase64(40, 20)));

            // Then
            XWPFParagraph filled = open(result.document()).getParagraphs().get(0);
            assertEquals(2, filled.getRuns().size());
            assertEquals(1, filled.getRuns().get(0).getEmbeddedPictures().size());
            assertEquals(0, filled.getRuns().get(0).getCTR().sizeOfTabArray());
            assertEquals("\tSource: county GIS", filled.getRuns().get(1).text());
        }

        @Test
        @DisplayName("Undecodable image is reported and its placeholder kept, other images still inserted")
        void fillDocument_badImage_reported() {
            // Given
            XWPFDocument document = new XWPFDocument();
            paragraph(document, "{{IMAGE_LTV_LTC}}");
            paragraph(document, "{{IMAGE_SITE_PLAN}}");

            // When
            FillResult result = filler.fillDocument(toBytes(document), Map.of(),
                    Map.of("IMAGE_LTV_LTC", textBase64(), "IMAGE_SITE_PLAN", pngBase64(10, 10)));

            // Then
            FillReport report = result.report();
            assertTrue(report.hasImageFailures());
            assertEquals("IMAGE_LTV_LTC", report.imageFailures().get(0).token());
            assertEquals(1, report.imagesInserted());
            assertEquals(List.of("{{IMAGE_LTV_LTC}}", ""), paragraphTexts(open(result.document())));
        }
    }

    @Test
    @DisplayName("Bytes that are not a .docx → InvalidTemplateException")
    void fillDocument_invalidTemplate_throws() {
        InvalidTemplateException exception = assertThrows(InvalidTemplateException.class,
                () -> filler.fillDocument(invalidFileBytes(), Map.of(), Map.of()));
        assertEquals(422, exception.getStatus());

        assertThrows(InvalidTemplateException.class, () -> filler.fillDocument(new byte[0], Map.of(), Map.of()));
    }
}
