package dk.trustworks.templatefiller.utils.services;

import dk.trustworks.templatefiller.exceptions.InvalidTemplateException;
import dk.trustworks.templatefiller.utils.word.BoxFitScaler;
import dk.trustworks.templatefiller.utils.word.DocumentTreeWalker;
import dk.trustworks.templatefiller.utils.word.FillContext;
import dk.trustworks.templatefiller.utils.word.FillReport;
import dk.trustworks.templatefiller.utils.word.FillResult;
import dk.trustworks.templatefiller.utils.word.ImageDecoder;
import dk.trustworks.templatefiller.utils.word.ImagePlaceholderWriter;
import dk.trustworks.templatefiller.utils.word.ParagraphFiller;
import dk.trustworks.templatefiller.utils.word.ParagraphInserter;
import dk.trustworks.templatefiller.utils.word.PlaceholderScanner;
import dk.trustworks.templatefiller.utils.word.RiskBlockParser;
import dk.trustworks.templatefiller.utils.word.RunFormatter;
import dk.trustworks.templatefiller.utils.word.RunSplicer;
import dk.trustworks.templatefiller.utils.word.SponsorBlockParser;
import dk.trustworks.templatefiller.utils.word.StructuredSectionExpander;
import dk.trustworks.templatefiller.utils.word.TemplateFillerConfig;
import dk.trustworks.templatefiller.utils.word.TemplateLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;

/**
 * Fills a .docx template in memory.
 *
 * <p>Placeholders use the syntax {{PLACEHOLDER_KEY}} and may be split across any number of
 * runs. For every paragraph of the document (body, tables, headers and footers):
 * <ol>
 *   <li>a structured placeholder ({{SPONSOR_BACKGROUND}}, {{RISKS_AND_MITIGANTS}}) expands
 *       into formatted paragraphs</li>
 *   <li>value placeholders are replaced with their text, keeping the surrounding runs'
 *       formatting</li>
 *   <li>{{IMAGE_*}} placeholders are replaced with inline pictures sized to the page</li>
 * </ol>
 * Placeholders without a value are left as they are.
 *
 * <p>The bean holds no per-fill state and can be used concurrently.
 */
@JBossLog
@ApplicationScoped
public class WordTemplateFiller {

    private final DocumentTreeWalker walker = new DocumentTreeWalker();
    private final ImageDecoder imageDecoder = new ImageDecoder();
    private final ParagraphFiller paragraphFiller;
    private final ImagePlaceholderWriter imageWriter;

    @Inject
    public WordTemplateFiller(TemplateFillerConfig config) {
        this(TemplateLayout.from(config));
    }

    WordTemplateFiller(TemplateLayout layout) {
        PlaceholderScanner scanner = new PlaceholderScanner();
        RunSplicer splicer = new RunSplicer();
        RunFormatter formatter = new RunFormatter(layout);
        StructuredSectionExpander expander = new StructuredSectionExpander(
                new SponsorBlockParser(), new RiskBlockParser(), formatter, new ParagraphInserter());
        this.paragraphFiller = new ParagraphFiller(scanner, splicer, formatter, expander);
        this.imageWriter = new ImagePlaceholderWriter(scanner, splicer, new BoxFitScaler(layout), layout);
    }

    /**
     * Fills the template with the given values and images.
     *
     * @param templateBytes the .docx template
     * @param values        placeholder name to replacement text
     * @param images        {@code IMAGE_*} placeholder name to base64 image data
     * @return the filled document and a report of what was replaced
     * @throws InvalidTemplateException if the bytes are not a readable .docx document
     */
    public FillResult fillDocument(byte[] templateBytes, Map<String, String> values, Map<String, String> images) {
        if (templateBytes == null || templateBytes.length == 0) {
            throw new InvalidTemplateException("Template content is empty");
        }
        FillContext context = new FillContext(values, images, imageDecoder);

        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(templateBytes));
             ByteArrayOutputStream out = new ByteArrayOutputStream(templateBytes.length)) {

            walker.walk(document, paragraph -> {
                paragraphFiller.fill(paragraph, context);
                imageWriter.fill(paragraph, context);
            });

            document.write(out);
            FillReport report = context.report();
            log.infof("Filled template: %d values, %d images, %d sections, %d unresolved, %d image failures",
                    report.valuesReplaced(), report.imagesInserted(), report.sectionsExpanded(),
                    report.unresolved().size(), report.imageFailures().size());
            if (!report.unresolved().isEmpty()) {
                log.debugf("Unresolved placeholders: %s", report.unresolved());
            }
            return new FillResult(out.toByteArray(), report);

        } catch (UnsupportedFileFormatException | POIXMLException e) {
            throw new InvalidTemplateException("Template is not a valid .docx document: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidTemplateException("Failed to read template: " + e.getMessage(), e);
        }
    }
}
