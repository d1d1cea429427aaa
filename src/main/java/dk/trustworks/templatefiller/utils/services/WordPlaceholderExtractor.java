package dk.trustworks.templatefiller.utils.services;

import dk.trustworks.templatefiller.exceptions.InvalidTemplateException;
import dk.trustworks.templatefiller.utils.word.DocumentTreeWalker;
import dk.trustworks.templatefiller.utils.word.PlaceholderScanner;
import dk.trustworks.templatefiller.utils.word.RunTextIndex;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Lists the placeholders a Word template (.docx) contains.
 *
 * <p>Placeholders use the syntax {{PLACEHOLDER_KEY}}:
 * <ul>
 *   <li>Double curly braces as delimiters</li>
 *   <li>Uppercase letters, numbers, and underscores only</li>
 *   <li>Case-sensitive matching</li>
 * </ul>
 *
 * <p>Every paragraph the filler visits is scanned (body, tables including nested ones,
 * headers and footers), and a placeholder split across runs is found like any other.
 */
@JBossLog
@ApplicationScoped
public class WordPlaceholderExtractor {

    private final DocumentTreeWalker walker = new DocumentTreeWalker();

    /**
     * Extracts all unique placeholders from a Word document.
     *
     * @param docxBytes The Word document as byte array
     * @return placeholder keys in order of first appearance (without curly braces)
     * @throws InvalidTemplateException if the bytes are not a readable .docx document
     */
    public Set<String> extractPlaceholders(byte[] docxBytes) {
        if (docxBytes == null || docxBytes.length == 0) {
            log.debug("Empty document bytes provided, returning empty set");
            return Set.of();
        }

        Set<String> placeholders = new LinkedHashSet<>();

        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(docxBytes))) {
            walker.walk(document, paragraph -> {
                Matcher matcher = PlaceholderScanner.PLACEHOLDER_PATTERN.matcher(RunTextIndex.build(paragraph).text());
                while (matcher.find()) {
                    if (placeholders.add(matcher.group(1))) {
                        log.debugf("Found placeholder: %s", matcher.group(1));
                    }
                }
            });
            log.infof("Extracted %d placeholders from Word document", placeholders.size());
        } catch (UnsupportedFileFormatException | POIXMLException e) {
            throw new InvalidTemplateException("Template is not a valid .docx document: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidTemplateException("Failed to read template: " + e.getMessage(), e);
        }

        return Collections.unmodifiableSet(placeholders);
    }

    /**
     * Validates if a string is a valid placeholder name.
     *
     * @param name The placeholder name to validate
     * @return true if the name is valid (uppercase, alphanumeric with underscores)
     */
    public boolean isValidPlaceholderName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        return name.matches("[A-Z0-9_]+");
    }
}
