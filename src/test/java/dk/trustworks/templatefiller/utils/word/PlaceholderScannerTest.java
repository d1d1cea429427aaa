package dk.trustworks.templatefiller.utils.word;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlaceholderScanner")
class PlaceholderScannerTest {

    private final PlaceholderScanner scanner = new PlaceholderScanner();

    @Test
    @DisplayName("Matches are classified by precedence and returned in text order")
    void scan_classifiesEveryKind() {
        // Given
        String text = "{{DEAL}} {{IMAGE_SITE_PLAN}} {{SPONSOR_BACKGROUND}} {{MISSING}}";
        Map<String, String> values = Map.of("DEAL", "Harbor Point", "SPONSOR_BACKGROUND", "Sponsor");
        Map<String, String> images = Map.of("IMAGE_SITE_PLAN", "iVBORw0KGgo=");

        // When
        List<PlaceholderMatch> matches = scanner.scan(text, values, images);

        // Then
        assertEquals(4, matches.size());
        assertEquals(new PlaceholderMatch("DEAL", 0, 8, PlaceholderKind.VALUE), matches.get(0));
        assertEquals(PlaceholderKind.IMAGE, matches.get(1).kind());
        assertEquals(PlaceholderKind.STRUCTURED, matches.get(2).kind());
        assertEquals(PlaceholderKind.UNRESOLVED, matches.get(3).kind());
        assertTrue(matches.get(1).start() < matches.get(2).start());
    }

    @Test
    @DisplayName("Structured name without a value → UNRESOLVED")
    void classify_structuredWithoutValue_unresolved() {
        assertEquals(PlaceholderKind.UNRESOLVED,
                scanner.classify("RISKS_AND_MITIGANTS", Map.of(), Map.of()));
    }

    @Test
    @DisplayName("IMAGE_ name only in the value map → VALUE")
    void classify_imageNameInValues_value() {
        assertEquals(PlaceholderKind.VALUE,
                scanner.classify("IMAGE_SITE_PLAN", Map.of("IMAGE_SITE_PLAN", "n/a"), Map.of()));
    }

    @Test
    @DisplayName("Lowercase or malformed tokens are not placeholders")
    void scan_malformedTokens_ignored() {
        assertTrue(scanner.scan("{{name}} {NAME} {{ NAME }} {{}}", Map.of(), Map.of()).isEmpty());
    }

    @Test
    @DisplayName("Null or empty text → no matches")
    void scan_emptyText_noMatches() {
        assertTrue(scanner.scan(null, Map.of(), Map.of()).isEmpty());
        assertTrue(scanner.scan("", Map.of(), Map.of()).isEmpty());
    }
}
