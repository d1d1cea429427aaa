package dk.trustworks.templatefiller.utils.word;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layout constants shared by every fill: body font, image content box and per-token
 * image widths, and the hanging indent used for risk paragraphs.
 *
 * @param fontFamily          canonical body font applied to injected text
 * @param fontSize            canonical body font size in points
 * @param maxWidthInches      width of the page content box
 * @param maxHeightInches     height of the page content box
 * @param defaultWidthInches  preferred width for image tokens without an entry in {@code imageWidths}
 * @param fallbackHeightInches height used when an image's dimensions cannot be read
 * @param imageWidths         preferred width in inches per image token name
 * @param hangingIndentTwips  left and hanging indent of risk paragraphs
 */
public record TemplateLayout(
        String fontFamily,
        int fontSize,
        double maxWidthInches,
        double maxHeightInches,
        double defaultWidthInches,
        double fallbackHeightInches,
        Map<String, Double> imageWidths,
        int hangingIndentTwips
) {

    public TemplateLayout {
        imageWidths = Map.copyOf(imageWidths);
    }

    public static Map<String, Double> defaultImageWidths() {
        Map<String, Double> widths = new LinkedHashMap<>();
        widths.put("IMAGE_SOURCES_USES", 6.5);
        widths.put("IMAGE_CAPITAL_STACK_CLOSING", 6.5);
        widths.put("IMAGE_LOAN_TO_COST", 6.0);
        widths.put("IMAGE_LTV_LTC", 6.0);
        widths.put("IMAGE_AERIAL_MAP", 5.0);
        widths.put("IMAGE_LOCATION_MAP", 5.0);
        widths.put("IMAGE_REGIONAL_MAP", 5.0);
        widths.put("IMAGE_SITE_PLAN", 5.5);
        widths.put("IMAGE_PILOT_SCHEDULE", 6.0);
        widths.put("IMAGE_TAKEOUT_SIZING", 6.0);
        return widths;
    }

    public static TemplateLayout defaults() {
        return new TemplateLayout("Calibri", 11, 6.5, 9.0, 6.0, 4.0, defaultImageWidths(), 2160);
    }

    public static TemplateLayout from(TemplateFillerConfig config) {
        Map<String, Double> widths = new LinkedHashMap<>(defaultImageWidths());
        widths.putAll(config.image().widths());
        return new TemplateLayout(
                config.font().family(),
                config.font().size(),
                config.image().maxWidth(),
                config.image().maxHeight(),
                config.image().defaultWidth(),
                config.image().fallbackHeight(),
                widths,
                config.risk().hangingIndentTwips());
    }

    /** Preferred width for an image token, falling back to {@link #defaultWidthInches()}. */
    public double widthFor(String token) {
        return imageWidths.getOrDefault(token, defaultWidthInches);
    }
}
