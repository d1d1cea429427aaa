package dk.trustworks.templatefiller.utils.word;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Configuration for template filling.
 *
 * <p>Example configuration in application.properties:
 * <pre>
 * template-filler.default-template-key=_Templates/IDS_Template_Fairbridge.docx
 * template-filler.image.max-width=6.5
 * template-filler.image.widths.IMAGE_SITE_PLAN=5.5
 * template-filler.font.family=Calibri
 * template-filler.risk.hanging-indent-twips=2160
 * </pre>
 */
@ConfigMapping(prefix = "template-filler")
public interface TemplateFillerConfig {

    /**
     * Template used when a request does not name one.
     */
    @WithDefault("_Templates/IDS_Template_Fairbridge.docx")
    String defaultTemplateKey();

    /**
     * Download filename used by /fill when a request does not name one.
     */
    @WithDefault("IDS_Generated.docx")
    String defaultOutputFilename();

    OutputKey outputKey();

    Image image();

    Font font();

    Risk risk();

    interface OutputKey {

        /**
         * How many numbered suffixes (_2, _3, ...) are probed before a timestamp suffix is used.
         */
        @WithDefault("50")
        int maxAttempts();
    }

    interface Image {

        /**
         * Page content box width in inches.
         */
        @WithDefault("6.5")
        double maxWidth();

        /**
         * Page content box height in inches.
         */
        @WithDefault("9.0")
        double maxHeight();

        /**
         * Preferred width for image tokens not listed in {@link #widths()}.
         */
        @WithDefault("6.0")
        double defaultWidth();

        /**
         * Height used when an image's own dimensions cannot be read.
         */
        @WithDefault("4.0")
        double fallbackHeight();

        /**
         * Preferred width in inches per image token name.
         */
        Map<String, Double> widths();
    }

    interface Font {

        @WithDefault("Calibri")
        String family();

        @WithDefault("11")
        int size();
    }

    interface Risk {

        @WithDefault("2160")
        int hangingIndentTwips();
    }
}
