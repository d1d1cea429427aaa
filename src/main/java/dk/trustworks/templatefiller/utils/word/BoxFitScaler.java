package dk.trustworks.templatefiller.utils.word;

import lombok.extern.jbosslog.JBossLog;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Sizes a picture to fit the page content box while keeping its aspect ratio.
 *
 * <p>Width first: {@code w = min(preferred, maxWidth)}, height from the aspect ratio. If the
 * height overflows, height is clamped and width recomputed from it; a width that still
 * overflows is clamped again and the height recomputed once more.
 *
 * <p>Never throws. Unreadable image data yields a {@link ImageBox.Outcome#FALLBACK} box of
 * {@code (min(preferred, maxWidth), min(fallbackHeight, maxHeight))}.
 */
@JBossLog
public class BoxFitScaler {

    private final double maxWidth;
    private final double maxHeight;
    private final double defaultWidth;
    private final double fallbackHeight;

    public BoxFitScaler(TemplateLayout layout) {
        this(layout.maxWidthInches(), layout.maxHeightInches(), layout.defaultWidthInches(), layout.fallbackHeightInches());
    }

    public BoxFitScaler(double maxWidth, double maxHeight, double defaultWidth, double fallbackHeight) {
        this.maxWidth = maxWidth;
        this.maxHeight = maxHeight;
        this.defaultWidth = defaultWidth;
        this.fallbackHeight = fallbackHeight;
    }

    public ImageBox fit(byte[] imageBytes, double preferredWidth) {
        BufferedImage image;
        try {
            image = imageBytes != null ? ImageIO.read(new ByteArrayInputStream(imageBytes)) : null;
        } catch (IOException | RuntimeException e) {
            log.warnf("Could not read image dimensions, using fallback box: %s", e.getMessage());
            return fallback(preferredWidth);
        }
        if (image == null) {
            log.debug("No image reader recognised the data, using fallback box");
            return fallback(preferredWidth);
        }
        return fit(image.getWidth(), image.getHeight(), preferredWidth);
    }

    public ImageBox fit(int intrinsicWidth, int intrinsicHeight, double preferredWidth) {
        if (intrinsicWidth <= 0 || intrinsicHeight <= 0) {
            return fallback(preferredWidth);
        }
        double aspect = (double) intrinsicHeight / intrinsicWidth;

        double width = Math.min(effectiveWidth(preferredWidth), maxWidth);
        double height = width * aspect;
        if (height > maxHeight) {
            height = maxHeight;
            width = height / aspect;
            if (width > maxWidth) {
                width = maxWidth;
                height = width * aspect;
            }
        }
        return new ImageBox(width, height, ImageBox.Outcome.FITTED);
    }

    private ImageBox fallback(double preferredWidth) {
        return new ImageBox(
                Math.min(effectiveWidth(preferredWidth), maxWidth),
                Math.min(fallbackHeight, maxHeight),
                ImageBox.Outcome.FALLBACK);
    }

    private double effectiveWidth(double preferredWidth) {
        return preferredWidth > 0 ? preferredWidth : defaultWidth;
    }
}
