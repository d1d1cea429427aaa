package dk.trustworks.templatefiller.utils.word;

import org.apache.poi.util.Units;

/**
 * Final size of an inserted picture.
 *
 * @param widthInches  width in inches
 * @param heightInches height in inches
 * @param outcome      {@link Outcome#FITTED} when computed from the image's own aspect ratio,
 *                     {@link Outcome#FALLBACK} when its dimensions could not be read
 */
public record ImageBox(double widthInches, double heightInches, Outcome outcome) {

    private static final double POINTS_PER_INCH = 72.0;

    public enum Outcome {
        FITTED,
        FALLBACK
    }

    public int widthEmu() {
        return Units.toEMU(widthInches * POINTS_PER_INCH);
    }

    public int heightEmu() {
        return Units.toEMU(heightInches * POINTS_PER_INCH);
    }

    public boolean isFallback() {
        return outcome == Outcome.FALLBACK;
    }
}
