package at.sv.mixer.color;

import java.util.Locale;

/**
 * A color in CIE Lab coordinates. L is in [0, 100], a and b are unbounded.
 */
public record ColorTriple(double L, double a, double b) {

    /**
     * Returned by mixing when there is nothing to mix.
     */
    public static final ColorTriple NEUTRAL_GRAY = new ColorTriple(50, 0, 0);

    public static ColorTriple of(double L, double a, double b) {
        return new ColorTriple(L, a, b);
    }

    public double chroma() {
        return Math.hypot(a, b);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Lab(%.1f, %.1f, %.1f)", L, a, b);
    }
}
