package at.sv.mixer;

import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * Formats a fraction in [0, 1] as percent with at most one decimal, e.g. 0.25 -> "25", 0.125 -> "12.5".
     */
    public static String formatPercent(double fraction) {
        double roundedOneDecimal = Math.round(fraction * 1000.0) / 10.0;
        if (Math.abs(roundedOneDecimal - Math.rint(roundedOneDecimal)) < 0.0001) {
            return String.valueOf((int) Math.rint(roundedOneDecimal));
        }
        return String.format(Locale.ROOT, "%.1f", roundedOneDecimal);
    }

    public static String formatGrams(double grams) {
        return String.format(Locale.ROOT, "%.1fg", grams);
    }

    public static String formatDeltaE(double deltaE) {
        return String.format(Locale.ROOT, "%.1f", deltaE);
    }
}
