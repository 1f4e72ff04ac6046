package at.sv.mixer.color;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses a target color given on the command line.
 * Supported inputs: "#808080", "808080", "#888", "rgb(128, 128, 128)", "lab(53.6 0 0)", "lab(53.6, 0, 0)".
 */
public final class TargetColorParser {

    private static final Pattern HEX_PATTERN = Pattern.compile("^#?([0-9a-fA-F]{6}|[0-9a-fA-F]{3})$");

    private TargetColorParser() {
    }

    /**
     * @param input the input string
     * @return the parsed color in Lab
     * @throws IllegalArgumentException if the input is not a supported color literal
     */
    public static ColorTriple parse(String input) {
        String s = input.trim();
        if (HEX_PATTERN.matcher(s).matches()) {
            return LabConverter.rgbToLab(parseHex(s));
        }
        if (hasFunctionPrefix(s, "rgb(")) {
            double[] parts = parseArguments(functionBody(s, "rgb("), "rgb(r g b)");
            return LabConverter.rgbToLab(new RGBColor(toChannel(parts[0]), toChannel(parts[1]), toChannel(parts[2])));
        }
        if (hasFunctionPrefix(s, "lab(")) {
            double[] parts = parseArguments(functionBody(s, "lab("), "lab(L a b)");
            return new ColorTriple(assertValidLightness(parts[0]), parts[1], parts[2]);
        }
        throw new IllegalArgumentException("Invalid color '" + input + "'. Expected: #RRGGBB, rgb(r g b) or lab(L a b)");
    }

    public static boolean isColorLiteral(String input) {
        String s = input.trim();
        return HEX_PATTERN.matcher(s).matches() || hasFunctionPrefix(s, "rgb(") || hasFunctionPrefix(s, "lab(");
    }

    public static RGBColor parseHex(String input) {
        String hex = input.trim();
        if (!HEX_PATTERN.matcher(hex).matches()) {
            throw new IllegalArgumentException("Invalid hex color '" + input + "'. Expected: #RRGGBB");
        }
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if (hex.length() == 3) {
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        return new RGBColor(Integer.parseInt(hex.substring(0, 2), 16),
                Integer.parseInt(hex.substring(2, 4), 16),
                Integer.parseInt(hex.substring(4, 6), 16));
    }

    private static boolean hasFunctionPrefix(String s, String prefix) {
        return s.regionMatches(true, 0, prefix, 0, prefix.length()) && s.endsWith(")");
    }

    private static String functionBody(String s, String prefix) {
        return s.substring(prefix.length(), s.length() - 1).trim();
    }

    private static double[] parseArguments(String body, String expected) {
        String[] parts = body.replace(',', ' ').trim().split("\\s+");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid color arguments '" + body + "'. Expected: " + expected);
        }
        double[] values = new double[3];
        for (int i = 0; i < 3; i++) {
            values[i] = parseNumber(parts[i]);
        }
        return values;
    }

    private static double parseNumber(String token) {
        try {
            return Double.parseDouble(token.toLowerCase(Locale.ROOT));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number '" + token + "'", e);
        }
    }

    private static int toChannel(double value) {
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException("Invalid RGB channel value '" + value + "'. Expected an integer 0-255");
        }
        return (int) value;
    }

    private static double assertValidLightness(double L) {
        if (L < 0 || L > 100) {
            throw new IllegalArgumentException("Invalid lightness value '" + L + "'. Allowed range: 0-100");
        }
        return L;
    }
}
