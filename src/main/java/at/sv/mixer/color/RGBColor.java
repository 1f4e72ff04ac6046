package at.sv.mixer.color;

import java.util.Locale;

public record RGBColor(int r, int g, int b) {

    public RGBColor {
        assertChannel(r);
        assertChannel(g);
        assertChannel(b);
    }

    private static void assertChannel(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Invalid RGB channel value '" + value + "'. Allowed range: 0-255");
        }
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", r, g, b);
    }
}
