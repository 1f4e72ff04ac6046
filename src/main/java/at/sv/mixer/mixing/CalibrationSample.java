package at.sv.mixer.mixing;

import at.sv.mixer.color.ColorTriple;

import java.util.List;

/**
 * A known mixing outcome: the given colors mixed at the given ratios are expected to produce {@code expected}.
 */
public record CalibrationSample(String name, List<ColorTriple> colors, double[] ratios, ColorTriple expected,
                                double weight) {

    public CalibrationSample {
        if (colors.size() != ratios.length) {
            throw new IllegalArgumentException("Calibration sample '" + name + "' has " + colors.size() +
                                               " colors but " + ratios.length + " ratios");
        }
        colors = List.copyOf(colors);
        ratios = ratios.clone();
    }
}
