package at.sv.mixer.mixing;

import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Finds the Kubelka-Munk gamma that best reproduces a set of known mixing outcomes.
 * Scans gamma over a fixed grid and picks the value with the lowest weighted mean DE76; ties keep the lower gamma.
 */
@Slf4j
public final class GammaCalibrator {

    public static final double DEFAULT_MIN_GAMMA = 0.5;
    public static final double DEFAULT_MAX_GAMMA = 3.0;
    public static final int DEFAULT_STEPS = 26;

    private static final ColorTriple WHITE = new ColorTriple(92.5, 0, 0);
    private static final ColorTriple BLACK = new ColorTriple(15.3, 0, 0);

    private final double minGamma;
    private final double maxGamma;
    private final int steps;

    public GammaCalibrator() {
        this(DEFAULT_MIN_GAMMA, DEFAULT_MAX_GAMMA, DEFAULT_STEPS);
    }

    public GammaCalibrator(double minGamma, double maxGamma, int steps) {
        if (!(minGamma > 0) || maxGamma < minGamma) {
            throw new IllegalArgumentException("Invalid gamma range [" + minGamma + ", " + maxGamma + "]");
        }
        if (steps < 2) {
            throw new IllegalArgumentException("Invalid step count '" + steps + "'. At least 2 steps are needed");
        }
        this.minGamma = minGamma;
        this.maxGamma = maxGamma;
        this.steps = steps;
    }

    /**
     * White and black gradations as observed when mixing hobby paints: black dominates the mixture.
     */
    public static List<CalibrationSample> whiteBlackGradations() {
        return List.of(
                gradation("white 95% + black 5%", 0.95, 75),
                gradation("white 90% + black 10%", 0.9, 65),
                gradation("white 80% + black 20%", 0.8, 55),
                gradation("white 50% + black 50%", 0.5, 40),
                gradation("white 20% + black 80%", 0.2, 25),
                gradation("white 10% + black 90%", 0.1, 20));
    }

    private static CalibrationSample gradation(String name, double white, double expectedL) {
        return new CalibrationSample(name, List.of(WHITE, BLACK), new double[]{white, 1 - white},
                new ColorTriple(expectedL, 0, 0), 1.0);
    }

    public Result calibrate(List<CalibrationSample> samples) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("At least one calibration sample is needed");
        }
        double bestGamma = minGamma;
        double bestError = Double.MAX_VALUE;
        for (int step = 0; step < steps; step++) {
            double gamma = minGamma + step * (maxGamma - minGamma) / (steps - 1);
            double error = meanError(new PigmentMixer(gamma), samples);
            log.debug("gamma={} mean error={}", gamma, error);
            if (error < bestError) {
                bestError = error;
                bestGamma = gamma;
            }
        }
        log.info("Calibrated gamma {} with mean error {} over {} samples", bestGamma, bestError, samples.size());
        return new Result(bestGamma, bestError);
    }

    public static double meanError(PigmentMixer mixer, List<CalibrationSample> samples) {
        double totalError = 0;
        double totalWeight = 0;
        for (CalibrationSample sample : samples) {
            ColorTriple predicted = mixer.mixKubelkaMunk(sample.colors(), sample.ratios());
            totalError += ColorDifference.deltaE76(sample.expected(), predicted) * sample.weight();
            totalWeight += sample.weight();
        }
        return totalError / totalWeight;
    }

    public record Result(double gamma, double meanError) {
    }
}
