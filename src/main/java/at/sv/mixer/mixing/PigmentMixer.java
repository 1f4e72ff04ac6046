package at.sv.mixer.mixing;

import at.sv.mixer.color.ColorTriple;

import java.util.List;

/**
 * Predicts the Lab color of opaque paints mixed at given ratios.
 * <p>
 * Lightness follows the single-constant Kubelka-Munk relation {@code K/S = (1 - R)² / 2R}, with the reflectance
 * approximated from L as {@code R = (L / 100)^γ}. The K/S values of the components mix linearly by ratio.
 * The a and b channels are averaged by ratio and attenuated by a chroma decay factor, so that mixing differently
 * colored paints reduces saturation.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public final class PigmentMixer {

    public static final double DEFAULT_GAMMA = 2.2;

    private static final double REFLECTANCE_EPSILON = 1e-6;
    /**
     * Maps typical chroma channel magnitudes (0-60) onto a pseudo absorption range of 1-2.2.
     */
    private static final double CHROMA_ABSORPTION_SCALE = 50.0;
    private static final double CHROMA_DECAY_SCALE = 10.0;

    private static final double HYBRID_BASE_WEIGHT = 0.3;
    private static final double HYBRID_DARKNESS_WEIGHT = 0.5;
    private static final double HYBRID_SIGNIFICANT_SHARE = 0.01;
    private static final double HYBRID_DESATURATION_PER_COLOR = 0.05;
    private static final double HYBRID_MIN_SATURATION = 0.7;

    private final double gamma;

    public PigmentMixer() {
        this(DEFAULT_GAMMA);
    }

    public PigmentMixer(double gamma) {
        if (!(gamma > 0) || Double.isInfinite(gamma)) {
            throw new IllegalArgumentException("Invalid gamma '" + gamma + "'. Gamma has to be a positive number");
        }
        this.gamma = gamma;
    }

    public double getGamma() {
        return gamma;
    }

    /**
     * @param colors the Lab colors of the components
     * @param ratios the non-negative mixing ratios, not necessarily normalized
     * @param model  the mixing model to use
     * @return the predicted color, or {@link ColorTriple#NEUTRAL_GRAY} if the ratios sum up to zero
     * @throws IllegalArgumentException if a ratio is negative or not a number, or the lengths differ
     */
    public ColorTriple mix(List<ColorTriple> colors, double[] ratios, MixingModel model) {
        return switch (model) {
            case KUBELKA_MUNK -> mixKubelkaMunk(colors, ratios);
            case HYBRID -> mixHybrid(colors, ratios);
        };
    }

    public ColorTriple mixKubelkaMunk(List<ColorTriple> colors, double[] ratios) {
        double[] weights = normalize(colors, ratios);
        if (weights == null) {
            return ColorTriple.NEUTRAL_GRAY;
        }
        ColorTriple single = singleComponent(colors, weights);
        if (single != null) {
            return single;
        }
        double L = kubelkaMunkLightness(colors, weights);
        double a = 0, b = 0, absorptionA = 0, absorptionB = 0;
        for (int i = 0; i < weights.length; i++) {
            ColorTriple c = colors.get(i);
            a += weights[i] * c.a();
            b += weights[i] * c.b();
            absorptionA += weights[i] * (1 + Math.abs(c.a()) / CHROMA_ABSORPTION_SCALE);
            absorptionB += weights[i] * (1 + Math.abs(c.b()) / CHROMA_ABSORPTION_SCALE);
        }
        return new ColorTriple(L, a * chromaDecay(absorptionA), b * chromaDecay(absorptionB));
    }

    public ColorTriple mixHybrid(List<ColorTriple> colors, double[] ratios) {
        double[] weights = normalize(colors, ratios);
        if (weights == null) {
            return ColorTriple.NEUTRAL_GRAY;
        }
        ColorTriple single = singleComponent(colors, weights);
        if (single != null) {
            return single;
        }
        double linearL = 0, a = 0, b = 0;
        double minL = Double.MAX_VALUE;
        int significantColors = 0;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0) {
                continue;
            }
            ColorTriple c = colors.get(i);
            linearL += weights[i] * c.L();
            a += weights[i] * c.a();
            b += weights[i] * c.b();
            minL = Math.min(minL, c.L());
            if (weights[i] > HYBRID_SIGNIFICANT_SHARE) {
                significantColors++;
            }
        }
        double darkness = clamp((100 - minL) / 100, 0, 1);
        double kmWeight = HYBRID_BASE_WEIGHT + HYBRID_DARKNESS_WEIGHT * darkness;
        double L = linearL * (1 - kmWeight) + kubelkaMunkLightness(colors, weights) * kmWeight;
        double saturation = Math.max(HYBRID_MIN_SATURATION,
                1 - HYBRID_DESATURATION_PER_COLOR * (significantColors - 1));
        return new ColorTriple(L, a * saturation, b * saturation);
    }

    private double kubelkaMunkLightness(List<ColorTriple> colors, double[] weights) {
        double mixedKS = 0;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0) {
                mixedKS += weights[i] * absorptionScatteringRatio(colors.get(i).L());
            }
        }
        double reflectance = 1 + mixedKS - Math.sqrt(mixedKS * mixedKS + 2 * mixedKS);
        reflectance = clamp(reflectance, 0, 1);
        return Math.pow(reflectance, 1 / gamma) * 100;
    }

    private double absorptionScatteringRatio(double L) {
        double reflectance = clamp(Math.pow(Math.max(L, 0) / 100, gamma),
                REFLECTANCE_EPSILON, 1 - REFLECTANCE_EPSILON);
        double absorbed = 1 - reflectance;
        return absorbed * absorbed / (2 * reflectance);
    }

    private static double chromaDecay(double absorption) {
        return 1 / (1 + absorption / CHROMA_DECAY_SCALE);
    }

    /**
     * @return the ratios scaled to sum up to 1, or null if they sum up to zero
     */
    private static double[] normalize(List<ColorTriple> colors, double[] ratios) {
        if (colors.size() != ratios.length) {
            throw new IllegalArgumentException("Got " + colors.size() + " colors but " + ratios.length + " ratios");
        }
        double total = 0;
        for (double ratio : ratios) {
            if (Double.isNaN(ratio) || ratio < 0 || Double.isInfinite(ratio)) {
                throw new IllegalArgumentException("Invalid mixing ratio '" + ratio + "'. Ratios have to be finite and non-negative");
            }
            total += ratio;
        }
        if (total <= 0) {
            return null;
        }
        double[] weights = new double[ratios.length];
        for (int i = 0; i < ratios.length; i++) {
            weights[i] = ratios[i] / total;
        }
        return weights;
    }

    /**
     * @return the only component with a positive share, or null if several components contribute
     */
    private static ColorTriple singleComponent(List<ColorTriple> colors, double[] weights) {
        int index = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0) {
                if (index >= 0) {
                    return null;
                }
                index = i;
            }
        }
        return colors.get(index);
    }

    private static double clamp(double value, double min, double max) {
        return value < min ? min : (value > max ? max : value);
    }
}
