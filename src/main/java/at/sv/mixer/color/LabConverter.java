package at.sv.mixer.color;

/**
 * Converts between 8-bit sRGB and CIE Lab via CIE XYZ, using the D65 reference white.
 * <p>
 * See: <a href="http://www.brucelindbloom.com/index.html?Math.html">Bruce Lindbloom, Useful Color Equations</a>
 */
public final class LabConverter {

    private LabConverter() {
    }

    // D65 linear sRGB <-> XYZ matrices
    // sRGB (linear) -> XYZ
    private static final double M11 = 0.4124564, M12 = 0.3575761, M13 = 0.1804375;
    private static final double M21 = 0.2126729, M22 = 0.7151522, M23 = 0.0721750;
    private static final double M31 = 0.0193339, M32 = 0.1191920, M33 = 0.9503041;

    // XYZ -> sRGB (linear)
    private static final double IM11 = 3.2404542, IM12 = -1.5371385, IM13 = -0.4985314;
    private static final double IM21 = -0.9692660, IM22 = 1.8760108, IM23 = 0.0415560;
    private static final double IM31 = 0.0556434, IM32 = -0.2040259, IM33 = 1.0572252;

    // D65 reference white
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double EPSILON = 216.0 / 24389.0;
    private static final double KAPPA = 24389.0 / 27.0;

    public static ColorTriple rgbToLab(int r, int g, int b) {
        return rgbToLab(new RGBColor(r, g, b));
    }

    public static ColorTriple rgbToLab(RGBColor rgb) {
        double red = GammaCorrection.sRGBToLinear(rgb.r() / 255.0);
        double green = GammaCorrection.sRGBToLinear(rgb.g() / 255.0);
        double blue = GammaCorrection.sRGBToLinear(rgb.b() / 255.0);

        double X = M11 * red + M12 * green + M13 * blue;
        double Y = M21 * red + M22 * green + M23 * blue;
        double Z = M31 * red + M32 * green + M33 * blue;

        double fx = labF(X / XN);
        double fy = labF(Y / YN);
        double fz = labF(Z / ZN);

        return new ColorTriple(116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz));
    }

    /**
     * Out-of-gamut colors are clipped per channel to [0, 255].
     */
    public static RGBColor labToRgb(double L, double a, double b) {
        double fy = (L + 16.0) / 116.0;
        double fx = fy + a / 500.0;
        double fz = fy - b / 200.0;

        double X = labFInverse(fx) * XN;
        double Y = (L > KAPPA * EPSILON ? fy * fy * fy : L / KAPPA) * YN;
        double Z = labFInverse(fz) * ZN;

        double red = IM11 * X + IM12 * Y + IM13 * Z;
        double green = IM21 * X + IM22 * Y + IM23 * Z;
        double blue = IM31 * X + IM32 * Y + IM33 * Z;

        return new RGBColor(toChannel(red), toChannel(green), toChannel(blue));
    }

    public static RGBColor labToRgb(ColorTriple lab) {
        return labToRgb(lab.L(), lab.a(), lab.b());
    }

    private static double labF(double t) {
        return t > EPSILON ? Math.cbrt(t) : (KAPPA * t + 16.0) / 116.0;
    }

    private static double labFInverse(double f) {
        double f3 = f * f * f;
        return f3 > EPSILON ? f3 : (116.0 * f - 16.0) / KAPPA;
    }

    private static int toChannel(double linear) {
        double companded = GammaCorrection.linearToSRGB(Math.max(0.0, linear));
        long value = Math.round(companded * 255.0);
        return (int) Math.max(0, Math.min(255, value));
    }

    private static final class GammaCorrection {
        private static final double gamma = 2.4;
        private static final double transition = 0.0031308; // linear domain
        private static final double slope = 12.92;
        private static final double offset = 0.055;

        static double sRGBToLinear(double value) {
            double transitionInv = slope * GammaCorrection.transition; // ~ 0.04045
            if (value <= transitionInv) {
                return value / slope;
            }
            return Math.pow((value + offset) / (1 + offset), gamma);
        }

        static double linearToSRGB(double value) {
            if (value <= transition) {
                return value * slope;
            }
            return (1 + offset) * Math.pow(value, 1 / gamma) - offset;
        }
    }
}
