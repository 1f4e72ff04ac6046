package at.sv.mixer.color;

public final class ColorDifference {

    private static final double POW_25_7 = Math.pow(25.0, 7);

    private ColorDifference() {
    }

    public static double colorDifference(ColorTriple c1, ColorTriple c2, DeltaEMethod method) {
        return switch (method) {
            case DE76 -> deltaE76(c1, c2);
            case DE00 -> deltaE2000(c1, c2);
        };
    }

    public static double deltaE76(ColorTriple c1, ColorTriple c2) {
        double dL = c1.L() - c2.L(), da = c1.a() - c2.a(), db = c1.b() - c2.b();
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    /**
     * CIEDE2000 with kL = kC = kH = 1, following Sharma, Wu and Dalal (2005),
     * "The CIEDE2000 Color-Difference Formula: Implementation Notes".
     */
    public static double deltaE2000(ColorTriple c1, ColorTriple c2) {
        double L1 = c1.L(), a1 = c1.a(), b1 = c1.b();
        double L2 = c2.L(), a2 = c2.a(), b2 = c2.b();

        double Lb = (L1 + L2) / 2.0;
        double Cb = (Math.hypot(a1, b1) + Math.hypot(a2, b2)) / 2.0;

        double Cb7 = Math.pow(Cb, 7);
        double G = 0.5 * (1.0 - Math.sqrt(Cb7 / (Cb7 + POW_25_7)));

        double a1p = a1 * (1.0 + G);
        double a2p = a2 * (1.0 + G);

        double C1p = Math.hypot(a1p, b1);
        double C2p = Math.hypot(a2p, b2);
        double Cbp = (C1p + C2p) / 2.0;
        double dCp = C2p - C1p;

        double h1p = hueAngle(b1, a1p);
        double h2p = hueAngle(b2, a2p);
        boolean achromatic = C1p * C2p == 0;

        double dhp;
        if (achromatic) {
            dhp = 0;
        } else if (Math.abs(h2p - h1p) <= Math.PI) {
            dhp = h2p - h1p;
        } else if (h2p - h1p > Math.PI) {
            dhp = h2p - h1p - 2.0 * Math.PI;
        } else {
            dhp = h2p - h1p + 2.0 * Math.PI;
        }
        double dHp = 2.0 * Math.sqrt(C1p * C2p) * Math.sin(dhp / 2.0);

        double Hbp;
        if (achromatic) {
            Hbp = h1p + h2p;
        } else if (Math.abs(h1p - h2p) <= Math.PI) {
            Hbp = (h1p + h2p) / 2.0;
        } else if (h1p + h2p < 2.0 * Math.PI) {
            Hbp = (h1p + h2p + 2.0 * Math.PI) / 2.0;
        } else {
            Hbp = (h1p + h2p - 2.0 * Math.PI) / 2.0;
        }

        double T = 1.0
                   - 0.17 * Math.cos(Hbp - Math.toRadians(30))
                   + 0.24 * Math.cos(2.0 * Hbp)
                   + 0.32 * Math.cos(3.0 * Hbp + Math.toRadians(6))
                   - 0.20 * Math.cos(4.0 * Hbp - Math.toRadians(63));

        double Lb50sq = (Lb - 50.0) * (Lb - 50.0);
        double SL = 1.0 + 0.015 * Lb50sq / Math.sqrt(20.0 + Lb50sq);
        double SC = 1.0 + 0.045 * Cbp;
        double SH = 1.0 + 0.015 * Cbp * T;

        double hueOffset = (Hbp - Math.toRadians(275)) / Math.toRadians(25);
        double dTheta = Math.toRadians(30) * Math.exp(-hueOffset * hueOffset);
        double Cbp7 = Math.pow(Cbp, 7);
        double RC = 2.0 * Math.sqrt(Cbp7 / (Cbp7 + POW_25_7));
        double RT = -Math.sin(2.0 * dTheta) * RC;

        double lTerm = (L2 - L1) / SL;
        double cTerm = dCp / SC;
        double hTerm = dHp / SH;

        return Math.sqrt(lTerm * lTerm + cTerm * cTerm + hTerm * hTerm + RT * cTerm * hTerm);
    }

    /**
     * Hue angle in [0, 2π). Zero for an achromatic color.
     */
    private static double hueAngle(double b, double ap) {
        if (b == 0 && ap == 0) {
            return 0;
        }
        double h = Math.atan2(b, ap);
        return h < 0 ? h + 2.0 * Math.PI : h;
    }
}
