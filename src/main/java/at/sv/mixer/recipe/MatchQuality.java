package at.sv.mixer.recipe;

public enum MatchQuality {
    VERY_CLOSE(3.0, "Very close match"),
    CLOSE(6.0, "Close enough"),
    USABLE(10.0, "Noticeable difference, but usable"),
    DISTANT(Double.POSITIVE_INFINITY, "Clearly different, more paints in the catalog would help");

    private final double upperBound;
    private final String description;

    MatchQuality(double upperBound, String description) {
        this.upperBound = upperBound;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static MatchQuality of(double deltaE) {
        for (MatchQuality quality : values()) {
            if (deltaE < quality.upperBound) {
                return quality;
            }
        }
        return DISTANT;
    }
}
