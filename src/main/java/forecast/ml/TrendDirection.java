package forecast.ml;

/** Qualitative direction reported with a forecast. */
public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    SEASONAL("seasonal");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /** Direction from the sign of a slope or trend term; exactly 0 is stable. */
    public static TrendDirection fromSlope(double slope) {
        if (slope > 0) return INCREASING;
        if (slope < 0) return DECREASING;
        return STABLE;
    }
}
