package forecast.ml;

/** Summary of a prepared series used to pick a forecasting method. */
public final class DataCharacteristics {

    private final int length;
    private final boolean hasTrend;
    private final boolean hasSeasonality;
    private final double volatility;
    private final int missingValues;
    private final int outliers;

    public DataCharacteristics(int length, boolean hasTrend, boolean hasSeasonality, double volatility,
                               int missingValues, int outliers) {
        if (length < 0 || missingValues < 0 || outliers < 0 || volatility < 0) {
            throw new IllegalArgumentException("counts and volatility must be non-negative");
        }
        this.length = length;
        this.hasTrend = hasTrend;
        this.hasSeasonality = hasSeasonality;
        this.volatility = volatility;
        this.missingValues = missingValues;
        this.outliers = outliers;
    }

    public int getLength() { return length; }
    public boolean hasTrend() { return hasTrend; }
    public boolean hasSeasonality() { return hasSeasonality; }
    /** Sample standard deviation of the values. */
    public double getVolatility() { return volatility; }
    public int getMissingValues() { return missingValues; }
    public int getOutliers() { return outliers; }

    @Override
    public String toString() {
        return "DataCharacteristics{length=" + length + ", hasTrend=" + hasTrend + ", hasSeasonality=" + hasSeasonality
            + ", volatility=" + volatility + ", missingValues=" + missingValues + ", outliers=" + outliers + "}";
    }
}
