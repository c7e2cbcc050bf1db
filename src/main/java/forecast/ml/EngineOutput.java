package forecast.ml;

import forecast.error.ForecastException;

/**
 * Raw numbers produced by one forecast engine, before dates and metadata are attached.
 */
public final class EngineOutput {

    private final double[] values;
    private final double[] upper;
    private final double[] lower;
    private final AccuracyMetrics metrics;
    private final TrendDirection trendDirection;
    private final boolean seasonalDetected;

    EngineOutput(double[] values, double[] upper, double[] lower, AccuracyMetrics metrics,
                 TrendDirection trendDirection, boolean seasonalDetected) {
        if (values.length != upper.length || values.length != lower.length) {
            throw new IllegalArgumentException("values and bounds must have equal length");
        }
        requireFinite("forecast", values);
        requireFinite("upper bound", upper);
        requireFinite("lower bound", lower);
        for (Double m : metrics.getValues().values()) {
            if (!Double.isFinite(m)) throw new ForecastException("Non-finite accuracy metric in " + metrics);
        }
        this.values = values.clone();
        this.upper = upper.clone();
        this.lower = lower.clone();
        this.metrics = metrics;
        this.trendDirection = trendDirection;
        this.seasonalDetected = seasonalDetected;
    }

    /** Symmetric band: value ± margin. */
    static EngineOutput withMargin(double[] values, double margin, AccuracyMetrics metrics,
                                   TrendDirection trendDirection, boolean seasonalDetected) {
        return new EngineOutput(values,
            ForecastStatistics.shift(values, margin),
            ForecastStatistics.shift(values, -margin),
            metrics, trendDirection, seasonalDetected);
    }

    private static void requireFinite(String what, double[] a) {
        for (int i = 0; i < a.length; i++) {
            if (!Double.isFinite(a[i])) {
                throw new ForecastException("Non-finite " + what + " at step " + (i + 1) + ": " + a[i]);
            }
        }
    }

    public double[] getValues() { return values.clone(); }
    public double[] getUpper() { return upper.clone(); }
    public double[] getLower() { return lower.clone(); }
    public AccuracyMetrics getMetrics() { return metrics; }
    public TrendDirection getTrendDirection() { return trendDirection; }
    public boolean isSeasonalDetected() { return seasonalDetected; }
    public int horizon() { return values.length; }
}
