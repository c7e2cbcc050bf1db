package forecast.ml;

import forecast.data.PreparedSeries;
import forecast.error.ForecastException;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Additive decomposition: per-position seasonal deviation from the mean, plus a linear trend
 * fitted to the deseasonalized series.
 * <p>
 * Season length is min(maxSeasonLength, n / 2). The pattern entry for position j is the mean of
 * all values at i ≡ j (mod season length) minus the overall mean.
 */
final class SeasonalDecompositionEngine implements ForecastEngine {

    static final SeasonalDecompositionEngine INSTANCE = new SeasonalDecompositionEngine();

    private SeasonalDecompositionEngine() {
    }

    @Override
    public MethodVariant variant() {
        return MethodVariant.SEASONAL_DECOMPOSITION;
    }

    @Override
    public EngineOutput forecast(PreparedSeries series, int horizon, double confidenceLevel, ForecastConfig config) {
        double[] y = series.values();
        int n = y.length;
        int seasonLength = seasonLength(n, config.getMaxSeasonLength());
        if (seasonLength < 1) {
            throw new ForecastException("Seasonal decomposition needs at least 2 points, got " + n);
        }

        double[] pattern = seasonalPattern(y, seasonLength);
        double[] deseasonalized = new double[n];
        for (int i = 0; i < n; i++) deseasonalized[i] = y[i] - pattern[i % seasonLength];

        double[] trend = LinearRegression.fit(deseasonalized).extrapolate(horizon);
        double[] values = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            values[h - 1] = trend[h - 1] + pattern[(n - 1 + h) % seasonLength];
        }

        double[] reconstructed = new double[n];
        for (int i = 0; i < n; i++) reconstructed[i] = deseasonalized[i] + pattern[i % seasonLength];

        AccuracyMetrics metrics = AccuracyMetrics.builder()
            .put("mae", ForecastStatistics.mae(y, reconstructed))
            .put("rmse", ForecastStatistics.rmse(y, reconstructed))
            .put("seasonal_strength", ForecastStatistics.populationStd(pattern))
            .confidence(MethodConfidence.HIGH)
            .build();

        double[] residuals = ForecastStatistics.residuals(y, reconstructed);
        return EngineOutput.withMargin(values, ForecastStatistics.marginOfError(residuals, confidenceLevel),
            metrics, TrendDirection.SEASONAL, true);
    }

    static int seasonLength(int n, int maxSeasonLength) {
        return Math.min(maxSeasonLength, n / 2);
    }

    static double[] seasonalPattern(double[] y, int seasonLength) {
        double[] sums = new double[seasonLength];
        int[] counts = new int[seasonLength];
        for (int i = 0; i < y.length; i++) {
            sums[i % seasonLength] += y[i];
            counts[i % seasonLength]++;
        }
        double mean = StatUtils.mean(y);
        double[] pattern = new double[seasonLength];
        for (int j = 0; j < seasonLength; j++) pattern[j] = sums[j] / counts[j] - mean;
        return pattern;
    }
}
