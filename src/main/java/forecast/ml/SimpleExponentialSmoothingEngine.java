package forecast.ml;

import forecast.data.PreparedSeries;

import java.util.Arrays;

/**
 * Simple exponential smoothing: s₀ = y₀, sᵢ = α·yᵢ + (1-α)·sᵢ₋₁.
 * Every future period gets the last smoothed value.
 */
final class SimpleExponentialSmoothingEngine implements ForecastEngine {

    static final SimpleExponentialSmoothingEngine INSTANCE = new SimpleExponentialSmoothingEngine();

    private SimpleExponentialSmoothingEngine() {
    }

    @Override
    public MethodVariant variant() {
        return MethodVariant.SIMPLE_EXPONENTIAL_SMOOTHING;
    }

    @Override
    public EngineOutput forecast(PreparedSeries series, int horizon, double confidenceLevel, ForecastConfig config) {
        double alpha = config.getAlpha();
        double[] y = series.values();
        double[] smoothed = smooth(y, alpha);

        double[] values = new double[horizon];
        Arrays.fill(values, smoothed[smoothed.length - 1]);

        AccuracyMetrics metrics = AccuracyMetrics.builder()
            .put("mae", ForecastStatistics.mae(y, smoothed))
            .put("rmse", ForecastStatistics.rmse(y, smoothed))
            .put("alpha", alpha)
            .confidence(MethodConfidence.MEDIUM)
            .build();

        double[] residuals = ForecastStatistics.residuals(y, smoothed);
        return EngineOutput.withMargin(values, ForecastStatistics.marginOfError(residuals, confidenceLevel),
            metrics, TrendDirection.STABLE, false);
    }

    static double[] smooth(double[] y, double alpha) {
        double[] s = new double[y.length];
        s[0] = y[0];
        for (int i = 1; i < y.length; i++) {
            s[i] = alpha * y[i] + (1 - alpha) * s[i - 1];
        }
        return s;
    }
}
