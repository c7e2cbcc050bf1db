package forecast.ml;

import forecast.data.PreparedSeries;

/**
 * Double exponential smoothing (Holt's linear trend).
 * <p>
 * level₀ = y₀, trend₀ = y₁ - y₀ (0 for a single point), then for i ≥ 1:
 * <pre>
 *   levelᵢ = α·yᵢ + (1-α)·(levelᵢ₋₁ + trendᵢ₋₁)
 *   trendᵢ = β·(levelᵢ - levelᵢ₋₁) + (1-β)·trendᵢ₋₁
 * </pre>
 * Forecast for step h is level + h·trend.
 */
final class HoltLinearTrendEngine implements ForecastEngine {

    static final HoltLinearTrendEngine INSTANCE = new HoltLinearTrendEngine();

    static final double HIGH_CONFIDENCE_TREND = 0.1;

    private HoltLinearTrendEngine() {
    }

    @Override
    public MethodVariant variant() {
        return MethodVariant.DOUBLE_EXPONENTIAL_SMOOTHING;
    }

    @Override
    public EngineOutput forecast(PreparedSeries series, int horizon, double confidenceLevel, ForecastConfig config) {
        double alpha = config.getAlpha();
        double beta = config.getBeta();
        double[] y = series.values();
        Fit fit = fit(y, alpha, beta);

        double[] values = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            values[h - 1] = fit.level + h * fit.trend;
        }

        AccuracyMetrics metrics = AccuracyMetrics.builder()
            .put("mae", ForecastStatistics.mae(y, fit.smoothed))
            .put("rmse", ForecastStatistics.rmse(y, fit.smoothed))
            .put("alpha", alpha)
            .put("beta", beta)
            .put("final_trend", fit.trend)
            .confidence(Math.abs(fit.trend) > HIGH_CONFIDENCE_TREND ? MethodConfidence.HIGH : MethodConfidence.MEDIUM)
            .build();

        double[] residuals = ForecastStatistics.residuals(y, fit.smoothed);
        return EngineOutput.withMargin(values, ForecastStatistics.marginOfError(residuals, confidenceLevel),
            metrics, TrendDirection.fromSlope(fit.trend), false);
    }

    static Fit fit(double[] y, double alpha, double beta) {
        double level = y[0];
        double trend = y.length > 1 ? y[1] - y[0] : 0;
        double[] smoothed = new double[y.length];
        smoothed[0] = level;
        for (int i = 1; i < y.length; i++) {
            double prevLevel = level;
            level = alpha * y[i] + (1 - alpha) * (level + trend);
            trend = beta * (level - prevLevel) + (1 - beta) * trend;
            smoothed[i] = level;
        }
        return new Fit(level, trend, smoothed);
    }

    /** Final state of the smoothing pass plus the in-sample levels. */
    static final class Fit {
        final double level;
        final double trend;
        final double[] smoothed;

        Fit(double level, double trend, double[] smoothed) {
            this.level = level;
            this.trend = trend;
            this.smoothed = smoothed;
        }
    }
}
