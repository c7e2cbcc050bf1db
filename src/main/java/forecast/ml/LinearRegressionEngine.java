package forecast.ml;

import forecast.data.PreparedSeries;

/**
 * Straight-line trend over the time index, extrapolated forward.
 * Confidence: high when R² &gt; 0.7, medium when R² &gt; 0.4, low otherwise.
 */
final class LinearRegressionEngine implements ForecastEngine {

    static final LinearRegressionEngine INSTANCE = new LinearRegressionEngine();

    private LinearRegressionEngine() {
    }

    @Override
    public MethodVariant variant() {
        return MethodVariant.LINEAR_REGRESSION;
    }

    @Override
    public EngineOutput forecast(PreparedSeries series, int horizon, double confidenceLevel, ForecastConfig config) {
        double[] y = series.values();
        LinearRegression lr = LinearRegression.fit(y);
        double[] fitted = lr.getFitted();
        double[] residuals = ForecastStatistics.residuals(y, fitted);

        double r2 = lr.getRSquared();
        AccuracyMetrics metrics = AccuracyMetrics.builder()
            .put("r_squared", r2)
            .put("mae", ForecastStatistics.mae(y, fitted))
            .put("rmse", ForecastStatistics.rmse(y, fitted))
            .confidence(confidenceFor(r2))
            .build();

        return EngineOutput.withMargin(
            lr.extrapolate(horizon),
            ForecastStatistics.marginOfError(residuals, confidenceLevel),
            metrics,
            TrendDirection.fromSlope(lr.getSlope()),
            false);
    }

    static MethodConfidence confidenceFor(double rSquared) {
        if (rSquared > 0.7) return MethodConfidence.HIGH;
        if (rSquared > 0.4) return MethodConfidence.MEDIUM;
        return MethodConfidence.LOW;
    }
}
