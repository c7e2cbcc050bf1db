package forecast.ml;

import forecast.data.PreparedSeries;

/**
 * One forecasting algorithm. Implementations are stateless and safe to share between threads.
 */
public interface ForecastEngine {

    MethodVariant variant();

    /**
     * @param series          prepared history, oldest first
     * @param horizon         number of future periods, already clamped by the caller
     * @param confidenceLevel 0.95 selects z = 1.96; any other level z = 2.576
     * @param config          smoothing weights and season bounds
     */
    EngineOutput forecast(PreparedSeries series, int horizon, double confidenceLevel, ForecastConfig config);

    /** The engine for a method. */
    static ForecastEngine forVariant(MethodVariant variant) {
        switch (variant) {
            case LINEAR_REGRESSION:
                return LinearRegressionEngine.INSTANCE;
            case SIMPLE_EXPONENTIAL_SMOOTHING:
                return SimpleExponentialSmoothingEngine.INSTANCE;
            case DOUBLE_EXPONENTIAL_SMOOTHING:
                return HoltLinearTrendEngine.INSTANCE;
            case SEASONAL_DECOMPOSITION:
                return SeasonalDecompositionEngine.INSTANCE;
            default:
                throw new IllegalArgumentException("Unknown method: " + variant);
        }
    }
}
