package forecast.ml;

/**
 * Maps data characteristics to a forecasting method. First matching rule wins:
 * <ol>
 *   <li>fewer than {@value #SHORT_SERIES_LENGTH} points: linear regression</li>
 *   <li>trend with volatility below {@value #MAX_TREND_VOLATILITY}: double exponential smoothing</li>
 *   <li>seasonality: seasonal decomposition</li>
 *   <li>otherwise: simple exponential smoothing</li>
 * </ol>
 * The volatility threshold is an absolute magnitude, not scaled to the series.
 */
public final class MethodSelector {

    static final int SHORT_SERIES_LENGTH = 6;
    static final double MAX_TREND_VOLATILITY = 50;

    private MethodSelector() {
    }

    public static MethodVariant select(DataCharacteristics chars) {
        if (chars.getLength() < SHORT_SERIES_LENGTH) {
            return MethodVariant.LINEAR_REGRESSION;
        }
        if (chars.hasTrend() && chars.getVolatility() < MAX_TREND_VOLATILITY) {
            return MethodVariant.DOUBLE_EXPONENTIAL_SMOOTHING;
        }
        if (chars.hasSeasonality()) {
            return MethodVariant.SEASONAL_DECOMPOSITION;
        }
        return MethodVariant.SIMPLE_EXPONENTIAL_SMOOTHING;
    }
}
