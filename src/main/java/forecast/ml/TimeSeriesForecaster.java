package forecast.ml;

import forecast.data.DataPreparator;
import forecast.data.DataTable;
import forecast.data.PreparedSeries;
import forecast.error.ForecastException;
import forecast.error.InsufficientDataException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forecasting pipeline: prepare → characterize → select method → forecast → package.
 * <p>
 * Holds only its configuration, so one instance can serve concurrent calls.
 */
public class TimeSeriesForecaster {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesForecaster.class);

    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    private final ForecastConfig config;
    private final DataPreparator preparator;
    private final CharacteristicsAnalyzer analyzer = new CharacteristicsAnalyzer();

    public TimeSeriesForecaster(ForecastConfig config) {
        if (config == null) throw new IllegalArgumentException("config required");
        this.config = config;
        this.preparator = new DataPreparator(config.getMinDataPoints());
    }

    public TimeSeriesForecaster() {
        this(ForecastConfig.defaults());
    }

    public ForecastResult analyze(DataTable table, String targetColumn, String dateColumn, int periods) {
        return analyze(table, targetColumn, dateColumn, periods, DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * Forecast {@code periods} steps of {@code targetColumn}, picking the method from the data.
     *
     * @throws forecast.error.ValidationException on bad input, before any numeric work
     * @throws ForecastException                  when the numbers cannot be computed
     */
    public ForecastResult analyze(DataTable table, String targetColumn, String dateColumn, int periods,
                                  double confidenceLevel) {
        checkRequest(periods);
        PreparedSeries series = preparator.prepare(table, targetColumn, dateColumn);
        DataCharacteristics chars = analyzer.characterize(series);
        log.debug("Characteristics of '{}': {}", targetColumn, chars);
        MethodVariant method = MethodSelector.select(chars);
        log.debug("Selected {} for '{}'", method.getDisplayName(), targetColumn);
        ForecastResult result = run(series, method, periods, confidenceLevel);
        log.info("Forecast generated: {} method, {} periods for '{}'", method.getDisplayName(),
            result.getForecastHorizon(), targetColumn);
        return result;
    }

    /** Run a given method on an already prepared series, skipping method selection. */
    public ForecastResult forecast(PreparedSeries series, MethodVariant method, int periods, double confidenceLevel) {
        checkRequest(periods);
        if (series == null || method == null) throw new IllegalArgumentException("series and method required");
        return run(series, method, periods, confidenceLevel);
    }

    public DataCharacteristics characterize(PreparedSeries series) {
        return analyzer.characterize(series);
    }

    public PreparedSeries prepare(DataTable table, String targetColumn, String dateColumn) {
        return preparator.prepare(table, targetColumn, dateColumn);
    }

    private ForecastResult run(PreparedSeries series, MethodVariant method, int periods, double confidenceLevel) {
        int horizon = clampHorizon(periods);
        EngineOutput out;
        try {
            out = ForecastEngine.forVariant(method).forecast(series, horizon, confidenceLevel, config);
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            throw new ForecastException(method.getDisplayName() + " failed: " + e.getMessage(), e);
        }
        return ResultPackager.assemble(method, out, series, config.getPeriodDays());
    }

    int clampHorizon(int periods) {
        return Math.min(periods, config.getMaxForecastHorizon());
    }

    // any confidence level is accepted; only 0.95 maps to the narrower band
    private static void checkRequest(int periods) {
        if (periods <= 0) {
            throw new InsufficientDataException("Number of forecast periods must be positive, got " + periods);
        }
    }

    public ForecastConfig getConfig() { return config; }
}
