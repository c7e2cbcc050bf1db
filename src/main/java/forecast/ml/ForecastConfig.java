package forecast.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Per-call forecasting parameters. Immutable; {@code with*} methods return modified copies.
 * <p>
 * Defaults: α = 0.3, β = 0.1, at least 3 data points, horizon capped at 12 periods,
 * season length capped at 12, 30 days per forecast period.
 */
public final class ForecastConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

    public static final double DEFAULT_ALPHA = 0.3;
    public static final double DEFAULT_BETA = 0.1;
    public static final int DEFAULT_MIN_DATA_POINTS = 3;
    public static final int DEFAULT_MAX_FORECAST_HORIZON = 12;
    public static final int DEFAULT_MAX_SEASON_LENGTH = 12;
    public static final int DEFAULT_PERIOD_DAYS = 30;

    private static final ForecastConfig DEFAULTS = new ForecastConfig(DEFAULT_ALPHA, DEFAULT_BETA,
        DEFAULT_MIN_DATA_POINTS, DEFAULT_MAX_FORECAST_HORIZON, DEFAULT_MAX_SEASON_LENGTH, DEFAULT_PERIOD_DAYS);

    /** Level smoothing weight (simple and double exponential smoothing). */
    private final double alpha;
    /** Trend smoothing weight (double exponential smoothing). */
    private final double beta;
    private final int minDataPoints;
    private final int maxForecastHorizon;
    private final int maxSeasonLength;
    private final int periodDays;

    public ForecastConfig(double alpha, double beta, int minDataPoints, int maxForecastHorizon,
                          int maxSeasonLength, int periodDays) {
        if (!(alpha >= 0 && alpha <= 1)) throw new IllegalArgumentException("alpha must be in [0, 1]: " + alpha);
        if (!(beta >= 0 && beta <= 1)) throw new IllegalArgumentException("beta must be in [0, 1]: " + beta);
        if (minDataPoints < 1) throw new IllegalArgumentException("minDataPoints must be >= 1: " + minDataPoints);
        if (maxForecastHorizon < 1) throw new IllegalArgumentException("maxForecastHorizon must be >= 1: " + maxForecastHorizon);
        if (maxSeasonLength < 1) throw new IllegalArgumentException("maxSeasonLength must be >= 1: " + maxSeasonLength);
        if (periodDays < 1) throw new IllegalArgumentException("periodDays must be >= 1: " + periodDays);
        this.alpha = alpha;
        this.beta = beta;
        this.minDataPoints = minDataPoints;
        this.maxForecastHorizon = maxForecastHorizon;
        this.maxSeasonLength = maxSeasonLength;
        this.periodDays = periodDays;
    }

    public static ForecastConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Defaults overridden by {@code FORECAST_ALPHA}, {@code FORECAST_BETA}, {@code FORECAST_MIN_DATA_POINTS},
     * {@code FORECAST_MAX_HORIZON}, {@code FORECAST_MAX_SEASON_LENGTH} and {@code FORECAST_PERIOD_DAYS}.
     * Blank or unparseable entries keep the default.
     */
    public static ForecastConfig fromEnvironment(Map<String, String> env) {
        return new ForecastConfig(
            getDouble(env, "FORECAST_ALPHA", DEFAULT_ALPHA),
            getDouble(env, "FORECAST_BETA", DEFAULT_BETA),
            getInt(env, "FORECAST_MIN_DATA_POINTS", DEFAULT_MIN_DATA_POINTS),
            getInt(env, "FORECAST_MAX_HORIZON", DEFAULT_MAX_FORECAST_HORIZON),
            getInt(env, "FORECAST_MAX_SEASON_LENGTH", DEFAULT_MAX_SEASON_LENGTH),
            getInt(env, "FORECAST_PERIOD_DAYS", DEFAULT_PERIOD_DAYS));
    }

    private static double getDouble(Map<String, String> env, String key, double def) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}='{}': not a number, using {}", key, raw, def);
            return def;
        }
    }

    private static int getInt(Map<String, String> env, String key, int def) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}='{}': not an integer, using {}", key, raw, def);
            return def;
        }
    }

    public ForecastConfig withAlpha(double alpha) {
        return new ForecastConfig(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    public ForecastConfig withBeta(double beta) {
        return new ForecastConfig(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    public ForecastConfig withMinDataPoints(int minDataPoints) {
        return new ForecastConfig(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    public ForecastConfig withMaxForecastHorizon(int maxForecastHorizon) {
        return new ForecastConfig(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    public ForecastConfig withMaxSeasonLength(int maxSeasonLength) {
        return new ForecastConfig(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    public ForecastConfig withPeriodDays(int periodDays) {
        return new ForecastConfig(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    public double getAlpha() { return alpha; }
    public double getBeta() { return beta; }
    public int getMinDataPoints() { return minDataPoints; }
    public int getMaxForecastHorizon() { return maxForecastHorizon; }
    public int getMaxSeasonLength() { return maxSeasonLength; }
    public int getPeriodDays() { return periodDays; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastConfig)) return false;
        ForecastConfig c = (ForecastConfig) o;
        return Double.compare(alpha, c.alpha) == 0 && Double.compare(beta, c.beta) == 0
            && minDataPoints == c.minDataPoints && maxForecastHorizon == c.maxForecastHorizon
            && maxSeasonLength == c.maxSeasonLength && periodDays == c.periodDays;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, beta, minDataPoints, maxForecastHorizon, maxSeasonLength, periodDays);
    }

    @Override
    public String toString() {
        return "ForecastConfig{alpha=" + alpha + ", beta=" + beta + ", minDataPoints=" + minDataPoints
            + ", maxForecastHorizon=" + maxForecastHorizon + ", maxSeasonLength=" + maxSeasonLength
            + ", periodDays=" + periodDays + "}";
    }
}
