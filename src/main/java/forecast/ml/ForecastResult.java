package forecast.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complete forecast handed to the caller. Immutable; the engine keeps no reference to it.
 * <p>
 * The four per-step lists have the same length ({@link #getForecastHorizon()}) and
 * {@code lower[i] <= value[i] <= upper[i]} holds for every step.
 */
public final class ForecastResult {

    private final MethodVariant method;
    private final List<Double> forecastValues;
    private final List<String> forecastDates;
    private final List<Double> confidenceUpper;
    private final List<Double> confidenceLower;
    private final AccuracyMetrics accuracyMetrics;
    private final boolean seasonalDetected;
    private final TrendDirection trendDirection;
    private final double lastActualValue;
    private final int forecastHorizon;

    public ForecastResult(MethodVariant method, List<Double> forecastValues, List<String> forecastDates,
                          List<Double> confidenceUpper, List<Double> confidenceLower, AccuracyMetrics accuracyMetrics,
                          boolean seasonalDetected, TrendDirection trendDirection, double lastActualValue,
                          int forecastHorizon) {
        this.method = Objects.requireNonNull(method, "method");
        this.forecastValues = copy(forecastValues);
        this.forecastDates = copy(forecastDates);
        this.confidenceUpper = copy(confidenceUpper);
        this.confidenceLower = copy(confidenceLower);
        this.accuracyMetrics = Objects.requireNonNull(accuracyMetrics, "accuracyMetrics");
        this.seasonalDetected = seasonalDetected;
        this.trendDirection = Objects.requireNonNull(trendDirection, "trendDirection");
        this.lastActualValue = lastActualValue;
        this.forecastHorizon = forecastHorizon;

        int h = forecastValues.size();
        if (forecastHorizon != h || forecastDates.size() != h || confidenceUpper.size() != h || confidenceLower.size() != h) {
            throw new IllegalArgumentException("forecast values, dates and bounds must all have length " + forecastHorizon);
        }
        for (int i = 0; i < h; i++) {
            double v = forecastValues.get(i);
            if (confidenceLower.get(i) > v || v > confidenceUpper.get(i)) {
                throw new IllegalArgumentException("step " + (i + 1) + ": value " + v + " outside ["
                    + confidenceLower.get(i) + ", " + confidenceUpper.get(i) + "]");
            }
        }
    }

    private static <T> List<T> copy(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(list)));
    }

    public MethodVariant getMethod() { return method; }
    public List<Double> getForecastValues() { return forecastValues; }
    /** ISO dates ({@code yyyy-MM-dd}), one per forecast step. */
    public List<String> getForecastDates() { return forecastDates; }
    public List<Double> getConfidenceUpper() { return confidenceUpper; }
    public List<Double> getConfidenceLower() { return confidenceLower; }
    public AccuracyMetrics getAccuracyMetrics() { return accuracyMetrics; }
    public boolean isSeasonalDetected() { return seasonalDetected; }
    public TrendDirection getTrendDirection() { return trendDirection; }
    public double getLastActualValue() { return lastActualValue; }
    public int getForecastHorizon() { return forecastHorizon; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastResult)) return false;
        ForecastResult r = (ForecastResult) o;
        return method == r.method
            && forecastValues.equals(r.forecastValues)
            && forecastDates.equals(r.forecastDates)
            && confidenceUpper.equals(r.confidenceUpper)
            && confidenceLower.equals(r.confidenceLower)
            && accuracyMetrics.equals(r.accuracyMetrics)
            && seasonalDetected == r.seasonalDetected
            && trendDirection == r.trendDirection
            && Double.compare(lastActualValue, r.lastActualValue) == 0
            && forecastHorizon == r.forecastHorizon;
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, forecastValues, forecastDates, confidenceUpper, confidenceLower,
            accuracyMetrics, seasonalDetected, trendDirection, lastActualValue, forecastHorizon);
    }

    @Override
    public String toString() {
        return "ForecastResult{method=" + method + ", horizon=" + forecastHorizon + ", trend=" + trendDirection.getLabel()
            + ", seasonal=" + seasonalDetected + ", values=" + forecastValues + "}";
    }
}
