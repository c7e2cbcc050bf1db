package forecast.ml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-sample accuracy of a forecast method: named numeric metrics in insertion order
 * (e.g. {@code r_squared}, {@code mae}, {@code rmse}, {@code alpha}) plus a qualitative confidence.
 */
public final class AccuracyMetrics {

    private final Map<String, Double> values;
    private final MethodConfidence methodConfidence;

    private AccuracyMetrics(Map<String, Double> values, MethodConfidence methodConfidence) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.methodConfidence = Objects.requireNonNull(methodConfidence, "methodConfidence");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Double> getValues() { return values; }
    public MethodConfidence getMethodConfidence() { return methodConfidence; }

    public double get(String name) {
        Double v = values.get(name);
        if (v == null) throw new IllegalArgumentException("No metric '" + name + "'");
        return v;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccuracyMetrics)) return false;
        AccuracyMetrics other = (AccuracyMetrics) o;
        return values.equals(other.values) && methodConfidence == other.methodConfidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, methodConfidence);
    }

    @Override
    public String toString() {
        return values + ", method_confidence=" + methodConfidence.getLabel();
    }

    public static final class Builder {
        private final Map<String, Double> values = new LinkedHashMap<>();
        private MethodConfidence methodConfidence = MethodConfidence.MEDIUM;

        public Builder put(String name, double value) {
            values.put(name, value);
            return this;
        }

        public Builder confidence(MethodConfidence confidence) {
            this.methodConfidence = confidence;
            return this;
        }

        public AccuracyMetrics build() {
            return new AccuracyMetrics(values, methodConfidence);
        }
    }
}
