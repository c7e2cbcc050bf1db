package forecast.data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Clean, time-ordered series ready for forecasting.
 * <p>
 * Invariants: at least one point, finite values, strictly increasing timestamps.
 */
public final class PreparedSeries {

    private final List<TimeSeriesPoint> points;
    private final int missingValues;

    public PreparedSeries(List<TimeSeriesPoint> points, int missingValues) {
        if (points == null || points.isEmpty()) throw new IllegalArgumentException("series must have at least one point");
        if (missingValues < 0) throw new IllegalArgumentException("missingValues must be >= 0");
        LocalDateTime prev = null;
        for (TimeSeriesPoint p : points) {
            if (!Double.isFinite(p.getValue())) {
                throw new IllegalArgumentException("non-finite value at " + p.getTimestamp());
            }
            if (prev != null && !p.getTimestamp().isAfter(prev)) {
                throw new IllegalArgumentException("timestamps must be strictly increasing: " + prev + " -> " + p.getTimestamp());
            }
            prev = p.getTimestamp();
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.missingValues = missingValues;
    }

    public PreparedSeries(List<TimeSeriesPoint> points) {
        this(points, 0);
    }

    /** Series of the given values, one per day starting at {@code start}. */
    public static PreparedSeries of(LocalDateTime start, double... values) {
        List<TimeSeriesPoint> pts = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) pts.add(new TimeSeriesPoint(start.plusDays(i), values[i]));
        return new PreparedSeries(pts);
    }

    public List<TimeSeriesPoint> getPoints() { return points; }
    public int size() { return points.size(); }

    /** Rows dropped for a missing target while this series was prepared. */
    public int getMissingValues() { return missingValues; }

    /** Values in time order (fresh copy). */
    public double[] values() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) out[i] = points.get(i).getValue();
        return out;
    }

    public TimeSeriesPoint lastPoint() {
        return points.get(points.size() - 1);
    }

    public double lastValue() {
        return lastPoint().getValue();
    }

    public LocalDateTime lastTimestamp() {
        return lastPoint().getTimestamp();
    }
}
