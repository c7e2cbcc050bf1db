package forecast.data;

import java.time.LocalDateTime;
import java.util.Objects;

/** One observation: timestamp and numeric value. */
public final class TimeSeriesPoint {

    private final LocalDateTime timestamp;
    private final double value;

    public TimeSeriesPoint(LocalDateTime timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public double getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeriesPoint)) return false;
        TimeSeriesPoint other = (TimeSeriesPoint) o;
        return Double.compare(value, other.value) == 0 && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return timestamp + "=" + value;
    }
}
