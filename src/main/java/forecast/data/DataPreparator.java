package forecast.data;

import forecast.error.DuplicateTimestampException;
import forecast.error.EmptyInputException;
import forecast.error.ForecastException;
import forecast.error.InsufficientDataException;
import forecast.error.MissingColumnException;
import forecast.error.NonNumericTargetException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Validates a raw table and extracts the (timestamp, target) series in ascending time order.
 * <p>
 * Validation runs before any parsing so a bad table fails without partial work:
 * empty table, missing column, too few rows, non-numeric target. Rows whose target is missing are
 * dropped and counted. The input table is never modified.
 */
public class DataPreparator {

    private final int minDataPoints;

    public DataPreparator(int minDataPoints) {
        if (minDataPoints < 1) throw new IllegalArgumentException("minDataPoints must be >= 1");
        this.minDataPoints = minDataPoints;
    }

    public PreparedSeries prepare(DataTable table, String targetColumn, String dateColumn) {
        validate(table, targetColumn, dateColumn);

        List<Row> rows = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            LocalDateTime ts = DateParser.parse(table.get(i, dateColumn));
            Number target = (Number) table.get(i, targetColumn);
            rows.add(new Row(ts, target));
        }
        // List.sort is stable: equal timestamps keep table order
        rows.sort(Comparator.comparing(r -> r.timestamp));

        List<TimeSeriesPoint> points = new ArrayList<>(rows.size());
        int missing = 0;
        for (Row r : rows) {
            if (r.target == null || Double.isNaN(r.target.doubleValue())) {
                missing++;
                continue;
            }
            double v = r.target.doubleValue();
            if (Double.isInfinite(v)) {
                throw new ForecastException("Non-finite value " + v + " in column '" + targetColumn + "' at " + r.timestamp);
            }
            if (!points.isEmpty() && points.get(points.size() - 1).getTimestamp().equals(r.timestamp)) {
                throw new DuplicateTimestampException("Duplicate timestamp " + r.timestamp + " in column '" + dateColumn + "'");
            }
            points.add(new TimeSeriesPoint(r.timestamp, v));
        }
        if (points.size() < minDataPoints) {
            throw new InsufficientDataException("Insufficient data points. Need at least " + minDataPoints
                + " usable rows, got " + points.size() + " (" + missing + " missing)");
        }
        return new PreparedSeries(points, missing);
    }

    private void validate(DataTable table, String targetColumn, String dateColumn) {
        if (table == null || table.isEmpty()) {
            throw new EmptyInputException("Data cannot be empty");
        }
        if (targetColumn == null || !table.hasColumn(targetColumn)) {
            throw new MissingColumnException("Target column '" + targetColumn + "' not found in data");
        }
        if (dateColumn == null || !table.hasColumn(dateColumn)) {
            throw new MissingColumnException("Date column '" + dateColumn + "' not found in data");
        }
        if (table.rowCount() < minDataPoints) {
            throw new InsufficientDataException("Insufficient data points. Need at least " + minDataPoints
                + ", got " + table.rowCount());
        }
        if (!table.isNumeric(targetColumn)) {
            throw new NonNumericTargetException("Target column '" + targetColumn + "' must be numeric");
        }
    }

    public int getMinDataPoints() { return minDataPoints; }

    private static final class Row {
        final LocalDateTime timestamp;
        final Number target;

        Row(LocalDateTime timestamp, Number target) {
            this.timestamp = timestamp;
            this.target = target;
        }
    }
}
