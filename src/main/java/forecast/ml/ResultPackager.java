package forecast.ml;

import forecast.data.PreparedSeries;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/** Attaches dates and series metadata to an engine's output. */
public final class ResultPackager {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private ResultPackager() {
    }

    public static ForecastResult assemble(MethodVariant method, EngineOutput output, PreparedSeries series,
                                          int periodDays) {
        return new ForecastResult(
            method,
            toList(output.getValues()),
            forecastDates(series.lastTimestamp(), output.horizon(), periodDays),
            toList(output.getUpper()),
            toList(output.getLower()),
            output.getMetrics(),
            output.isSeasonalDetected(),
            output.getTrendDirection(),
            series.lastValue(),
            output.horizon());
    }

    /** Step h lands {@code periodDays * h} days after the last observation, whatever the real cadence. */
    static List<String> forecastDates(LocalDateTime last, int horizon, int periodDays) {
        List<String> dates = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            dates.add(last.plusDays((long) periodDays * h).format(DATE));
        }
        return dates;
    }

    private static List<Double> toList(double[] a) {
        List<Double> out = new ArrayList<>(a.length);
        for (double v : a) out.add(v);
        return out;
    }
}
