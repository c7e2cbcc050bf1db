package forecast.ml;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link ForecastResult} as plain text for reports and the command line.
 */
public final class ForecastFormatter {

    private ForecastFormatter() {
    }

    public static String format(ForecastResult result) {
        Objects.requireNonNull(result, "result");
        StringBuilder sb = new StringBuilder();
        String method = result.getMethod().getDisplayName();

        sb.append(method).append(" Forecast\n\n");

        sb.append("Forecast Summary:\n");
        sb.append("- Method: ").append(method).append('\n');
        sb.append("- Periods: ").append(result.getForecastHorizon()).append('\n');
        sb.append("- Trend: ").append(titleCase(result.getTrendDirection().getLabel())).append('\n');
        sb.append("- Seasonal: ").append(result.isSeasonalDetected() ? "Yes" : "No").append('\n');
        sb.append("- Last Value: ").append(money(result.getLastActualValue())).append("\n\n");

        sb.append("Forecast Values:\n");
        List<String> dates = result.getForecastDates();
        for (int i = 0; i < dates.size(); i++) {
            sb.append("- ").append(dates.get(i)).append(": ")
                .append(money(result.getForecastValues().get(i)))
                .append(" (").append(money(result.getConfidenceLower().get(i)))
                .append(" - ").append(money(result.getConfidenceUpper().get(i))).append(")\n");
        }

        sb.append("\nAccuracy Metrics:\n");
        AccuracyMetrics metrics = result.getAccuracyMetrics();
        for (Map.Entry<String, Double> e : metrics.getValues().entrySet()) {
            sb.append("- ").append(titleCase(e.getKey())).append(": ")
                .append(String.format(Locale.US, "%.3f", e.getValue())).append('\n');
        }
        sb.append("- Method Confidence: ").append(metrics.getMethodConfidence().getLabel()).append('\n');

        sb.append("\nKey Insights:\n");
        sb.append("- ").append(trendInsight(result.getTrendDirection())).append('\n');
        if (result.isSeasonalDetected()) {
            sb.append("- Seasonal patterns incorporated in forecast\n");
        }
        return sb.toString();
    }

    static String trendInsight(TrendDirection direction) {
        switch (direction) {
            case INCREASING:
                return "Positive growth trend detected";
            case DECREASING:
                return "Declining trend detected";
            default:
                return "Stable trend with minimal change";
        }
    }

    /** "final_trend" → "Final Trend" */
    static String titleCase(String snake) {
        StringBuilder sb = new StringBuilder(snake.length());
        for (String word : snake.split("_")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    // no currency symbol: the target column is not necessarily money
    private static String money(double v) {
        return String.format(Locale.US, "%,.2f", v);
    }
}
