package forecast;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import forecast.data.DataTable;
import forecast.ml.MethodVariant;
import forecast.ml.TimeSeriesForecaster;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Body of {@code POST /api/forecast}:
 * <pre>
 * {"rows": [{"Date": "2024-01-31", "Revenue": 120.5}, ...],
 *  "targetColumn": "Revenue", "dateColumn": "Date",
 *  "periods": 6, "confidenceLevel": 0.95, "method": "LINEAR_REGRESSION"}
 * </pre>
 * Only {@code rows} and {@code targetColumn} are required.
 */
final class ForecastRequest {

    static final String DEFAULT_DATE_COLUMN = "Date";
    static final int DEFAULT_PERIODS = 6;

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private final DataTable table;
    private final String targetColumn;
    private final String dateColumn;
    private final int periods;
    private final double confidenceLevel;
    /** Forced method; null lets the data decide. */
    private final MethodVariant method;

    private ForecastRequest(DataTable table, String targetColumn, String dateColumn, int periods,
                            double confidenceLevel, MethodVariant method) {
        this.table = table;
        this.targetColumn = targetColumn;
        this.dateColumn = dateColumn;
        this.periods = periods;
        this.confidenceLevel = confidenceLevel;
        this.method = method;
    }

    /**
     * @throws IllegalArgumentException when the body is missing, not JSON, or lacks a required field
     */
    static ForecastRequest parse(Gson gson, String body) {
        if (body == null || body.isBlank()) throw new IllegalArgumentException("Missing request body");
        Map<String, Object> req;
        try {
            req = gson.fromJson(body, MAP_TYPE);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
        }
        if (req == null) throw new IllegalArgumentException("Invalid JSON");

        Object rowsObj = req.get("rows");
        if (!(rowsObj instanceof List<?>)) throw new IllegalArgumentException("Missing or invalid 'rows' array");
        DataTable table = toTable((List<?>) rowsObj);

        Object target = req.get("targetColumn");
        if (!(target instanceof String) || ((String) target).isBlank()) {
            throw new IllegalArgumentException("Missing 'targetColumn'");
        }
        String dateColumn = req.get("dateColumn") instanceof String ? (String) req.get("dateColumn") : DEFAULT_DATE_COLUMN;
        int periods = getNumber(req, "periods", DEFAULT_PERIODS).intValue();
        double confidence = getNumber(req, "confidenceLevel", TimeSeriesForecaster.DEFAULT_CONFIDENCE_LEVEL).doubleValue();
        return new ForecastRequest(table, (String) target, dateColumn, periods, confidence, parseMethod(req.get("method")));
    }

    private static DataTable toTable(List<?> rows) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Object o : rows) {
            if (!(o instanceof Map<?, ?>)) throw new IllegalArgumentException("Each row must be a JSON object");
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                String key = String.valueOf(e.getKey());
                columns.add(key);
                row.put(key, e.getValue());
            }
            out.add(row);
        }
        return new DataTable(new ArrayList<>(columns), out);
    }

    private static Number getNumber(Map<String, Object> req, String key, Number def) {
        Object v = req.get(key);
        if (v == null) return def;
        if (!(v instanceof Number)) throw new IllegalArgumentException("'" + key + "' must be a number");
        return (Number) v;
    }

    private static MethodVariant parseMethod(Object raw) {
        if (raw == null) return null;
        String name = String.valueOf(raw).trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return MethodVariant.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown method '" + raw + "'", e);
        }
    }

    DataTable getTable() { return table; }
    String getTargetColumn() { return targetColumn; }
    String getDateColumn() { return dateColumn; }
    int getPeriods() { return periods; }
    double getConfidenceLevel() { return confidenceLevel; }
    MethodVariant getMethod() { return method; }
}
