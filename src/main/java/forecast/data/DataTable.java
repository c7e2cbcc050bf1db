package forecast.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw tabular input: named columns and rows of loosely typed cells.
 * <p>
 * Cells are {@link Number}, {@link String}, {@link java.time.LocalDate},
 * {@link java.time.LocalDateTime} or {@code null} for a missing value.
 */
public final class DataTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public DataTable(List<String> columns, List<Map<String, Object>> rows) {
        if (columns == null || rows == null) throw new IllegalArgumentException("columns and rows required");
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            // LinkedHashMap instead of Map.copyOf: cells may be null
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public List<String> getColumns() { return columns; }
    public List<Map<String, Object>> getRows() { return rows; }
    public int rowCount() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    /** Cell at (row, column); {@code null} when missing. */
    public Object get(int row, String column) {
        return rows.get(row).get(column);
    }

    /** True when the column holds at least one value and every non-null cell is a {@link Number}. */
    public boolean isNumeric(String column) {
        boolean seen = false;
        for (Map<String, Object> row : rows) {
            Object v = row.get(column);
            if (v == null) continue;
            if (!(v instanceof Number)) return false;
            seen = true;
        }
        return seen;
    }

    /** Incrementally builds a table, one row at a time in column order. */
    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = new ArrayList<>(columns);
        }

        public Builder row(Object... cells) {
            if (cells.length != columns.size()) {
                throw new IllegalArgumentException("Expected " + columns.size() + " cells, got " + cells.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < cells.length; i++) row.put(columns.get(i), cells[i]);
            rows.add(row);
            return this;
        }

        public Builder row(Map<String, Object> row) {
            rows.add(new LinkedHashMap<>(row));
            return this;
        }

        public DataTable build() {
            return new DataTable(columns, rows);
        }
    }
}
