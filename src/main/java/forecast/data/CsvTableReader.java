package forecast.data;

import forecast.error.EmptyInputException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link DataTable} from delimited text. Expected: a header line, then one row per period.
 * <p>
 * Delimiter is comma, semicolon or tab, except inside double quotes; lines starting with {@code #}
 * are skipped and a leading byte order mark is dropped. Cells that parse as numbers become
 * {@link Double}, empty cells become {@code null}, anything else stays a string.
 */
public final class CsvTableReader {

    private CsvTableReader() {
    }

    public static DataTable read(Path path) throws IOException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    public static DataTable read(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> header = null;
        List<Map<String, Object>> rows = new ArrayList<>();
        String line;
        while ((line = in.readLine()) != null) {
            if (header == null && line.startsWith("\uFEFF")) line = line.substring(1);
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            List<String> parts = split(trimmed);
            if (header == null) {
                header = new ArrayList<>(parts.size());
                for (String p : parts) header.add(unquote(p.trim()));
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int j = 0; j < header.size(); j++) {
                row.put(header.get(j), j < parts.size() ? cell(parts.get(j)) : null);
            }
            rows.add(row);
        }
        if (header == null) throw new EmptyInputException("Empty file");
        return new DataTable(header, rows);
    }

    static List<String> split(String line) {
        List<String> parts = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                cur.append(c);
            } else if (!quoted && (c == ',' || c == ';' || c == '\t')) {
                parts.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        parts.add(cur.toString());
        return parts;
    }

    static Object cell(String raw) {
        String s = unquote(raw.trim());
        if (s.isEmpty() || s.equalsIgnoreCase("nan") || s.equalsIgnoreCase("null")) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return s; // dates, labels
        }
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) return s.substring(1, s.length() - 1);
        return s;
    }
}
