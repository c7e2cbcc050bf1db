package forecast.data;

import forecast.error.InvalidDateException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Turns date cells into timestamps. Accepts {@link LocalDate}, {@link LocalDateTime} and strings in
 * the usual spreadsheet layouts; month-only strings ({@code 2024-03}) map to the first of the month.
 */
public final class DateParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("MM/dd/yyyy")
    );

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private DateParser() {
    }

    public static LocalDateTime parse(Object cell) {
        if (cell == null) throw new InvalidDateException("Missing date value");
        if (cell instanceof LocalDateTime) return (LocalDateTime) cell;
        if (cell instanceof LocalDate) return ((LocalDate) cell).atStartOfDay();
        if (!(cell instanceof String)) {
            throw new InvalidDateException("Unsupported date value: " + cell + " (" + cell.getClass().getSimpleName() + ")");
        }
        String text = ((String) cell).trim();
        if (text.isEmpty()) throw new InvalidDateException("Missing date value");

        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, f);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, f).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        try {
            return YearMonth.parse(text, MONTH_FORMAT).atDay(1).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new InvalidDateException("Unparseable date: '" + text + "'");
        }
    }
}
