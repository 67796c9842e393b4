package com.shipdata.inference;

import com.shipdata.model.ColumnType;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure functions that classify a raw text value as a type candidate and turn it into the
 * canonical text DuckDB casts exactly.
 *
 * <p>Classification is strict: anything that would lose information when stored as a typed
 * value (leading zeros, a plus sign, integers beyond 64 bits) stays a string.
 */
public final class TypeInference {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("0|-?[1-9]\\d*");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][-+]?\\d+)?");
    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("(\\d{4})([-/])(\\d{1,2})\\2(\\d{1,2})");
    private static final Pattern PART_DATE_PATTERN = Pattern.compile("(\\d{1,2})([/.-])(\\d{1,2})\\2(\\d{4}|\\d{2})");
    // Microsecond precision at most; finer fractions would be truncated by the store.
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile(
            "(\\d{4})-(\\d{1,2})-(\\d{1,2})[T ](\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,6}))?)?");

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    // Two-digit years below this pivot land in the 2000s.
    private static final int TWO_DIGIT_YEAR_PIVOT = 70;

    private TypeInference() {
    }

    /**
     * Classify one raw value.
     *
     * @param raw raw text, may be null
     * @return type candidate, or null when the value is blank
     */
    public static ColumnType classify(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String v = raw.trim();

        if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) {
            return ColumnType.BOOLEAN;
        }
        if (INTEGER_PATTERN.matcher(v).matches()) {
            return classifyInteger(v);
        }
        if (DECIMAL_PATTERN.matcher(v).matches()) {
            try {
                return Double.isFinite(Double.parseDouble(v)) ? ColumnType.DOUBLE : ColumnType.STRING;
            } catch (NumberFormatException e) {
                return ColumnType.STRING;
            }
        }
        if (parseTimestamp(v) != null) {
            return ColumnType.TIMESTAMP;
        }
        if (parseIsoDate(v) != null) {
            return ColumnType.DATE;
        }
        DatePartEvidence evidence = datePartEvidence(v);
        if (evidence != null && (evidence.monthFirst() != null || evidence.dayFirst() != null)) {
            return ColumnType.DATE;
        }
        return ColumnType.STRING;
    }

    private static ColumnType classifyInteger(String v) {
        try {
            long value = Long.parseLong(v);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return ColumnType.INTEGER;
            }
            return ColumnType.BIG_INTEGER;
        } catch (NumberFormatException e) {
            // Beyond 64 bits: a double would round it.
            return ColumnType.STRING;
        }
    }

    /**
     * Read a day/month date such as {@code 03/04/2026} under both field orders.
     *
     * @param raw raw text
     * @return both readings (either may be null when invalid), or null if the text is not shaped
     *         like a day/month date
     */
    public static DatePartEvidence datePartEvidence(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        Matcher m = PART_DATE_PATTERN.matcher(raw.trim());
        if (!m.matches()) {
            return null;
        }
        int first = Integer.parseInt(m.group(1));
        int second = Integer.parseInt(m.group(3));
        int year = expandYear(m.group(4));
        return new DatePartEvidence(safeDate(year, first, second), safeDate(year, second, first));
    }

    /**
     * Produce the canonical text for a value already known to belong to a column of {@code type}.
     *
     * @param raw raw text
     * @param type resolved column type
     * @param order field order for day/month dates
     * @return canonical text, or null for blank input
     * @throws IllegalArgumentException if the value does not fit the type
     */
    public static String normalize(String raw, ColumnType type, DateOrder order) {
        if (isBlank(raw)) {
            return null;
        }
        if (type == ColumnType.STRING) {
            return raw;
        }
        String v = raw.trim();
        switch (type) {
            case BOOLEAN:
                return v.toLowerCase(Locale.ROOT);
            case INTEGER:
            case BIG_INTEGER:
            case DOUBLE:
                return v;
            case DATE: {
                LocalDate date = parseDate(v, order);
                if (date == null) {
                    throw new IllegalArgumentException("Not a date: " + v);
                }
                return date.toString();
            }
            case TIMESTAMP: {
                LocalDateTime ts = parseTimestamp(v);
                if (ts == null) {
                    LocalDate date = parseDate(v, order);
                    if (date == null) {
                        throw new IllegalArgumentException("Not a timestamp: " + v);
                    }
                    ts = date.atStartOfDay();
                }
                return formatTimestamp(ts);
            }
            default:
                throw new IllegalArgumentException("Unsupported type: " + type);
        }
    }

    /**
     * Format a timestamp the way DuckDB prints and parses it.
     *
     * @param ts timestamp
     * @return {@code yyyy-MM-dd HH:mm:ss[.fraction]}
     */
    public static String formatTimestamp(LocalDateTime ts) {
        return TIMESTAMP_FORMAT.format(ts);
    }

    /**
     * Human readable date used in ambiguity warnings, e.g. {@code Jan 02, 2026}.
     *
     * @param date date
     * @return display text
     */
    public static String display(LocalDate date) {
        return DISPLAY_FORMAT.format(date);
    }

    static LocalDate parseDate(String v, DateOrder order) {
        LocalDate iso = parseIsoDate(v);
        if (iso != null) {
            return iso;
        }
        DatePartEvidence evidence = datePartEvidence(v);
        if (evidence == null) {
            return null;
        }
        return order == DateOrder.DAY_FIRST ? evidence.dayFirst() : evidence.monthFirst();
    }

    static LocalDate parseIsoDate(String v) {
        Matcher m = ISO_DATE_PATTERN.matcher(v);
        if (!m.matches()) {
            return null;
        }
        return safeDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }

    static LocalDateTime parseTimestamp(String v) {
        Matcher m = TIMESTAMP_PATTERN.matcher(v);
        if (!m.matches()) {
            return null;
        }
        LocalDate date = safeDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        if (date == null) {
            return null;
        }
        try {
            int hour = Integer.parseInt(m.group(4));
            int minute = Integer.parseInt(m.group(5));
            int second = m.group(6) != null ? Integer.parseInt(m.group(6)) : 0;
            int nanos = 0;
            if (m.group(7) != null) {
                String fraction = (m.group(7) + "000000000").substring(0, 9);
                nanos = Integer.parseInt(fraction);
            }
            return LocalDateTime.of(date, LocalTime.of(hour, minute, second, nanos));
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int expandYear(String year) {
        int y = Integer.parseInt(year);
        if (year.length() == 2) {
            return y < TWO_DIGIT_YEAR_PIVOT ? 2000 + y : 1900 + y;
        }
        return y;
    }

    static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }

    /**
     * The two readings of a day/month date. A null side means that reading is not a valid date.
     *
     * @param monthFirst US reading
     * @param dayFirst EU reading
     */
    public record DatePartEvidence(LocalDate monthFirst, LocalDate dayFirst) {

        public boolean isAmbiguous() {
            return monthFirst != null && dayFirst != null && !monthFirst.equals(dayFirst);
        }
    }
}
