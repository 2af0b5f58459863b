package com.projectedjournal.cashgrid.grid;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Coercion of heterogeneous spreadsheet cells into numbers, dates and text.
 *
 * <p>Every coercion is lenient in the same way: a value that cannot be converted becomes
 * {@code null} ("missing") instead of raising.
 */
public final class CellValues {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("uuuu/MM/dd"),
            strict("MM/dd/uuuu"),
            strict("M/d/uuuu"),
            strict("dd-MMM-uuuu"),
            strict("d MMM uuuu"),
            strict("MMM d, uuuu"));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm"));

    private CellValues() {}

    public static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }

    /**
     * Converts a cell to a decimal. Numbers pass through; text must be a plain decimal literal
     * (surrounding whitespace allowed). NaN, infinities, booleans and anything else are missing.
     */
    public static BigDecimal toDecimal(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            try {
                return new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof String) {
            String trimmed = ((String) value).trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Converts a cell to a calendar date. Date-typed cells are truncated to their day; text is
     * tried against a fixed list of ISO, US and month-name formats. Numbers are never read as
     * dates.
     */
    public static LocalDate toDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Date) {
            return Instant.ofEpochMilli(((Date) value).getTime()).atZone(ZoneId.systemDefault()).toLocalDate();
        }
        if (value instanceof String) {
            return parseDate(((String) value).trim());
        }
        return null;
    }

    /** Text form of a cell, or {@code null} for blanks. Whole-number decimals drop their fraction. */
    public static String toText(Object value) {
        if (isBlank(value)) {
            return null;
        }
        if (value instanceof BigDecimal) {
            BigDecimal stripped = ((BigDecimal) value).stripTrailingZeros();
            return stripped.scale() <= 0 ? stripped.toBigInteger().toString() : stripped.toPlainString();
        }
        return value.toString().trim();
    }

    /**
     * A column is uniformly numeric when every non-blank cell is a {@link Number}. A column with no
     * non-blank cells at all also counts, the way spreadsheet readers type an empty column.
     */
    public static boolean isUniformlyNumeric(List<Object> column) {
        for (Object value : column) {
            if (isBlank(value)) {
                continue;
            }
            if (!(value instanceof Number)) {
                return false;
            }
        }
        return true;
    }

    private static LocalDate parseDate(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format).toLocalDate();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
