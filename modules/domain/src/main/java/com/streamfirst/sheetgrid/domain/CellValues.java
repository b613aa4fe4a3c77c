package com.streamfirst.sheetgrid.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient conversions for spreadsheet cell values. Sheet cells arrive as strings, numbers, booleans
 * or date-like strings; none of these helpers throw on malformed input, they report "no value"
 * instead.
 */
public final class CellValues {

    private static final List<DateTimeFormatter> DATE_FORMATS =
            List.of(
                    DateTimeFormatter.ISO_LOCAL_DATE,
                    DateTimeFormatter.ofPattern("d/M/uuuu", Locale.ENGLISH),
                    DateTimeFormatter.ofPattern("d-M-uuuu", Locale.ENGLISH),
                    DateTimeFormatter.ofPattern("d MMM uuuu", Locale.ENGLISH),
                    DateTimeFormatter.ofPattern("d-MMM-uuuu", Locale.ENGLISH));

    private CellValues() {}

    /** Renders a cell the way it is displayed and searched; {@code null} becomes the empty string. */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    /** True for {@code null} and for values whose string form is blank. */
    public static boolean isBlank(Object value) {
        return stringify(value).isBlank();
    }

    /**
     * Parses a numeric cell. Grouping commas and surrounding whitespace are ignored, anything else
     * that is not a plain decimal number yields empty.
     */
    public static Optional<BigDecimal> parseNumber(Object value) {
        if (value == null || value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Integer || value instanceof Long) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        String text = value.toString().trim().replace(",", "");
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a date-like cell. Accepts ISO dates and date-times plus the day-first layouts used in the
     * sheets ({@code 15/04/2025}, {@code 15-04-2025}, {@code 15 Apr 2025}).
     */
    public static Optional<LocalDate> parseDate(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
