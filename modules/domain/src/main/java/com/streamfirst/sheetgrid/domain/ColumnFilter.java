package com.streamfirst.sheetgrid.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A filter attached to a single column. Every variant decides for itself whether it is active; an
 * inactive filter never excludes a row.
 */
public sealed interface ColumnFilter
        permits ColumnFilter.ValueSet,
                ColumnFilter.Text,
                ColumnFilter.DateRange,
                ColumnFilter.NumberRange {

    boolean isActive();

    /** Tests one cell value. Only consulted while the filter is active. */
    boolean matches(Object cellValue);

    /** Short human readable description for filter summaries. */
    String describe();

    /**
     * Keeps rows whose stringified cell is one of the selected values. An empty selection is treated
     * as "no filter".
     */
    record ValueSet(Set<String> selected, boolean active) implements ColumnFilter {
        public ValueSet {
            Objects.requireNonNull(selected, "Selected values cannot be null");
            selected = Collections.unmodifiableSet(new LinkedHashSet<>(selected));
        }

        public static ValueSet of(String... values) {
            return new ValueSet(new LinkedHashSet<>(List.of(values)), true);
        }

        @Override
        public boolean isActive() {
            return active && !selected.isEmpty();
        }

        @Override
        public boolean matches(Object cellValue) {
            return selected.contains(CellValues.stringify(cellValue).trim());
        }

        @Override
        public String describe() {
            return selected.size() + " values";
        }
    }

    /** Case-insensitive substring match on the stringified cell. */
    record Text(String term, boolean active) implements ColumnFilter {
        public Text {
            term = term == null ? "" : term;
        }

        public static Text of(String term) {
            return new Text(term, true);
        }

        @Override
        public boolean isActive() {
            return active && !term.isBlank();
        }

        @Override
        public boolean matches(Object cellValue) {
            return CellValues.stringify(cellValue)
                    .toLowerCase(Locale.ROOT)
                    .contains(term.trim().toLowerCase(Locale.ROOT));
        }

        @Override
        public String describe() {
            return "\"" + term + "\"";
        }
    }

    /**
     * Inclusive date range. A missing bound leaves that side open; a cell that does not parse as a
     * date never matches.
     */
    record DateRange(LocalDate from, LocalDate to) implements ColumnFilter {
        public static DateRange between(LocalDate from, LocalDate to) {
            return new DateRange(from, to);
        }

        @Override
        public boolean isActive() {
            return from != null || to != null;
        }

        @Override
        public boolean matches(Object cellValue) {
            Optional<LocalDate> date = CellValues.parseDate(cellValue);
            if (date.isEmpty()) {
                return false;
            }
            LocalDate d = date.get();
            return (from == null || !d.isBefore(from)) && (to == null || !d.isAfter(to));
        }

        @Override
        public String describe() {
            return (from == null ? "start" : from.toString()) + " - " + (to == null ? "end" : to);
        }
    }

    /**
     * Inclusive numeric range. A missing bound leaves that side open; a non-numeric cell never
     * matches.
     */
    record NumberRange(BigDecimal min, BigDecimal max) implements ColumnFilter {
        public static NumberRange atLeast(BigDecimal min) {
            return new NumberRange(min, null);
        }

        public static NumberRange atMost(BigDecimal max) {
            return new NumberRange(null, max);
        }

        @Override
        public boolean isActive() {
            return min != null || max != null;
        }

        @Override
        public boolean matches(Object cellValue) {
            Optional<BigDecimal> number = CellValues.parseNumber(cellValue);
            if (number.isEmpty()) {
                return false;
            }
            BigDecimal n = number.get();
            return (min == null || n.compareTo(min) >= 0) && (max == null || n.compareTo(max) <= 0);
        }

        @Override
        public String describe() {
            return (min == null ? "min" : min.toPlainString())
                    + " - "
                    + (max == null ? "max" : max.toPlainString());
        }
    }
}
