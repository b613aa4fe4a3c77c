package com.streamfirst.sheetgrid.domain;

import lombok.Value;
import lombok.With;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Complete filter and sort configuration of a table view. Immutable; every mutator returns a new
 * state so that derived views stay pure functions of (records, state).
 */
@Value
public class FilterState {

    public static final FilterState EMPTY =
            new FilterState("", Map.of(), null, SortDirection.ASC);

    /** Free-text term matched case-insensitively against every column */
    @With String globalSearch;

    /** Per-column filters in the order they were first set */
    Map<String, ColumnFilter> columnFilters;

    /** Column to sort by, or null to keep input order */
    @With String sortBy;

    @With SortDirection sortDirection;

    public FilterState(
            String globalSearch,
            Map<String, ColumnFilter> columnFilters,
            String sortBy,
            SortDirection sortDirection) {
        this.globalSearch = globalSearch == null ? "" : globalSearch;
        this.columnFilters =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNull(columnFilters, "Column filters cannot be null")));
        this.sortBy = sortBy;
        this.sortDirection = sortDirection == null ? SortDirection.ASC : sortDirection;
    }

    /** Sets or replaces the filter of one column. */
    public FilterState withColumnFilter(String column, ColumnFilter filter) {
        Objects.requireNonNull(column, "Column cannot be null");
        Objects.requireNonNull(filter, "Filter cannot be null");
        Map<String, ColumnFilter> updated = new LinkedHashMap<>(columnFilters);
        updated.put(column, filter);
        return new FilterState(globalSearch, updated, sortBy, sortDirection);
    }

    public FilterState withoutColumnFilter(String column) {
        if (!columnFilters.containsKey(column)) {
            return this;
        }
        Map<String, ColumnFilter> updated = new LinkedHashMap<>(columnFilters);
        updated.remove(column);
        return new FilterState(globalSearch, updated, sortBy, sortDirection);
    }

    public FilterState withSort(String column, SortDirection direction) {
        return new FilterState(globalSearch, columnFilters, column, direction);
    }

    /**
     * Sorting by the current sort column flips the direction; any other column starts ascending.
     */
    public FilterState toggleSort(String column) {
        if (column != null && column.equals(sortBy)) {
            return withSortDirection(sortDirection.toggle());
        }
        return withSort(column, SortDirection.ASC);
    }

    public boolean hasGlobalSearch() {
        return !globalSearch.isBlank();
    }

    /** True when any row could be excluded by this state. Sorting alone does not count. */
    public boolean hasActiveFilters() {
        return hasGlobalSearch() || columnFilters.values().stream().anyMatch(ColumnFilter::isActive);
    }

    /** One line per active filter, e.g. {@code Global: "motor"} or {@code Gross premium: 0 - 5000}. */
    public List<String> summary() {
        List<String> lines = new ArrayList<>();
        if (hasGlobalSearch()) {
            lines.add("Global: \"" + globalSearch + "\"");
        }
        columnFilters.forEach(
                (column, filter) -> {
                    if (filter.isActive()) {
                        lines.add(column + ": " + filter.describe());
                    }
                });
        return lines;
    }
}
