package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Applies the global search and the per-column filters of a {@link FilterState}. The result keeps
 * the input order. Malformed cell values never raise; they simply fail to match active filters.
 *
 * <p>Applying the same state twice yields the same rows as applying it once.
 */
public class FilterEngine {

    public List<SheetRecord> apply(List<SheetRecord> records, FilterState state) {
        if (!state.hasActiveFilters()) {
            return List.copyOf(records);
        }
        Predicate<SheetRecord> predicate = toPredicate(state);
        return records.stream().filter(predicate).toList();
    }

    /** All active criteria AND-ed together. */
    Predicate<SheetRecord> toPredicate(FilterState state) {
        Predicate<SheetRecord> predicate = record -> true;
        if (state.hasGlobalSearch()) {
            String term = state.getGlobalSearch().trim().toLowerCase(Locale.ROOT);
            predicate = predicate.and(record -> matchesGlobal(record, term));
        }
        for (Map.Entry<String, ColumnFilter> entry : state.getColumnFilters().entrySet()) {
            ColumnFilter filter = entry.getValue();
            if (filter.isActive()) {
                String column = entry.getKey();
                predicate = predicate.and(record -> filter.matches(record.get(column)));
            }
        }
        return predicate;
    }

    private static boolean matchesGlobal(SheetRecord record, String lowerCaseTerm) {
        for (Object value : record.getFields().values()) {
            if (CellValues.stringify(value).toLowerCase(Locale.ROOT).contains(lowerCaseTerm)) {
                return true;
            }
        }
        return false;
    }
}
