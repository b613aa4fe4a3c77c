package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distinct values per column, used to populate value-set filter pickers. Values are trimmed, blank
 * cells are skipped and first-seen order is kept; callers may re-sort for display.
 *
 * <p>The index is memoized against the {@link RecordStore} version and rebuilt lazily after any
 * change to the rows.
 */
@Slf4j
public class ColumnValueIndex {

    private Map<String, List<String>> valuesByColumn = Map.of();
    private long indexedVersion = -1;

    /** Distinct non-blank values of one column, in first-seen order. */
    public static List<String> distinctValues(List<SheetRecord> records, String column) {
        Set<String> values = new LinkedHashSet<>();
        for (SheetRecord record : records) {
            String value = CellValues.stringify(record.get(column)).trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }

    /** Rebuilds the index if the store changed since the last build. */
    public synchronized void refresh(RecordStore store) {
        long version = store.getVersion();
        if (version == indexedVersion) {
            return;
        }
        rebuild(store.records());
        indexedVersion = version;
    }

    public synchronized void rebuild(List<SheetRecord> records) {
        Map<String, Set<String>> collected = new LinkedHashMap<>();
        for (SheetRecord record : records) {
            record
                    .getFields()
                    .forEach(
                            (column, raw) -> {
                                Set<String> values = collected.computeIfAbsent(column, c -> new LinkedHashSet<>());
                                String value = CellValues.stringify(raw).trim();
                                if (!value.isEmpty()) {
                                    values.add(value);
                                }
                            });
        }
        Map<String, List<String>> built = new LinkedHashMap<>();
        collected.forEach((column, values) -> built.put(column, List.copyOf(values)));
        valuesByColumn = built;
        log.debug("Indexed distinct values for {} columns over {} records", built.size(), records.size());
    }

    public synchronized List<String> valuesFor(String column) {
        return valuesByColumn.getOrDefault(column, List.of());
    }

    public synchronized List<String> columns() {
        return new ArrayList<>(valuesByColumn.keySet());
    }
}
