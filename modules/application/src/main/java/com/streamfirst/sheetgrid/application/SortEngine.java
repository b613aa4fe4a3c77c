package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stable single-column sort. Rows with equal keys keep their relative input order in both
 * directions, so editing one row does not reshuffle unrelated rows on re-sort.
 *
 * <p>Ordering of non-empty cells: numeric values before text, numbers compared numerically, text
 * compared case-insensitively. Null and blank cells always go last, in either direction.
 */
public class SortEngine {

    private static final Comparator<Object> CELL_ORDER = SortEngine::compareCells;

    public List<SheetRecord> apply(List<SheetRecord> records, String sortBy, SortDirection direction) {
        if (sortBy == null) {
            return List.copyOf(records);
        }
        List<SheetRecord> present = new ArrayList<>(records.size());
        List<SheetRecord> blank = new ArrayList<>();
        for (SheetRecord record : records) {
            (CellValues.isBlank(record.get(sortBy)) ? blank : present).add(record);
        }

        Comparator<SheetRecord> comparator =
                Comparator.<SheetRecord, Object>comparing(r -> r.get(sortBy), CELL_ORDER);
        if (direction == SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        // List.sort is a stable merge sort
        present.sort(comparator);
        present.addAll(blank);
        return List.copyOf(present);
    }

    /**
     * Numbers rank before text when only one side parses as a number. Comparing such mixed pairs as
     * text would not be transitive: {@code 9 < 10} numerically, while {@code "10" < "5x" < "9"} as
     * text, which closes a cycle and breaks the {@link Comparator} contract {@link List#sort} relies on.
     */
    static int compareCells(Object left, Object right) {
        Optional<BigDecimal> leftNumber = CellValues.parseNumber(left);
        Optional<BigDecimal> rightNumber = CellValues.parseNumber(right);
        if (leftNumber.isPresent() && rightNumber.isPresent()) {
            return leftNumber.get().compareTo(rightNumber.get());
        }
        if (leftNumber.isPresent() != rightNumber.isPresent()) {
            return leftNumber.isPresent() ? -1 : 1;
        }
        return String.CASE_INSENSITIVE_ORDER.compare(
                CellValues.stringify(left), CellValues.stringify(right));
    }
}
