package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.SheetRecord;
import com.streamfirst.sheetgrid.domain.SortDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.streamfirst.sheetgrid.application.Records.*;
import static org.assertj.core.api.Assertions.assertThat;

class SortEngineTest {

    private final SortEngine engine = new SortEngine();

    @Test
    void testSortsNumericTextDescending() {
        assertThat(ids(engine.apply(amounts(), "amt", SortDirection.DESC))).containsExactly("P3", "P1", "P2");
    }

    @Test
    void testComparesNumbersNumericallyNotLexically() {
        List<SheetRecord> records = List.of(row("A", "amt", "9"), row("B", "amt", "1,000"), row("C", "amt", "80"));

        assertThat(ids(engine.apply(records, "amt", SortDirection.ASC))).containsExactly("A", "C", "B");
    }

    @Test
    void testEqualKeysKeepInputOrderInBothDirections() {
        List<SheetRecord> records =
                List.of(
                        row("A", "agent", "x"),
                        row("B", "agent", "y"),
                        row("C", "agent", "X"),
                        row("D", "agent", "y"),
                        row("E", "agent", "x"));

        assertThat(ids(engine.apply(records, "agent", SortDirection.ASC))).containsExactly("A", "C", "E", "B", "D");
        assertThat(ids(engine.apply(records, "agent", SortDirection.DESC))).containsExactly("B", "D", "A", "C", "E");
    }

    @Test
    void testBlankCellsGoLastInEitherDirection() {
        List<SheetRecord> records =
                List.of(row("A", "amt", ""), row("B", "amt", "5"), row("C"), row("D", "amt", "7"));

        assertThat(ids(engine.apply(records, "amt", SortDirection.ASC))).containsExactly("B", "D", "A", "C");
        assertThat(ids(engine.apply(records, "amt", SortDirection.DESC))).containsExactly("D", "B", "A", "C");
    }

    @Test
    void testNumbersRankBeforeText() {
        List<SheetRecord> records = List.of(row("A", "v", "beta"), row("B", "v", "10"), row("C", "v", "Alpha"));

        assertThat(ids(engine.apply(records, "v", SortDirection.ASC))).containsExactly("B", "C", "A");
    }

    @Test
    void testNoSortColumnKeepsInputOrder() {
        assertThat(ids(engine.apply(amounts(), null, SortDirection.DESC))).containsExactly("P1", "P2", "P3");
    }
}
