package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.RecordId;
import com.streamfirst.sheetgrid.domain.ViewId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.streamfirst.sheetgrid.application.Records.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordStoreTest {

    private static final ViewId MASTER = ViewId.of("Master");
    private static final RecordId P1 = RecordId.of("P1");

    @Test
    void testRejectsDuplicateIdentities() {
        RecordStore store = new RecordStore();

        assertThatThrownBy(() -> store.replaceAll(MASTER, List.of(row("P1"), row("P1"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("P1");
        assertThat(store.size()).isZero();
    }

    @Test
    void testRestoresASnapshotOfTheCurrentGeneration() {
        RecordStore store = new RecordStore();
        store.replaceAll(MASTER, Records.amounts());
        RecordStore.Snapshot snapshot = store.snapshot();

        store.apply(P1, "amt", "999");
        assertThat(store.valueOf(P1, "amt")).isEqualTo("999");
        assertThat(snapshot.valueOf(P1, "amt")).isEqualTo("100");

        assertThat(store.restore(snapshot)).isTrue();
        assertThat(store.valueOf(P1, "amt")).isEqualTo("100");
    }

    @Test
    void testIgnoresSnapshotsOfAReplacedRowSet() {
        RecordStore store = new RecordStore();
        store.replaceAll(MASTER, Records.amounts());
        RecordStore.Snapshot snapshot = store.snapshot();

        store.replaceAll(MASTER, List.of(row("P1", "amt", "1")));

        assertThat(store.isCurrent(snapshot)).isFalse();
        assertThat(store.restore(snapshot)).isFalse();
        assertThat(store.valueOf(P1, "amt")).isEqualTo("1");
    }

    @Test
    void testApplyToUnknownRecordIsANoOp() {
        RecordStore store = new RecordStore();
        store.replaceAll(MASTER, Records.amounts());
        long version = store.getVersion();

        assertThat(store.apply(RecordId.of("nope"), "amt", "1")).isFalse();
        assertThat(store.getVersion()).isEqualTo(version);
    }
}
