package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the raw row set of the active view. The set is swapped wholesale on view switch or refresh;
 * afterwards only single cells change, through optimistic application and rollback of edits.
 *
 * <p>Every swap starts a new generation. Work started against an older generation (an in-flight
 * submission, a slow fetch) can detect that the rows it targeted are gone.
 */
@Slf4j
public class RecordStore {

    private ViewId viewId;
    private long generation;
    private long version;
    private List<SheetRecord> records = new ArrayList<>();
    private Map<RecordId, Integer> positions = new HashMap<>();

    /**
     * Point-in-time copy of the rows, used to roll back optimistic changes.
     *
     * @param generation the generation the copy was taken from
     */
    public record Snapshot(ViewId viewId, long generation, List<SheetRecord> records) {
        public Snapshot {
            records = List.copyOf(records);
        }

        /** Value of a cell at snapshot time, null when the record or column is absent. */
        public Object valueOf(RecordId recordId, String fieldName) {
            return records.stream()
                    .filter(r -> r.getId().equals(recordId))
                    .findFirst()
                    .map(r -> r.get(fieldName))
                    .orElse(null);
        }
    }

    /**
     * Replaces the whole row set.
     *
     * @throws IllegalArgumentException if two rows share the same business identity
     */
    public synchronized void replaceAll(ViewId newViewId, List<SheetRecord> newRecords) {
        Map<RecordId, Integer> newPositions = new HashMap<>();
        for (int i = 0; i < newRecords.size(); i++) {
            RecordId id = newRecords.get(i).getId();
            if (newPositions.putIfAbsent(id, i) != null) {
                throw new IllegalArgumentException(
                        "Duplicate record identity '" + id + "' in view '" + newViewId + "'");
            }
        }
        this.viewId = newViewId;
        this.records = new ArrayList<>(newRecords);
        this.positions = newPositions;
        this.generation++;
        this.version++;
        log.info("Loaded {} records for view {} (generation {})", records.size(), viewId, generation);
    }

    public synchronized ViewId getViewId() {
        return viewId;
    }

    public synchronized long getGeneration() {
        return generation;
    }

    /** Increases on every change, including single-cell updates. */
    public synchronized long getVersion() {
        return version;
    }

    /** Immutable copy of the rows in load order. */
    public synchronized List<SheetRecord> records() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized Optional<SheetRecord> find(RecordId recordId) {
        Integer position = positions.get(recordId);
        return position == null ? Optional.empty() : Optional.of(records.get(position));
    }

    /** Current value of a cell, null when the record or column is absent. */
    public synchronized Object valueOf(RecordId recordId, String fieldName) {
        return find(recordId).map(r -> r.get(fieldName)).orElse(null);
    }

    /**
     * Writes one cell.
     *
     * @return true if the record exists and was updated
     */
    public synchronized boolean apply(RecordId recordId, String fieldName, Object value) {
        Integer position = positions.get(recordId);
        if (position == null) {
            log.debug("Ignoring update of {}/{}: record not loaded", recordId, fieldName);
            return false;
        }
        records.set(position, records.get(position).with(fieldName, value));
        version++;
        return true;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(viewId, generation, records);
    }

    /**
     * Restores rows from a snapshot of the current generation.
     *
     * @return false if the store was swapped since the snapshot was taken; nothing is restored then
     */
    public synchronized boolean restore(Snapshot snapshot) {
        if (!isCurrent(snapshot)) {
            log.warn(
                    "Not restoring snapshot of generation {}: store is at generation {}",
                    snapshot.generation(),
                    generation);
            return false;
        }
        this.records = new ArrayList<>(snapshot.records());
        version++;
        return true;
    }

    /** True if the snapshot was taken from the row set that is still loaded. */
    public synchronized boolean isCurrent(Snapshot snapshot) {
        return snapshot.generation() == generation && Objects.equals(snapshot.viewId(), viewId);
    }
}
