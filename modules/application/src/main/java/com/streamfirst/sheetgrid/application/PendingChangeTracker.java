package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Tracks local edits that the remote store has not confirmed, keyed by (record, field).
 *
 * <p>An entry exists only while the edited value differs from the last confirmed value or while it
 * is in flight. Editing a cell again before submission overwrites the entry (last writer wins);
 * editing a cell whose value is in flight queues the new value behind the in-flight one so it goes
 * out with the next batch.
 *
 * <p>Reads go through {@link #getDisplayValue}: the pending value if there is one, else the committed
 * value. The tracker has no network side effects.
 */
@Slf4j
public class PendingChangeTracker {

    private final BiFunction<RecordId, String, Object> committedValues;
    private final Map<RecordId, Map<String, PendingEdit>> edits = new LinkedHashMap<>();
    private final Map<CellKey, PendingEdit> queuedBehindInFlight = new HashMap<>();

    /**
     * @param committedValues lookup of the last confirmed value of a cell, used as the rollback target
     *     of new edits
     */
    public PendingChangeTracker(BiFunction<RecordId, String, Object> committedValues) {
        this.committedValues = Objects.requireNonNull(committedValues, "Committed value source cannot be null");
    }

    /** Records an edit, overwriting any earlier unsubmitted edit of the same cell. */
    public synchronized void setPending(RecordId recordId, String fieldName, String newValue) {
        CellKey cell = CellKey.of(recordId, fieldName);
        PendingEdit existing = find(cell);

        if (existing == null) {
            Object committed = committedValues.apply(recordId, fieldName);
            if (sameValue(newValue, committed)) {
                return;
            }
            put(PendingEdit.create(recordId, fieldName, newValue, committed));
            log.debug("Pending edit on {}", cell);
            return;
        }

        if (existing.isInFlight()) {
            queuedBehindInFlight.put(cell, PendingEdit.create(recordId, fieldName, newValue, existing.getPreviousValue()));
            log.debug("Queued edit on {} behind in-flight submission", cell);
            return;
        }

        if (sameValue(newValue, existing.getPreviousValue())) {
            remove(cell);
            log.debug("Edit on {} reverted to confirmed value", cell);
        } else {
            put(existing.withNewValue(newValue));
        }
    }

    /** The pending value of a cell if it has one, otherwise {@code committedValue}. */
    public synchronized Object getDisplayValue(RecordId recordId, String fieldName, Object committedValue) {
        CellKey cell = CellKey.of(recordId, fieldName);
        PendingEdit queued = queuedBehindInFlight.get(cell);
        if (queued != null) {
            return queued.getNewValue();
        }
        PendingEdit edit = find(cell);
        if (edit == null || edit.getState() == PendingEdit.State.FAILED) {
            return committedValue;
        }
        return edit.getNewValue();
    }

    /** Display value plus presentation status of a cell. */
    public synchronized CellDisplay display(RecordId recordId, String fieldName, Object committedValue) {
        CellKey cell = CellKey.of(recordId, fieldName);
        Object value = getDisplayValue(recordId, fieldName, committedValue);
        PendingEdit edit = find(cell);
        if (edit == null) {
            return CellDisplay.committed(value);
        }
        if (edit.getState() == PendingEdit.State.FAILED && !queuedBehindInFlight.containsKey(cell)) {
            return new CellDisplay(value, CellStatus.FAILED, edit.getErrorMessage());
        }
        return new CellDisplay(value, CellStatus.PENDING, null);
    }

    public synchronized CellStatus statusOf(RecordId recordId, String fieldName) {
        return display(recordId, fieldName, null).status();
    }

    /** Drops the edit of one cell. */
    public synchronized void clear(RecordId recordId, String fieldName) {
        remove(CellKey.of(recordId, fieldName));
    }

    /** Drops every edit of one record. */
    public synchronized void clear(RecordId recordId) {
        Map<String, PendingEdit> fields = edits.remove(recordId);
        if (fields != null) {
            fields.keySet().forEach(field -> queuedBehindInFlight.remove(CellKey.of(recordId, field)));
        }
    }

    /** Drops everything, including in-flight entries. Used when the row set is replaced. */
    public synchronized void clearAll() {
        edits.clear();
        queuedBehindInFlight.clear();
    }

    /**
     * Drops pending and failed edits and anything queued behind in-flight cells. In-flight entries
     * stay until their submission resolves.
     *
     * @return number of cells discarded
     */
    public synchronized int discardUnsubmitted() {
        int discarded = queuedBehindInFlight.size();
        queuedBehindInFlight.clear();
        for (PendingEdit edit : all()) {
            if (!edit.isInFlight()) {
                remove(edit.cellKey());
                discarded++;
            }
        }
        return discarded;
    }

    public synchronized boolean hasPending() {
        return !edits.isEmpty();
    }

    /** Number of cells with a tracked edit in any state. */
    public synchronized int count() {
        return edits.values().stream().mapToInt(Map::size).sum();
    }

    public synchronized int count(PendingEdit.State state) {
        return (int) all().stream().filter(e -> e.getState() == state).count();
    }

    /** Copy of all tracked edits grouped by record. */
    public synchronized Map<RecordId, Map<String, PendingEdit>> snapshot() {
        Map<RecordId, Map<String, PendingEdit>> copy = new LinkedHashMap<>();
        edits.forEach((id, fields) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        return Collections.unmodifiableMap(copy);
    }

    public synchronized PendingEdit get(RecordId recordId, String fieldName) {
        return find(CellKey.of(recordId, fieldName));
    }

    /**
     * Marks every {@link PendingEdit.State#PENDING PENDING} edit as submitting and returns them in the
     * order they were first made. In-flight and failed cells are not included.
     */
    synchronized List<PendingEdit> beginBatch(Instant submittedAt) {
        List<PendingEdit> batch = new ArrayList<>();
        for (PendingEdit edit : all()) {
            if (edit.getState() == PendingEdit.State.PENDING) {
                PendingEdit submitting = edit.markSubmitting(submittedAt);
                put(submitting);
                batch.add(submitting);
            }
        }
        return batch;
    }

    /** The store accepted the cell: drop the entry, promoting a queued follow-up edit if any. */
    synchronized void confirm(CellKey cell) {
        PendingEdit confirmed = find(cell);
        PendingEdit queued = queuedBehindInFlight.remove(cell);
        if (queued == null || confirmed == null || sameValue(queued.getNewValue(), confirmed.getNewValue())) {
            remove(cell);
            return;
        }
        put(PendingEdit.create(cell.recordId(), cell.fieldName(), queued.getNewValue(), confirmed.getNewValue()));
    }

    /**
     * The store rejected the cell: flag it as failed, or, if the user has edited it again in the
     * meantime, keep the newer value pending instead.
     */
    synchronized void fail(CellKey cell, String reason) {
        PendingEdit failed = find(cell);
        if (failed == null) {
            return;
        }
        PendingEdit queued = queuedBehindInFlight.remove(cell);
        if (queued != null) {
            log.debug("Rejected value on {} superseded by a newer edit", cell);
            put(queued);
            return;
        }
        put(failed.markFailed(reason));
    }

    /** The submission never reached the store: return its cells to pending. */
    synchronized void release(Collection<CellKey> cells) {
        for (CellKey cell : cells) {
            PendingEdit edit = find(cell);
            if (edit == null) {
                continue;
            }
            PendingEdit queued = queuedBehindInFlight.remove(cell);
            put(queued != null ? queued : edit.backToPending());
        }
    }

    /**
     * Returns failed cells to pending so the next submission sends their values again.
     *
     * @return number of cells requeued
     */
    public synchronized int retryFailed() {
        int retried = 0;
        for (PendingEdit edit : all()) {
            if (edit.getState() == PendingEdit.State.FAILED) {
                put(edit.backToPending().withErrorMessage(null));
                retried++;
            }
        }
        return retried;
    }

    private PendingEdit find(CellKey cell) {
        Map<String, PendingEdit> fields = edits.get(cell.recordId());
        return fields == null ? null : fields.get(cell.fieldName());
    }

    private void put(PendingEdit edit) {
        edits.computeIfAbsent(edit.getRecordId(), id -> new LinkedHashMap<>()).put(edit.getFieldName(), edit);
    }

    private void remove(CellKey cell) {
        Map<String, PendingEdit> fields = edits.get(cell.recordId());
        if (fields != null) {
            fields.remove(cell.fieldName());
            if (fields.isEmpty()) {
                edits.remove(cell.recordId());
            }
        }
        queuedBehindInFlight.remove(cell);
    }

    private List<PendingEdit> all() {
        List<PendingEdit> all = new ArrayList<>();
        edits.values().forEach(fields -> all.addAll(fields.values()));
        return all;
    }

    private static boolean sameValue(Object a, Object b) {
        return CellValues.stringify(a).equals(CellValues.stringify(b));
    }
}
