package com.streamfirst.sheetgrid.domain;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A locally applied, not yet confirmed change to one cell. The edit remembers the last confirmed
 * value so that a failed submission can be reverted cell by cell.
 */
@Value
public class PendingEdit {
    /** Where the edit sits in the submit/confirm cycle. */
    public enum State {
        /** Edited locally, not yet part of a submission */
        PENDING,
        /** Included in the batch that is currently in flight */
        SUBMITTING,
        /** The remote store rejected this cell; the local value was reverted */
        FAILED
    }

    @NonNull RecordId recordId;

    @NonNull String fieldName;

    /** Value the user entered; may be null to clear the cell */
    String newValue;

    /** Last confirmed value of the cell, restored on rollback */
    Object previousValue;

    /** When the edit was handed to the remote store, null until then */
    @With Instant submittedAt;

    @NonNull @With State state;

    /** Reason reported for the last failed submission, null otherwise */
    @With String errorMessage;

    public static PendingEdit create(RecordId recordId, String fieldName, String newValue, Object previousValue) {
        return new PendingEdit(recordId, fieldName, newValue, previousValue, null, State.PENDING, null);
    }

    public CellKey cellKey() {
        return CellKey.of(recordId, fieldName);
    }

    /** Replaces the entered value, keeping the confirmed value this edit would roll back to. */
    public PendingEdit withNewValue(String value) {
        return new PendingEdit(recordId, fieldName, value, previousValue, null, State.PENDING, null);
    }

    public PendingEdit markSubmitting(Instant at) {
        return withSubmittedAt(at).withState(State.SUBMITTING).withErrorMessage(null);
    }

    public PendingEdit markFailed(String reason) {
        return withState(State.FAILED).withErrorMessage(reason);
    }

    public PendingEdit backToPending() {
        return withState(State.PENDING).withSubmittedAt(null);
    }

    public boolean isInFlight() {
        return state == State.SUBMITTING;
    }

    @Override
    public String toString() {
        return "PendingEdit{" + recordId + "/" + fieldName + ", state=" + state + '}';
    }
}
