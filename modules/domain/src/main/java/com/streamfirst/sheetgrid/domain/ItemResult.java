package com.streamfirst.sheetgrid.domain;

import java.util.Objects;

/**
 * Outcome of one field update as reported by the remote store.
 *
 * @param oldValue the value the store held before the update, null when unknown
 * @param errorMessage why the update failed, null on success
 */
public record ItemResult(
        RecordId recordId,
        String fieldName,
        String oldValue,
        String newValue,
        boolean success,
        String errorMessage) {

    public ItemResult {
        Objects.requireNonNull(recordId, "Record ID cannot be null");
        Objects.requireNonNull(fieldName, "Field name cannot be null");
    }

    public static ItemResult succeeded(BulkUpdateItem item, String oldValue) {
        return new ItemResult(item.recordId(), item.fieldName(), oldValue, item.newValue(), true, null);
    }

    public static ItemResult failed(BulkUpdateItem item, String errorMessage) {
        return new ItemResult(item.recordId(), item.fieldName(), null, item.newValue(), false, errorMessage);
    }

    public CellKey cellKey() {
        return CellKey.of(recordId, fieldName);
    }
}
