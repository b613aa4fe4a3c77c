package com.streamfirst.sheetgrid.domain;

import java.util.Objects;

/**
 * One field update on the wire: {@code {record_id, field_name, new_value}}.
 *
 * @param newValue the value to write, null clears the cell
 */
public record BulkUpdateItem(RecordId recordId, String fieldName, String newValue) {
    public BulkUpdateItem {
        Objects.requireNonNull(recordId, "Record ID cannot be null");
        Objects.requireNonNull(fieldName, "Field name cannot be null");
    }

    public CellKey cellKey() {
        return CellKey.of(recordId, fieldName);
    }
}
