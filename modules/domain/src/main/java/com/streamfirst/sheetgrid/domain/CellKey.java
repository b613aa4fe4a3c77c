package com.streamfirst.sheetgrid.domain;

import java.util.Objects;

/** Addresses a single field of a single record. */
public record CellKey(RecordId recordId, String fieldName) {
    public CellKey {
        Objects.requireNonNull(recordId, "Record ID cannot be null");
        Objects.requireNonNull(fieldName, "Field name cannot be null");
        if (fieldName.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be blank");
        }
    }

    public static CellKey of(RecordId recordId, String fieldName) {
        return new CellKey(recordId, fieldName);
    }

    @Override
    public String toString() {
        return recordId + "/" + fieldName;
    }
}
