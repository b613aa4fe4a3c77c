package com.streamfirst.sheetgrid.domain;

import java.util.Objects;

/**
 * Business identity of a sheet row (e.g. a policy number). Rows are correlated with the remote
 * store by this value, never by their position in the sheet.
 *
 * @param value the identity as it appears in the identity column
 */
public record RecordId(String value) {
    public RecordId {
        Objects.requireNonNull(value, "Record ID cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Record ID cannot be empty");
        }
    }

    public static RecordId of(String value) {
        return new RecordId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
