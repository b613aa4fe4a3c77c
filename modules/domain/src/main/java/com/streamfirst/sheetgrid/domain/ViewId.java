package com.streamfirst.sheetgrid.domain;

import java.util.Objects;

/**
 * Identifies a logical sheet (e.g. "Master" or a quarterly sheet such as "Q3-2025") that a table
 * session loads, filters and edits.
 *
 * @param name the sheet name as known to the remote store
 */
public record ViewId(String name) {
    public ViewId {
        Objects.requireNonNull(name, "View name cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("View name cannot be empty");
        }
    }

    public static ViewId of(String name) {
        return new ViewId(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
