package com.streamfirst.sheetgrid.domain;

import java.util.List;
import java.util.Objects;

/**
 * One slice of the filtered and sorted row set, ready for rendering.
 *
 * @param data the rows on this page, never more than {@code pageSize}
 * @param page the effective (clamped) one-based page number
 * @param pageSize rows per page
 * @param totalPages number of pages, at least one even for an empty set
 * @param totalRecords number of rows across all pages
 */
public record Page(List<SheetRecord> data, int page, int pageSize, int totalPages, int totalRecords) {
    public Page {
        Objects.requireNonNull(data, "Page data cannot be null");
        data = List.copyOf(data);
    }

    public boolean hasNext() {
        return page < totalPages;
    }

    public boolean hasPrevious() {
        return page > 1;
    }
}
