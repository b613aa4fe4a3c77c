package com.streamfirst.sheetgrid.domain;

/**
 * Requested page position. The page number is clamped against the current row count whenever a page
 * is produced, so a requested page may exceed the number of pages that exist.
 *
 * @param page one-based page number
 * @param pageSize rows per page
 */
public record PaginationState(int page, int pageSize) {
    public PaginationState {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be >= 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be > 0, got " + pageSize);
        }
    }

    public static PaginationState firstPage(int pageSize) {
        return new PaginationState(1, pageSize);
    }

    public PaginationState withPage(int newPage) {
        return new PaginationState(Math.max(1, newPage), pageSize);
    }

    /** Changing the page size always returns to the first page. */
    public PaginationState withPageSize(int newPageSize) {
        return new PaginationState(1, newPageSize);
    }

    public int totalPages(int rowCount) {
        return Math.max(1, (rowCount + pageSize - 1) / pageSize);
    }

    public PaginationState clampTo(int rowCount) {
        int clamped = Math.min(page, totalPages(rowCount));
        return clamped == page ? this : new PaginationState(clamped, pageSize);
    }
}
