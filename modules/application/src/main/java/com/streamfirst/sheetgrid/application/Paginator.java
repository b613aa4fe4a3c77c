package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;

import java.util.List;

/**
 * Cuts a row set into pages. The requested page is clamped into {@code [1, totalPages]} on every
 * call, so a page number left over from a larger result set still yields a valid page.
 */
public class Paginator {

    public Page slice(List<SheetRecord> records, int page, int pageSize) {
        PaginationState state = new PaginationState(Math.max(1, page), pageSize).clampTo(records.size());
        int totalPages = state.totalPages(records.size());
        int from = Math.min((state.page() - 1) * pageSize, records.size());
        int to = Math.min(from + pageSize, records.size());
        return new Page(records.subList(from, to), state.page(), pageSize, totalPages, records.size());
    }

    public Page slice(List<SheetRecord> records, PaginationState state) {
        return slice(records, state.page(), state.pageSize());
    }
}
