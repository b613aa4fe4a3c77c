package com.streamfirst.sheetgrid.ports;

import com.streamfirst.sheetgrid.domain.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the remote, spreadsheet-backed record store. The store offers no transactions, no row
 * locking and no version tokens: updates are applied field by field with last-write-wins semantics
 * and concurrent edits made outside this application go undetected.
 */
public interface SheetStorePort {

    /**
     * Fetches a full snapshot of a view.
     *
     * @param viewId the sheet to read
     * @return a future with every row of the sheet in sheet order; fails if the store is unreachable
     *     or the sheet does not exist
     */
    CompletableFuture<List<SheetRecord>> fetchView(ViewId viewId);

    /**
     * Lists the views (sheets) available for browsing.
     *
     * @return a future with the view identifiers in the store's order
     */
    CompletableFuture<List<ViewId>> listViews();

    /**
     * Applies a batch of field updates. Items are processed independently; a structured result is
     * returned even when some or all items fail. The future only fails when the request never
     * produced such a result (network error, timeout, store unavailable).
     *
     * @param request the ordered field updates and the view they target
     * @return a future with per-item outcomes
     */
    CompletableFuture<BulkUpdateResult> submitBulkUpdate(BulkUpdateRequest request);

    /**
     * Fetches aggregate statistics computed by the store over its whole data set.
     *
     * @return a future with the statistics payload
     */
    CompletableFuture<SheetStats> fetchStats();
}
