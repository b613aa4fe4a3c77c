package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One table over the active view of a sheet: filter, sort and pagination state, local edits and
 * their synchronisation with the remote store.
 *
 * <p>Derived state ({@link #getPage()}, {@link #getFilteredRecords()}, {@link #getFilteredStats()})
 * is recomputed from the loaded rows and the current {@link FilterState}; nothing is cached that
 * could drift from those inputs.
 */
public interface TableSession extends AutoCloseable {

    // Views

    ViewId getActiveView();

    CompletableFuture<List<ViewId>> listViews();

    /**
     * Loads a view, replacing all rows and discarding local edits, filters and pagination.
     *
     * <p>Fails with {@link FetchException} if the view cannot be loaded; the previous view stays
     * active then.
     */
    CompletableFuture<Void> switchView(ViewId viewId);

    /** Reloads the active view, discarding local edits but keeping filters. */
    CompletableFuture<Void> refresh();

    // Derived state

    Page getPage();

    List<SheetRecord> getFilteredRecords();

    /** Distinct non-blank values of a column across all loaded rows, for value-set filters. */
    List<String> getColumnValues(String column);

    SheetStats getFilteredStats();

    /** Whole-sheet statistics from the remote store, served through the stats cache. */
    CompletableFuture<SheetStats> getSheetStats(boolean forceRefresh);

    // Filtering and sorting

    FilterState getFilterState();

    void setGlobalSearch(String term);

    /** Debounced variant of {@link #setGlobalSearch} for keystroke input. */
    void onGlobalSearchInput(String term);

    void setColumnFilter(String column, ColumnFilter filter);

    /** Debounced text filter on one column for keystroke input. */
    void onColumnSearchInput(String column, String term);

    void clearColumnFilter(String column);

    void setSort(String column, SortDirection direction);

    void toggleSort(String column);

    void clearAllFilters();

    // Pagination

    PaginationState getPagination();

    void goToPage(int page);

    void nextPage();

    void previousPage();

    void setPageSize(int pageSize);

    // Editing

    /**
     * Records a local edit.
     *
     * @throws ValidationException if the value fails a local check; nothing is recorded then
     */
    void editCell(RecordId recordId, String fieldName, String newValue);

    CellDisplay getCellDisplay(RecordId recordId, String fieldName);

    boolean hasPendingChanges();

    int getPendingChangeCount();

    /**
     * Sends all pending edits in one bulk update.
     *
     * <p>Completes with the store's result, also when some items were rejected; those cells are
     * reverted and flagged as failed. Fails with {@link TransportException} if the store was not
     * reached; all edits stay pending then.
     */
    CompletableFuture<BulkUpdateResult> submitPendingChanges();

    /** Makes failed cells pending again so the next submission retries them. */
    int retryFailedChanges();

    /** Drops every edit that is not in flight. */
    int discardPendingChanges();

    // Observers

    void addListener(TableSessionListener listener);

    void removeListener(TableSessionListener listener);

    @Override
    void close();
}
