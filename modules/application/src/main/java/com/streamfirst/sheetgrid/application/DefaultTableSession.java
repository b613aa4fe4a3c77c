package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;
import com.streamfirst.sheetgrid.ports.SheetStorePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * {@link TableSession} that owns the row store, pending edits and derived views of one active view.
 *
 * <p>Filtering, sorting and pagination run synchronously on the caller's thread. Fetches and
 * submissions complete on whatever thread the {@link SheetStorePort} completes them. Listeners are
 * notified outside of the session lock.
 */
@Slf4j
public class DefaultTableSession implements TableSession {

    static final String HIGH_FAILURE_NOTICE =
            "Many updates were rejected, so the view was reloaded from the sheet. "
                    + "Some of your edits may need to be redone.";

    private static final String GLOBAL_SEARCH_KEY = "global-search";
    private static final String COLUMN_SEARCH_PREFIX = "column-search:";

    private final SheetStorePort sheetStore;
    private final StatsCache<SheetStats> statsCache;
    private final CellValidator validator;
    private final SessionSettings settings;
    private final RecordStore recordStore = new RecordStore();
    private final PendingChangeTracker tracker = new PendingChangeTracker(recordStore::valueOf);
    private final BulkSyncCoordinator coordinator;
    private final FilterEngine filterEngine = new FilterEngine();
    private final SortEngine sortEngine = new SortEngine();
    private final Paginator paginator = new Paginator();
    private final ColumnValueIndex columnIndex = new ColumnValueIndex();
    private final FilteredStatsCalculator statsCalculator;
    private final Debouncer debouncer;
    private final List<TableSessionListener> listeners = new CopyOnWriteArrayList<>();

    private FilterState filterState = FilterState.EMPTY;
    private PaginationState pagination;
    private long viewRequests;

    private long derivedVersion = -1;
    private FilterState derivedFor;
    private List<SheetRecord> derived = List.of();

    public DefaultTableSession(
            SheetStorePort sheetStore,
            StatsCache<SheetStats> statsCache,
            CellValidator validator,
            SessionSettings settings,
            SyncSettings syncSettings,
            StatsColumns statsColumns,
            Clock clock) {
        this(
                sheetStore,
                statsCache,
                validator,
                settings,
                syncSettings,
                statsColumns,
                clock,
                new Debouncer(settings.searchDebounce()));
    }

    public DefaultTableSession(
            SheetStorePort sheetStore,
            StatsCache<SheetStats> statsCache,
            CellValidator validator,
            SessionSettings settings,
            SyncSettings syncSettings,
            StatsColumns statsColumns,
            Clock clock,
            Debouncer debouncer) {
        this.sheetStore = Objects.requireNonNull(sheetStore, "Sheet store cannot be null");
        this.statsCache = Objects.requireNonNull(statsCache, "Stats cache cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.statsCalculator = new FilteredStatsCalculator(statsColumns);
        this.debouncer = Objects.requireNonNull(debouncer, "Debouncer cannot be null");
        this.pagination = PaginationState.firstPage(settings.defaultPageSize());
        this.coordinator = new BulkSyncCoordinator(sheetStore, recordStore, tracker, syncSettings, clock);
        this.coordinator.onHighFailureRate(result -> reloadAfterRejections());
    }

    // Views

    @Override
    public ViewId getActiveView() {
        return recordStore.getViewId();
    }

    @Override
    public CompletableFuture<List<ViewId>> listViews() {
        return sheetStore.listViews();
    }

    @Override
    public CompletableFuture<Void> switchView(ViewId viewId) {
        Objects.requireNonNull(viewId, "View ID cannot be null");
        return load(viewId, nextViewRequest(), true);
    }

    @Override
    public CompletableFuture<Void> refresh() {
        ViewId active = getActiveView();
        if (active == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No view has been loaded"));
        }
        return load(active, nextViewRequest(), false);
    }

    private synchronized long nextViewRequest() {
        return ++viewRequests;
    }

    private CompletableFuture<Void> load(ViewId viewId, long request, boolean resetFilters) {
        log.info("Loading view {}", viewId);
        CompletableFuture<List<SheetRecord>> fetch;
        try {
            fetch = sheetStore.fetchView(viewId);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        return fetch.handle(
                (records, error) -> {
                    if (error != null) {
                        throw fetchFailed(viewId, unwrap(error));
                    }
                    boolean installed;
                    try {
                        installed = install(viewId, request, records, resetFilters);
                    } catch (IllegalArgumentException e) {
                        throw fetchFailed(viewId, e);
                    }
                    if (!installed) {
                        log.info("Ignoring load of view {}: superseded by a newer request", viewId);
                        return null;
                    }
                    notifyStateChanged();
                    return null;
                });
    }

    private synchronized boolean install(
            ViewId viewId, long request, List<SheetRecord> records, boolean resetFilters) {
        if (request != viewRequests) {
            return false;
        }
        recordStore.replaceAll(viewId, records);
        tracker.clearAll();
        if (resetFilters) {
            filterState = FilterState.EMPTY;
            pagination = PaginationState.firstPage(settings.defaultPageSize());
        }
        columnIndex.refresh(recordStore);
        clampPagination();
        return true;
    }

    private FetchException fetchFailed(ViewId viewId, Throwable cause) {
        FetchException failure =
                cause instanceof FetchException fetchException
                        ? fetchException
                        : new FetchException(viewId, cause.getMessage(), cause);
        log.error("Loading view {} failed", viewId, cause);
        listeners.forEach(listener -> listener.onSyncFailed(failure));
        return failure;
    }

    private void reloadAfterRejections() {
        ViewId active = getActiveView();
        refresh()
                .whenComplete(
                        (ignored, error) -> {
                            if (error == null) {
                                listeners.forEach(listener -> listener.onViewRefreshed(active, HIGH_FAILURE_NOTICE));
                            }
                        });
    }

    // Derived state

    @Override
    public synchronized Page getPage() {
        return paginator.slice(derivedRecords(), pagination);
    }

    @Override
    public synchronized List<SheetRecord> getFilteredRecords() {
        return derivedRecords();
    }

    @Override
    public synchronized List<String> getColumnValues(String column) {
        columnIndex.refresh(recordStore);
        return columnIndex.valuesFor(column);
    }

    @Override
    public synchronized SheetStats getFilteredStats() {
        return statsCalculator.calculate(derivedRecords());
    }

    @Override
    public CompletableFuture<SheetStats> getSheetStats(boolean forceRefresh) {
        return statsCache.get(forceRefresh);
    }

    private List<SheetRecord> derivedRecords() {
        long version = recordStore.getVersion();
        if (version != derivedVersion || !filterState.equals(derivedFor)) {
            List<SheetRecord> filtered = filterEngine.apply(recordStore.records(), filterState);
            derived = sortEngine.apply(filtered, filterState.getSortBy(), filterState.getSortDirection());
            derivedVersion = version;
            derivedFor = filterState;
        }
        return derived;
    }

    // Filtering and sorting

    @Override
    public synchronized FilterState getFilterState() {
        return filterState;
    }

    @Override
    public void setGlobalSearch(String term) {
        debouncer.cancel(GLOBAL_SEARCH_KEY);
        changeFilters(state -> state.withGlobalSearch(term == null ? "" : term), true);
    }

    @Override
    public void onGlobalSearchInput(String term) {
        debouncer.submit(GLOBAL_SEARCH_KEY, () -> setGlobalSearch(term));
    }

    @Override
    public void setColumnFilter(String column, ColumnFilter filter) {
        changeFilters(state -> state.withColumnFilter(column, filter), true);
    }

    @Override
    public void onColumnSearchInput(String column, String term) {
        Objects.requireNonNull(column, "Column cannot be null");
        debouncer.submit(columnSearchKey(column), () -> setColumnFilter(column, ColumnFilter.Text.of(term)));
    }

    @Override
    public void clearColumnFilter(String column) {
        debouncer.cancel(columnSearchKey(column));
        changeFilters(state -> state.withoutColumnFilter(column), true);
    }

    @Override
    public void setSort(String column, SortDirection direction) {
        changeFilters(state -> state.withSort(column, direction), false);
    }

    @Override
    public void toggleSort(String column) {
        changeFilters(state -> state.toggleSort(column), false);
    }

    @Override
    public void clearAllFilters() {
        debouncer.cancel(GLOBAL_SEARCH_KEY);
        // includes searches for columns that have no filter yet
        debouncer.cancelIf(key -> key instanceof String name && name.startsWith(COLUMN_SEARCH_PREFIX));
        changeFilters(state -> FilterState.EMPTY, true);
    }

    private void changeFilters(UnaryOperator<FilterState> change, boolean resetPage) {
        FilterState changed;
        synchronized (this) {
            filterState = change.apply(filterState);
            changed = filterState;
            if (resetPage) {
                pagination = pagination.withPage(1);
            }
        }
        log.debug("Filters now {}", changed.summary());
        notifyStateChanged();
    }

    private static String columnSearchKey(String column) {
        return COLUMN_SEARCH_PREFIX + column;
    }

    // Pagination

    @Override
    public synchronized PaginationState getPagination() {
        return pagination.clampTo(derivedRecords().size());
    }

    /** Pulls the stored page back into range after the row set has shrunk. */
    private synchronized void clampPagination() {
        pagination = pagination.clampTo(derivedRecords().size());
    }

    @Override
    public void goToPage(int page) {
        synchronized (this) {
            pagination = pagination.withPage(page).clampTo(derivedRecords().size());
        }
        notifyStateChanged();
    }

    @Override
    public void nextPage() {
        goToPage(getPagination().page() + 1);
    }

    @Override
    public void previousPage() {
        goToPage(getPagination().page() - 1);
    }

    @Override
    public void setPageSize(int pageSize) {
        synchronized (this) {
            pagination = pagination.withPageSize(pageSize);
        }
        notifyStateChanged();
    }

    // Editing

    @Override
    public void editCell(RecordId recordId, String fieldName, String newValue) {
        CellKey cell = CellKey.of(recordId, fieldName);
        if (recordStore.find(recordId).isEmpty()) {
            throw new ValidationException(cell, "record is not loaded");
        }
        if (fieldName.equals(settings.identityColumn())) {
            throw new ValidationException(cell, "the identity column cannot be edited");
        }
        validator.validate(cell, newValue).orElseThrow(reason -> new ValidationException(cell, reason));
        tracker.setPending(recordId, fieldName, newValue);
        notifyStateChanged();
    }

    @Override
    public CellDisplay getCellDisplay(RecordId recordId, String fieldName) {
        return tracker.display(recordId, fieldName, recordStore.valueOf(recordId, fieldName));
    }

    @Override
    public boolean hasPendingChanges() {
        return tracker.hasPending();
    }

    @Override
    public int getPendingChangeCount() {
        return tracker.count();
    }

    @Override
    public CompletableFuture<BulkUpdateResult> submitPendingChanges() {
        CompletableFuture<BulkUpdateResult> submission = coordinator.submit();
        notifyStateChanged();
        return submission.whenComplete(
                (result, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        if (cause instanceof SheetGridException failure) {
                            listeners.forEach(listener -> listener.onSyncFailed(failure));
                        }
                    } else if (result.hasFailures()) {
                        PartialUpdateException partial =
                                new PartialUpdateException(result.failures(), result.getTotalUpdates());
                        listeners.forEach(listener -> listener.onSyncFailed(partial));
                    }
                    clampPagination();
                    notifyStateChanged();
                });
    }

    @Override
    public int retryFailedChanges() {
        int retried = tracker.retryFailed();
        if (retried > 0) {
            notifyStateChanged();
        }
        return retried;
    }

    @Override
    public int discardPendingChanges() {
        int discarded = tracker.discardUnsubmitted();
        if (discarded > 0) {
            log.info("Discarded {} unsubmitted edit(s)", discarded);
            notifyStateChanged();
        }
        return discarded;
    }

    /** State of the bulk synchronisation, exposed for status indicators. */
    public BulkSyncCoordinator.State getSyncState() {
        return coordinator.getState();
    }

    // Observers

    @Override
    public void addListener(TableSessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeListener(TableSessionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        debouncer.close();
        listeners.clear();
    }

    private void notifyStateChanged() {
        for (TableSessionListener listener : listeners) {
            try {
                listener.onStateChanged();
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on state change", listener, e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
