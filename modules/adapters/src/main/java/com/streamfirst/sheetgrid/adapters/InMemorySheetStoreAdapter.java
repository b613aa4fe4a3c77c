package com.streamfirst.sheetgrid.adapters;

import com.streamfirst.sheetgrid.domain.*;
import com.streamfirst.sheetgrid.ports.SheetStorePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * In-memory implementation of SheetStorePort for testing and development. Each view is a sheet
 * with a header row and string cells. Bulk updates are applied item by item and fail per item the
 * way the spreadsheet backend does: unknown records and unknown columns are reported, not thrown.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemorySheetStoreAdapter implements SheetStorePort {

    private final String identityColumn;
    private final Executor executor;

    private final Map<ViewId, Sheet> sheets = new LinkedHashMap<>();
    private final Map<String, String> rejectedFields = new HashMap<>();
    private final List<BulkUpdateRequest> submittedRequests = new ArrayList<>();
    private final Map<ViewId, Integer> fetchCounts = new HashMap<>();

    private SheetStats stats = SheetStats.EMPTY;
    private RuntimeException statsFailure;
    private RuntimeException nextSubmitFailure;
    private CompletableFuture<Void> submitGate;
    private int statsFetchCount;

    private static final class Sheet {
        final List<String> headers;
        final List<Map<String, String>> rows = new ArrayList<>();

        Sheet(List<String> headers) {
            this.headers = List.copyOf(headers);
        }
    }

    /** Completes every future on the calling thread. */
    public InMemorySheetStoreAdapter(String identityColumn) {
        this(identityColumn, Runnable::run);
    }

    /** Completes futures on {@code executor}, to simulate network latency. */
    public InMemorySheetStoreAdapter(String identityColumn, Executor executor) {
        this.identityColumn = Objects.requireNonNull(identityColumn, "Identity column cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
    }

    @Override
    public CompletableFuture<List<SheetRecord>> fetchView(ViewId viewId) {
        return CompletableFuture.supplyAsync(() -> readView(viewId), executor);
    }

    @Override
    public CompletableFuture<List<ViewId>> listViews() {
        return CompletableFuture.supplyAsync(this::viewIds, executor);
    }

    @Override
    public CompletableFuture<BulkUpdateResult> submitBulkUpdate(BulkUpdateRequest request) {
        CompletableFuture<Void> gate;
        synchronized (this) {
            submittedRequests.add(request);
            RuntimeException failure = nextSubmitFailure;
            nextSubmitFailure = null;
            if (failure != null) {
                log.debug("Failing submission of {} update(s) on purpose", request.size());
                return CompletableFuture.failedFuture(failure);
            }
            gate = submitGate;
        }
        Supplier<BulkUpdateResult> apply = () -> applyUpdates(request);
        if (gate != null) {
            return gate.thenApplyAsync(ignored -> apply.get(), executor);
        }
        return CompletableFuture.supplyAsync(apply, executor);
    }

    @Override
    public CompletableFuture<SheetStats> fetchStats() {
        return CompletableFuture.supplyAsync(this::readStats, executor);
    }

    /**
     * Creates or replaces a sheet. Cells missing from a row are stored as empty strings.
     */
    public synchronized void putView(ViewId viewId, List<String> headers, List<? extends Map<String, ?>> rows) {
        if (!headers.contains(identityColumn)) {
            throw new IllegalArgumentException("Headers of view " + viewId + " lack identity column " + identityColumn);
        }
        Sheet sheet = new Sheet(headers);
        for (Map<String, ?> row : rows) {
            Map<String, String> cells = new LinkedHashMap<>();
            for (String header : sheet.headers) {
                cells.put(header, CellValues.stringify(row.get(header)));
            }
            sheet.rows.add(cells);
        }
        sheets.put(viewId, sheet);
        log.info("Registered view {} with {} rows", viewId, rows.size());
    }

    /** Changes a cell as another user of the sheet would. */
    public synchronized void setCell(ViewId viewId, RecordId recordId, String fieldName, String value) {
        Map<String, String> row =
                findRow(sheet(viewId), recordId)
                        .orElseThrow(() -> new IllegalArgumentException("Record not found: " + recordId));
        row.put(fieldName, value == null ? "" : value);
    }

    public synchronized Optional<String> getCell(ViewId viewId, RecordId recordId, String fieldName) {
        Sheet sheet = sheets.get(viewId);
        return sheet == null ? Optional.empty() : findRow(sheet, recordId).map(row -> row.get(fieldName));
    }

    /** Every update of {@code fieldName} fails with {@code reason} until cleared. */
    public synchronized void rejectField(String fieldName, String reason) {
        rejectedFields.put(fieldName, reason);
    }

    public synchronized void clearRejections() {
        rejectedFields.clear();
    }

    /** The next bulk update fails without a structured result. */
    public synchronized void failNextSubmit(RuntimeException failure) {
        nextSubmitFailure = Objects.requireNonNull(failure, "Failure cannot be null");
    }

    /** Holds bulk updates back until {@link #releaseSubmissions()} is called. */
    public synchronized void holdSubmissions() {
        if (submitGate == null) {
            submitGate = new CompletableFuture<>();
        }
    }

    public void releaseSubmissions() {
        CompletableFuture<Void> gate;
        synchronized (this) {
            gate = submitGate;
            submitGate = null;
        }
        if (gate != null) {
            gate.complete(null);
        }
    }

    public synchronized void setStats(SheetStats stats) {
        this.stats = Objects.requireNonNull(stats, "Stats cannot be null");
        this.statsFailure = null;
    }

    /** Stats fetches fail with {@code failure} until {@link #setStats} is called again. */
    public synchronized void failStats(RuntimeException failure) {
        this.statsFailure = Objects.requireNonNull(failure, "Failure cannot be null");
    }

    public synchronized List<BulkUpdateRequest> getSubmittedRequests() {
        return List.copyOf(submittedRequests);
    }

    public synchronized int getFetchCount(ViewId viewId) {
        return fetchCounts.getOrDefault(viewId, 0);
    }

    public synchronized int getStatsFetchCount() {
        return statsFetchCount;
    }

    private synchronized List<SheetRecord> readView(ViewId viewId) {
        fetchCounts.merge(viewId, 1, Integer::sum);
        Sheet sheet = sheet(viewId);
        List<SheetRecord> records = new ArrayList<>(sheet.rows.size());
        for (Map<String, String> row : sheet.rows) {
            records.add(SheetRecord.of(identityColumn, row));
        }
        log.debug("Fetched {} records from view {}", records.size(), viewId);
        return records;
    }

    private synchronized List<ViewId> viewIds() {
        return List.copyOf(sheets.keySet());
    }

    private synchronized SheetStats readStats() {
        statsFetchCount++;
        if (statsFailure != null) {
            throw statsFailure;
        }
        return stats;
    }

    private synchronized BulkUpdateResult applyUpdates(BulkUpdateRequest request) {
        long started = System.nanoTime();
        Sheet sheet = sheets.get(request.getViewId());
        List<ItemResult> results = new ArrayList<>(request.size());
        for (BulkUpdateItem item : request.getUpdates()) {
            results.add(applyUpdate(sheet, request.getViewId(), item));
        }
        BulkUpdateResult result = BulkUpdateResult.of(results, Duration.ofNanos(System.nanoTime() - started));
        log.info(
                "Processed bulk update for view {}: {} successful, {} failed",
                request.getViewId(),
                result.getSuccessfulUpdates(),
                result.getFailedUpdates());
        return result;
    }

    private ItemResult applyUpdate(Sheet sheet, ViewId viewId, BulkUpdateItem item) {
        if (sheet == null) {
            return ItemResult.failed(item, "Sheet '" + viewId + "' not accessible");
        }
        Optional<Map<String, String>> row = findRow(sheet, item.recordId());
        if (row.isEmpty()) {
            return ItemResult.failed(item, "Record with ID '" + item.recordId() + "' not found");
        }
        if (!sheet.headers.contains(item.fieldName())) {
            return ItemResult.failed(item, "Field '" + item.fieldName() + "' not found in headers");
        }
        String rejection = rejectedFields.get(item.fieldName());
        if (rejection != null) {
            return ItemResult.failed(item, rejection);
        }
        String oldValue = row.get().put(item.fieldName(), item.newValue() == null ? "" : item.newValue());
        return ItemResult.succeeded(item, oldValue);
    }

    private Sheet sheet(ViewId viewId) {
        Sheet sheet = sheets.get(viewId);
        if (sheet == null) {
            throw new NoSuchElementException("View not found: " + viewId);
        }
        return sheet;
    }

    private Optional<Map<String, String>> findRow(Sheet sheet, RecordId recordId) {
        return sheet.rows.stream()
                .filter(row -> recordId.value().equals(row.get(identityColumn).trim()))
                .findFirst();
    }
}
