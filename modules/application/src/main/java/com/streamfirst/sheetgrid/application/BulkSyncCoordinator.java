package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.*;
import com.streamfirst.sheetgrid.ports.SheetStorePort;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Sends pending edits to the remote store in batches and reconciles the answer with local state.
 *
 * <p>Edits are applied to the {@link RecordStore} before the request goes out. A transport failure
 * restores the pre-submit rows and puts the edits back to pending. A structured response is applied
 * cell by cell: accepted cells are confirmed, rejected cells are reverted to their pre-submit value
 * and flagged as failed.
 *
 * <p>At most one submission is in flight. A submit issued meanwhile runs once the current one has
 * resolved and picks up whatever was edited in between.
 */
@Slf4j
@RequiredArgsConstructor
public class BulkSyncCoordinator {

    /** Lifecycle of a submission. */
    public enum State {
        IDLE,
        /** Collecting pending edits into a request */
        BATCHING,
        /** Request sent, waiting for the store */
        SUBMITTING,
        /** Applying the per-item results */
        RECONCILING,
        /** The last request never reached the store; left on the next submit */
        FAILED
    }

    private final SheetStorePort sheetStore;
    private final RecordStore recordStore;
    private final PendingChangeTracker tracker;
    private final SyncSettings settings;
    private final Clock clock;

    @Getter private volatile State state = State.IDLE;
    private volatile Consumer<BulkUpdateResult> highFailureRateHandler = result -> {};
    private CompletableFuture<BulkUpdateResult> inFlight;

    /** Called after reconciling a response whose failure rate exceeds the configured threshold. */
    public void onHighFailureRate(Consumer<BulkUpdateResult> handler) {
        this.highFailureRateHandler = Objects.requireNonNull(handler, "Handler cannot be null");
    }

    public synchronized boolean isSubmitting() {
        return inFlight != null && !inFlight.isDone();
    }

    /**
     * Submits every pending edit of the active view.
     *
     * <p>The returned future completes with the store's result, including when some items were
     * rejected. It fails with {@link TransportException} when the store could not be reached.
     */
    public synchronized CompletableFuture<BulkUpdateResult> submit() {
        if (isSubmitting()) {
            log.debug("Submission in flight, chaining next batch behind it");
            return inFlight.handle((result, error) -> null).thenCompose(ignored -> submit());
        }

        state = State.BATCHING;
        List<PendingEdit> batch = tracker.beginBatch(clock.instant());
        if (batch.isEmpty()) {
            state = State.IDLE;
            return CompletableFuture.completedFuture(BulkUpdateResult.empty());
        }

        RecordStore.Snapshot preEdit = recordStore.snapshot();
        BulkUpdateRequest request = BulkUpdateRequest.coalesce(preEdit.viewId(), batch);
        for (BulkUpdateItem item : request.getUpdates()) {
            recordStore.apply(item.recordId(), item.fieldName(), item.newValue());
        }

        state = State.SUBMITTING;
        log.info("Submitting {} field update(s) for view {}", request.size(), request.getViewId());

        CompletableFuture<BulkUpdateResult> sent;
        try {
            sent = sheetStore.submitBulkUpdate(request);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<BulkUpdateResult> reconciled =
                sent.handle((response, error) -> reconcile(preEdit, request, response, error));
        inFlight = reconciled;
        return reconciled;
    }

    private synchronized BulkUpdateResult reconcile(
            RecordStore.Snapshot preEdit, BulkUpdateRequest request, BulkUpdateResult response, Throwable error) {
        state = State.RECONCILING;
        boolean stale = !recordStore.isCurrent(preEdit);

        if (error != null) {
            Throwable cause = unwrap(error);
            if (stale) {
                log.info("Discarding failed submission for view {}: view was reloaded", request.getViewId());
                state = State.IDLE;
            } else {
                log.error("Bulk update of {} field(s) failed in transport", request.size(), cause);
                recordStore.restore(preEdit);
                tracker.release(request.getUpdates().stream().map(BulkUpdateItem::cellKey).toList());
                state = State.FAILED;
            }
            throw new TransportException(request.size(), cause);
        }

        if (stale) {
            log.info("Discarding result for view {}: view was reloaded", request.getViewId());
            state = State.IDLE;
            return response;
        }

        Map<CellKey, ItemResult> byCell = new HashMap<>();
        response.getResults().forEach(result -> byCell.put(result.cellKey(), result));

        List<ItemResult> failures = new ArrayList<>();
        for (BulkUpdateItem item : request.getUpdates()) {
            CellKey cell = item.cellKey();
            ItemResult result = byCell.get(cell);
            if (result != null && result.success()) {
                tracker.confirm(cell);
                continue;
            }
            String reason = result == null ? "No result returned" : result.errorMessage();
            recordStore.apply(item.recordId(), item.fieldName(), preEdit.valueOf(item.recordId(), item.fieldName()));
            tracker.fail(cell, reason);
            failures.add(result != null ? result : ItemResult.failed(item, reason));
        }

        if (failures.isEmpty()) {
            log.info("Bulk update confirmed: {} field(s) in {}", request.size(), response.getProcessingTime());
        } else {
            log.warn(
                    "Bulk update partially rejected: {} of {} field(s) failed, first: {}",
                    failures.size(),
                    request.size(),
                    failures.get(0).errorMessage());
        }
        state = State.IDLE;
        checkFailureRate(response, (double) failures.size() / request.size());
        return response;
    }

    private void checkFailureRate(BulkUpdateResult response, double failureRate) {
        if (failureRate > settings.failureRateThreshold()) {
            log.warn(
                    "Failure rate {} exceeds threshold {}, refetching view",
                    failureRate,
                    settings.failureRateThreshold());
            highFailureRateHandler.accept(response);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
