package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.adapters.InMemorySheetStoreAdapter;
import com.streamfirst.sheetgrid.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Submission and reconciliation of pending edits against the in-memory sheet store: optimistic
 * application, per-cell rollback, transport failures and submissions that outlive their view.
 */
@Slf4j
class BulkSyncCoordinatorTest {

    private static final ViewId MASTER = ViewId.of("Master");
    private static final RecordId P1 = RecordId.of("P1");
    private static final RecordId P2 = RecordId.of("P2");
    private static final RecordId P3 = RecordId.of("P3");

    private final MutableClock clock = new MutableClock(Instant.parse("2025-04-01T10:00:00Z"));
    private final List<BulkUpdateResult> highFailureResults = new ArrayList<>();

    private InMemorySheetStoreAdapter sheetStore;
    private RecordStore recordStore;
    private PendingChangeTracker tracker;

    @BeforeEach
    void setUp() {
        sheetStore = new InMemorySheetStoreAdapter("id");
        sheetStore.putView(
                MASTER,
                List.of("id", "amt", "agent"),
                List.of(
                        Map.of("id", "P1", "amt", "100", "agent", "AG-01"),
                        Map.of("id", "P2", "amt", "50", "agent", "AG-02"),
                        Map.of("id", "P3", "amt", "200", "agent", "AG-03")));
        recordStore = new RecordStore();
        recordStore.replaceAll(MASTER, sheetStore.fetchView(MASTER).join());
        tracker = new PendingChangeTracker(recordStore::valueOf);
    }

    private BulkSyncCoordinator coordinator(SyncSettings settings) {
        return coordinator(sheetStore, settings);
    }

    private BulkSyncCoordinator coordinator(InMemorySheetStoreAdapter store, SyncSettings settings) {
        BulkSyncCoordinator coordinator = new BulkSyncCoordinator(store, recordStore, tracker, settings, clock);
        coordinator.onHighFailureRate(highFailureResults::add);
        return coordinator;
    }

    @Test
    void testRejectedItemIsRevertedWhileOthersStayApplied() {
        BulkSyncCoordinator coordinator = coordinator(new SyncSettings(0.5));
        sheetStore.rejectField("agent", "Protected range");
        tracker.setPending(P1, "amt", "110");
        tracker.setPending(P2, "agent", "AG-09");
        tracker.setPending(P3, "amt", "210");

        BulkUpdateResult result = coordinator.submit().join();

        assertThat(result.getFailedUpdates()).isEqualTo(1);
        assertThat(recordStore.valueOf(P1, "amt")).isEqualTo("110");
        assertThat(recordStore.valueOf(P2, "agent")).isEqualTo("AG-02");
        assertThat(recordStore.valueOf(P3, "amt")).isEqualTo("210");
        assertThat(tracker.snapshot()).containsOnlyKeys(P2);
        assertThat(tracker.get(P2, "agent").getState()).isEqualTo(PendingEdit.State.FAILED);
        assertThat(tracker.display(P2, "agent", recordStore.valueOf(P2, "agent")).errorMessage())
                .isEqualTo("Protected range");
        assertThat(coordinator.getState()).isEqualTo(BulkSyncCoordinator.State.IDLE);
        assertThat(highFailureResults).isEmpty();
    }

    @Test
    void testTransportFailureRestoresRowsAndKeepsEditsPending() {
        BulkSyncCoordinator coordinator = coordinator(SyncSettings.DEFAULT);
        sheetStore.failNextSubmit(new IllegalStateException("connection reset"));
        tracker.setPending(P1, "amt", "110");
        tracker.setPending(P3, "amt", "210");

        CompletableFuture<BulkUpdateResult> submission = coordinator.submit();

        assertThatThrownBy(submission::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(TransportException.class);
        assertThat(recordStore.valueOf(P1, "amt")).isEqualTo("100");
        assertThat(recordStore.valueOf(P3, "amt")).isEqualTo("200");
        assertThat(tracker.count(PendingEdit.State.PENDING)).isEqualTo(2);
        assertThat(coordinator.getState()).isEqualTo(BulkSyncCoordinator.State.FAILED);

        BulkUpdateResult retry = coordinator.submit().join();

        assertThat(retry.getSuccessfulUpdates()).isEqualTo(2);
        assertThat(tracker.hasPending()).isFalse();
        assertThat(sheetStore.getCell(MASTER, P1, "amt")).contains("110");
    }

    @Test
    void testEditsAreVisibleWhileInFlightAndLaterEditsGoInTheNextBatch() {
        BulkSyncCoordinator coordinator = coordinator(SyncSettings.DEFAULT);
        sheetStore.holdSubmissions();
        tracker.setPending(P1, "amt", "110");

        CompletableFuture<BulkUpdateResult> first = coordinator.submit();

        assertThat(coordinator.isSubmitting()).isTrue();
        assertThat(coordinator.getState()).isEqualTo(BulkSyncCoordinator.State.SUBMITTING);
        assertThat(recordStore.valueOf(P1, "amt")).isEqualTo("110");

        tracker.setPending(P1, "amt", "120");
        tracker.setPending(P2, "amt", "55");
        CompletableFuture<BulkUpdateResult> second = coordinator.submit();
        assertThat(sheetStore.getSubmittedRequests()).hasSize(1);

        sheetStore.releaseSubmissions();

        assertThat(first.join().getSuccessfulUpdates()).isEqualTo(1);
        assertThat(second.join().getSuccessfulUpdates()).isEqualTo(2);
        List<BulkUpdateRequest> requests = sheetStore.getSubmittedRequests();
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).getUpdates())
                .containsExactly(new BulkUpdateItem(P1, "amt", "120"), new BulkUpdateItem(P2, "amt", "55"));
        assertThat(recordStore.valueOf(P1, "amt")).isEqualTo("120");
        assertThat(tracker.hasPending()).isFalse();
    }

    @Test
    void testResultForAReplacedRowSetIsDiscarded() {
        BulkSyncCoordinator coordinator = coordinator(SyncSettings.DEFAULT);
        sheetStore.holdSubmissions();
        tracker.setPending(P1, "amt", "110");
        CompletableFuture<BulkUpdateResult> submission = coordinator.submit();

        recordStore.replaceAll(ViewId.of("Q1-2025"), List.of(Records.row("P1", "amt", "7")));
        tracker.clearAll();
        sheetStore.releaseSubmissions();

        assertThat(submission.join().getSuccessfulUpdates()).isEqualTo(1);
        assertThat(recordStore.valueOf(P1, "amt")).isEqualTo("7");
        assertThat(tracker.hasPending()).isFalse();
    }

    @Test
    void testHighFailureRateTriggersHandler() {
        BulkSyncCoordinator coordinator = coordinator(SyncSettings.DEFAULT);
        sheetStore.rejectField("agent", "Protected range");
        tracker.setPending(P1, "amt", "110");
        tracker.setPending(P2, "agent", "AG-09");

        BulkUpdateResult result = coordinator.submit().join();

        assertThat(highFailureResults).containsExactly(result);
    }

    @Test
    void testMissingItemResultCountsAsFailure() {
        InMemorySheetStoreAdapter silentStore =
                new InMemorySheetStoreAdapter("id") {
                    @Override
                    public CompletableFuture<BulkUpdateResult> submitBulkUpdate(BulkUpdateRequest request) {
                        return CompletableFuture.completedFuture(BulkUpdateResult.of(List.of(), Duration.ZERO));
                    }
                };
        BulkSyncCoordinator coordinator = coordinator(silentStore, SyncSettings.DEFAULT);
        tracker.setPending(P1, "amt", "110");

        coordinator.submit().join();

        assertThat(recordStore.valueOf(P1, "amt")).isEqualTo("100");
        assertThat(tracker.display(P1, "amt", "100").errorMessage()).isEqualTo("No result returned");
        assertThat(highFailureResults).hasSize(1);
    }

    @Test
    void testNothingPendingSendsNothing() {
        BulkSyncCoordinator coordinator = coordinator(SyncSettings.DEFAULT);

        BulkUpdateResult result = coordinator.submit().join();

        assertThat(result.getTotalUpdates()).isZero();
        assertThat(sheetStore.getSubmittedRequests()).isEmpty();
        log.debug("Empty submission returned '{}'", result.getMessage());
    }
}
