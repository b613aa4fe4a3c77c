package com.streamfirst.sheetgrid.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.sheetgrid.adapters.InMemoryKeyValueStoreAdapter;
import com.streamfirst.sheetgrid.adapters.InMemorySheetStoreAdapter;
import com.streamfirst.sheetgrid.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Table session over the in-memory sheet store: view switching, derived pages, local edits and
 * their submission, including rejected items, transport failures and submissions that outlive
 * their view.
 */
@Slf4j
class DefaultTableSessionTest {

    private static final String POLICY = "Policy number";
    private static final String AGENT = "Agent Code";
    private static final String GROSS = "Gross premium";
    private static final String MONTH = "Reporting Month (mmm'yy)";

    private static final ViewId MASTER = ViewId.of("Master");
    private static final ViewId Q3 = ViewId.of("Q3-2025");
    private static final RecordId P1001 = RecordId.of("P-1001");
    private static final RecordId P1002 = RecordId.of("P-1002");

    private final MutableClock clock = new MutableClock(Instant.parse("2025-04-01T10:00:00Z"));
    private final RecordingListener listener = new RecordingListener();

    private InMemorySheetStoreAdapter sheetStore;
    private DefaultTableSession session;

    @BeforeEach
    void setUp() {
        sheetStore = new InMemorySheetStoreAdapter(POLICY);
        sheetStore.putView(
                MASTER,
                List.of(POLICY, AGENT, GROSS, MONTH),
                List.of(
                        Map.of(POLICY, "P-1001", AGENT, "AG-01", GROSS, "1000", MONTH, "Jan'25"),
                        Map.of(POLICY, "P-1002", AGENT, "AG-02", GROSS, "500", MONTH, "Jan'25"),
                        Map.of(POLICY, "P-1003", AGENT, "AG-01", GROSS, "2000", MONTH, "Feb'25"),
                        Map.of(POLICY, "P-1004", AGENT, "AG-03", GROSS, "750", MONTH, "Feb'25"),
                        Map.of(POLICY, "P-1005", AGENT, "AG-02", GROSS, "300", MONTH, "Mar'25")));
        sheetStore.putView(
                Q3,
                List.of(POLICY, AGENT, GROSS, MONTH),
                List.of(Map.of(POLICY, "Q-1", AGENT, "AG-07", GROSS, "90", MONTH, "Jul'25")));

        session = session(SyncSettings.DEFAULT, new Debouncer(Duration.ZERO));
        session.switchView(MASTER).join();
        session.addListener(listener);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private DefaultTableSession session(SyncSettings syncSettings, Debouncer debouncer) {
        StatsCache<SheetStats> statsCache =
                new StatsCache<>(
                        sheetStore::fetchStats,
                        new InMemoryKeyValueStoreAdapter(),
                        new ObjectMapper(),
                        SheetStats.class,
                        StatsCacheSettings.DEFAULT,
                        clock);
        CellValidator validator =
                new ColumnFormatValidator(new ValidationSettings(POLICY, Set.of(GROSS), Set.of(), Set.of()));
        return new DefaultTableSession(
                sheetStore,
                statsCache,
                validator,
                new SessionSettings(POLICY, 2, Duration.ZERO),
                syncSettings,
                StatsColumns.DEFAULT,
                clock,
                debouncer);
    }

    private List<String> pageIds() {
        return session.getPage().data().stream().map(r -> r.getId().value()).toList();
    }

    @Test
    void testSwitchViewLoadsRowsAndResetsFiltersAndPage() {
        session.setGlobalSearch("AG-0");
        session.goToPage(2);

        session.switchView(Q3).join();

        assertThat(session.getActiveView()).isEqualTo(Q3);
        assertThat(session.getFilterState()).isEqualTo(FilterState.EMPTY);
        assertThat(session.getPagination().page()).isEqualTo(1);
        assertThat(pageIds()).containsExactly("Q-1");
        assertThat(listener.stateChanges.get()).isPositive();
    }

    @Test
    void testFailedSwitchKeepsTheActiveView() {
        assertThatThrownBy(() -> session.switchView(ViewId.of("Missing")).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(FetchException.class);

        assertThat(session.getActiveView()).isEqualTo(MASTER);
        assertThat(session.getPage().totalRecords()).isEqualTo(5);
        assertThat(listener.errors).singleElement().isInstanceOf(FetchException.class);
    }

    @Test
    void testFilterChangesReturnToFirstPageButSortingDoesNot() {
        session.goToPage(2);
        session.toggleSort(GROSS);

        assertThat(session.getPagination().page()).isEqualTo(2);
        assertThat(pageIds()).containsExactly("P-1004", "P-1001");

        session.setGlobalSearch("ag-01");

        assertThat(session.getPagination().page()).isEqualTo(1);
        assertThat(pageIds()).containsExactly("P-1001", "P-1003");
        assertThat(session.getPage().totalPages()).isEqualTo(1);
    }

    @Test
    void testPageNavigationIsClampedToExistingPages() {
        session.goToPage(10);
        assertThat(session.getPagination().page()).isEqualTo(3);
        assertThat(pageIds()).containsExactly("P-1005");

        session.nextPage();
        assertThat(session.getPagination().page()).isEqualTo(3);

        session.previousPage();
        session.previousPage();
        session.previousPage();
        assertThat(session.getPagination().page()).isEqualTo(1);
        assertThat(session.getPage().hasPrevious()).isFalse();

        session.goToPage(3);
        session.setPageSize(10);
        assertThat(session.getPagination()).isEqualTo(PaginationState.firstPage(10));
    }

    @Test
    void testStoredPageStaysClampedWhenRowsShrinkAndGrowAgain() {
        List<Map<String, String>> allRows = List.of(
                Map.of(POLICY, "P-1001", AGENT, "AG-01", GROSS, "1000", MONTH, "Jan'25"),
                Map.of(POLICY, "P-1002", AGENT, "AG-02", GROSS, "500", MONTH, "Jan'25"),
                Map.of(POLICY, "P-1003", AGENT, "AG-01", GROSS, "2000", MONTH, "Feb'25"),
                Map.of(POLICY, "P-1004", AGENT, "AG-03", GROSS, "750", MONTH, "Feb'25"),
                Map.of(POLICY, "P-1005", AGENT, "AG-02", GROSS, "300", MONTH, "Mar'25"));
        session.goToPage(3);
        assertThat(session.getPagination().page()).isEqualTo(3);

        sheetStore.putView(MASTER, List.of(POLICY, AGENT, GROSS, MONTH), allRows.subList(0, 1));
        session.refresh().join();
        assertThat(session.getPagination().page()).isEqualTo(1);

        sheetStore.putView(MASTER, List.of(POLICY, AGENT, GROSS, MONTH), allRows);
        session.refresh().join();

        assertThat(session.getPagination().page()).isEqualTo(1);
        assertThat(pageIds()).containsExactly("P-1001", "P-1002");
    }

    @Test
    void testFilteredStatsFollowTheColumnFilters() {
        session.setColumnFilter(MONTH, ColumnFilter.ValueSet.of("Jan'25"));

        SheetStats stats = session.getFilteredStats();

        assertThat(stats.totalRecords()).isEqualTo(2);
        assertThat(stats.totalGrossPremium()).isEqualByComparingTo(new BigDecimal("1500"));
        assertThat(session.getColumnValues(AGENT)).containsExactlyInAnyOrder("AG-01", "AG-02", "AG-03");

        session.clearColumnFilter(MONTH);
        assertThat(session.getFilteredStats().totalRecords()).isEqualTo(5);
    }

    @Test
    void testDebouncedSearchInputIsAppliedOnce() throws Exception {
        CountDownLatch applied = new CountDownLatch(1);
        session.addListener(applied::countDown);

        session.onGlobalSearchInput("ag-02");

        assertThat(applied.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(session.getFilterState().getGlobalSearch()).isEqualTo("ag-02");
        assertThat(session.getFilteredRecords()).hasSize(2);
    }

    @Test
    void testClearAllFiltersCancelsPendingColumnSearches() throws Exception {
        session.close();
        session = session(SyncSettings.DEFAULT, new Debouncer(Duration.ofMillis(100)));
        session.switchView(MASTER).join();
        CountDownLatch globalApplied = new CountDownLatch(1);
        session.addListener(() -> {
            if (!session.getFilterState().getGlobalSearch().isEmpty()) {
                globalApplied.countDown();
            }
        });

        session.onColumnSearchInput(AGENT, "ag-02");
        session.clearAllFilters();
        // scheduled after the column search, so it runs after it would have
        session.onGlobalSearchInput("P-100");

        assertThat(globalApplied.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(session.getFilterState().getColumnFilters()).isEmpty();
        assertThat(session.getFilteredRecords()).hasSize(5);
    }

    @Test
    void testEditShowsPendingValueUntilSubmitted() {
        session.editCell(P1001, GROSS, "1100");

        assertThat(session.getCellDisplay(P1001, GROSS)).isEqualTo(new CellDisplay("1100", CellStatus.PENDING, null));
        assertThat(session.getPendingChangeCount()).isEqualTo(1);
        assertThat(sheetStore.getCell(MASTER, P1001, GROSS)).contains("1000");

        BulkUpdateResult result = session.submitPendingChanges().join();

        assertThat(result.getSuccessfulUpdates()).isEqualTo(1);
        assertThat(session.hasPendingChanges()).isFalse();
        assertThat(session.getCellDisplay(P1001, GROSS)).isEqualTo(CellDisplay.committed("1100"));
        assertThat(sheetStore.getCell(MASTER, P1001, GROSS)).contains("1100");
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void testInvalidEditsAreRejectedBeforeTracking() {
        assertThatThrownBy(() -> session.editCell(P1001, GROSS, "a lot"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'a lot' is not a number");
        assertThatThrownBy(() -> session.editCell(P1001, POLICY, "P-9999"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("identity column");
        assertThatThrownBy(() -> session.editCell(RecordId.of("P-0000"), GROSS, "1"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not loaded");

        assertThat(session.hasPendingChanges()).isFalse();
    }

    @Test
    void testRejectedCellIsRevertedAndCanBeRetried() {
        session.close();
        session = session(new SyncSettings(0.5), new Debouncer(Duration.ZERO));
        session.switchView(MASTER).join();
        session.addListener(listener);
        sheetStore.rejectField(AGENT, "Protected range");
        session.editCell(P1001, GROSS, "1100");
        session.editCell(P1002, AGENT, "AG-09");

        BulkUpdateResult result = session.submitPendingChanges().join();

        assertThat(result.getFailedUpdates()).isEqualTo(1);
        assertThat(session.getCellDisplay(P1002, AGENT))
                .isEqualTo(new CellDisplay("AG-02", CellStatus.FAILED, "Protected range"));
        assertThat(session.getCellDisplay(P1001, GROSS).status()).isEqualTo(CellStatus.COMMITTED);
        assertThat(listener.errors).singleElement().isInstanceOf(PartialUpdateException.class);
        assertThat(listener.notices).isEmpty();

        assertThat(session.retryFailedChanges()).isEqualTo(1);
        assertThat(session.getCellDisplay(P1002, AGENT).status()).isEqualTo(CellStatus.PENDING);

        sheetStore.clearRejections();
        session.submitPendingChanges().join();

        assertThat(session.hasPendingChanges()).isFalse();
        assertThat(sheetStore.getCell(MASTER, P1002, AGENT)).contains("AG-09");
    }

    @Test
    void testHighFailureRateReloadsTheView() {
        sheetStore.rejectField(AGENT, "Protected range");
        session.editCell(P1001, AGENT, "AG-09");

        session.submitPendingChanges().join();

        assertThat(sheetStore.getFetchCount(MASTER)).isEqualTo(2);
        assertThat(listener.notices).containsExactly(DefaultTableSession.HIGH_FAILURE_NOTICE);
        assertThat(session.hasPendingChanges()).isFalse();
        assertThat(session.getCellDisplay(P1001, AGENT)).isEqualTo(CellDisplay.committed("AG-01"));
    }

    @Test
    void testTransportFailureKeepsEditsPending() {
        sheetStore.failNextSubmit(new IllegalStateException("connection reset"));
        session.editCell(P1001, GROSS, "1100");

        assertThatThrownBy(() -> session.submitPendingChanges().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(TransportException.class);

        assertThat(session.getSyncState()).isEqualTo(BulkSyncCoordinator.State.FAILED);
        assertThat(session.getCellDisplay(P1001, GROSS)).isEqualTo(new CellDisplay("1100", CellStatus.PENDING, null));
        assertThat(session.getFilteredRecords().get(0).get(GROSS)).isEqualTo("1000");
        assertThat(listener.errors).singleElement().isInstanceOf(TransportException.class);

        session.submitPendingChanges().join();

        assertThat(session.getSyncState()).isEqualTo(BulkSyncCoordinator.State.IDLE);
        assertThat(sheetStore.getCell(MASTER, P1001, GROSS)).contains("1100");
    }

    @Test
    void testSubmissionResolvingAfterViewSwitchIsDiscarded() {
        sheetStore.holdSubmissions();
        session.editCell(P1001, GROSS, "1100");
        CompletableFuture<BulkUpdateResult> submission = session.submitPendingChanges();
        assertThat(submission).isNotDone();

        session.switchView(Q3).join();
        sheetStore.releaseSubmissions();
        submission.join();

        assertThat(session.getActiveView()).isEqualTo(Q3);
        assertThat(session.hasPendingChanges()).isFalse();
        assertThat(pageIds()).containsExactly("Q-1");
        assertThat(session.getSyncState()).isEqualTo(BulkSyncCoordinator.State.IDLE);
    }

    @Test
    void testDiscardDropsUnsubmittedEdits() {
        session.editCell(P1001, GROSS, "1100");
        session.editCell(P1002, GROSS, "600");

        assertThat(session.discardPendingChanges()).isEqualTo(2);

        assertThat(session.hasPendingChanges()).isFalse();
        assertThat(session.getCellDisplay(P1002, GROSS)).isEqualTo(CellDisplay.committed("500"));
        assertThat(session.submitPendingChanges().join().getTotalUpdates()).isZero();
    }

    @Test
    void testSheetStatsAreServedFromTheCache() {
        sheetStore.setStats(new FilteredStatsCalculator(StatsColumns.DEFAULT).calculate(session.getFilteredRecords()));

        SheetStats first = session.getSheetStats(false).join();
        SheetStats second = session.getSheetStats(false).join();

        assertThat(second).isEqualTo(first);
        assertThat(first.totalRecords()).isEqualTo(5);
        assertThat(sheetStore.getStatsFetchCount()).isEqualTo(1);
    }

    private static final class RecordingListener implements TableSessionListener {
        final AtomicInteger stateChanges = new AtomicInteger();
        final List<SheetGridException> errors = new CopyOnWriteArrayList<>();
        final List<String> notices = new CopyOnWriteArrayList<>();

        @Override
        public void onStateChanged() {
            stateChanges.incrementAndGet();
        }

        @Override
        public void onSyncFailed(SheetGridException error) {
            log.debug("Sync failed: {}", error.getMessage());
            errors.add(error);
        }

        @Override
        public void onViewRefreshed(ViewId viewId, String notice) {
            notices.add(notice);
        }
    }
}
