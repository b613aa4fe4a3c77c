package com.streamfirst.sheetgrid.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.sheetgrid.adapters.FileKeyValueStoreAdapter;
import com.streamfirst.sheetgrid.adapters.InMemoryKeyValueStoreAdapter;
import com.streamfirst.sheetgrid.adapters.InMemorySheetStoreAdapter;
import com.streamfirst.sheetgrid.application.*;
import com.streamfirst.sheetgrid.domain.*;
import com.streamfirst.sheetgrid.ports.KeyValueStorePort;
import com.streamfirst.sheetgrid.ports.SheetStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/** Wires a table session over the in-memory sheet store and optionally runs a walkthrough. */
@Slf4j
@Configuration
@EnableConfigurationProperties(SheetGridProperties.class)
public class SheetGridConfiguration {

    // --- Adapter beans ---

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SheetStorePort sheetStore(SheetGridProperties properties) {
        log.info("Creating in-memory sheet store keyed by '{}'", properties.getIdentityColumn());
        return new InMemorySheetStoreAdapter(properties.getIdentityColumn());
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStorePort statsDurableStore(SheetGridProperties properties) {
        if (properties.getStats().getCacheDirectory() == null) {
            log.info("No stats cache directory configured, keeping durable stats in memory");
            return new InMemoryKeyValueStoreAdapter();
        }
        log.info("Persisting stats cache under {}", properties.getStats().getCacheDirectory());
        return new FileKeyValueStoreAdapter(properties.getStats().getCacheDirectory());
    }

    // --- Application beans ---

    @Bean
    public StatsCache<SheetStats> statsCache(
            SheetStorePort sheetStore,
            KeyValueStorePort statsDurableStore,
            ObjectMapper objectMapper,
            SheetGridProperties properties,
            Clock clock) {
        return new StatsCache<>(
                sheetStore::fetchStats,
                statsDurableStore,
                objectMapper,
                SheetStats.class,
                properties.toStatsCacheSettings(),
                clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CellValidator cellValidator(SheetGridProperties properties) {
        return new ColumnFormatValidator(properties.toValidationSettings());
    }

    @Bean
    public TableSession tableSession(
            SheetStorePort sheetStore,
            StatsCache<SheetStats> statsCache,
            CellValidator cellValidator,
            SheetGridProperties properties,
            Clock clock) {
        return new DefaultTableSession(
                sheetStore,
                statsCache,
                cellValidator,
                properties.toSessionSettings(),
                properties.toSyncSettings(),
                properties.toStatsColumns(),
                clock);
    }

    // --- Walkthrough ---

    @Bean
    @ConditionalOnProperty(prefix = "sheetgrid.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(TableSession session, SheetStorePort sheetStore, SheetGridProperties properties) {
        return args -> {
            log.info("--- Starting sheet grid walkthrough ---");
            ViewId view = ViewId.of(properties.getDefaultView());
            if (sheetStore instanceof InMemorySheetStoreAdapter store) {
                seed(store, view);
            }

            session.switchView(view).join();
            log.info("STEP 1: Loaded view {} with {} records", view, session.getPage().totalRecords());

            session.setColumnFilter("Insurer name", ColumnFilter.ValueSet.of("HDFC Ergo"));
            session.toggleSort("Gross premium");
            session.toggleSort("Gross premium");
            Page page = session.getPage();
            log.info("STEP 2: Filters {} leave {} records", session.getFilterState().summary(), page.totalRecords());
            page.data().forEach(record -> log.info("  -> {} {}", record.getId(), record.get("Gross premium")));

            SheetStats filtered = session.getFilteredStats();
            log.info(
                    "STEP 3: Filtered gross premium {} over {} policies",
                    filtered.totalGrossPremium(),
                    filtered.totalPolicies());

            session.editCell(RecordId.of("P-1003"), "Net premium", "7400");
            session.editCell(RecordId.of("P-1005"), "Agent Code", "AG-07");
            log.info("STEP 4: {} edit(s) pending", session.getPendingChangeCount());

            BulkUpdateResult result = session.submitPendingChanges().join();
            log.info("STEP 5: {} in {}", result.getMessage(), result.getProcessingTime());

            SheetStats sheetStats = session.getSheetStats(false).join();
            log.info("STEP 6: Sheet has {} records, top agent {}", sheetStats.totalRecords(), sheetStats.topAgents());

            log.info("--- Walkthrough finished ---");
        };
    }

    private static void seed(InMemorySheetStoreAdapter store, ViewId view) {
        List<String> headers =
                List.of(
                        "Policy number",
                        "Agent Code",
                        "Insurer name",
                        "Gross premium",
                        "Net premium",
                        "Cut Pay Amount Received From Agent",
                        "Reporting Month (mmm'yy)");
        List<Map<String, String>> rows =
                List.of(
                        row("P-1001", "AG-01", "HDFC Ergo", "12000", "10169", "0", "Jan'25"),
                        row("P-1002", "AG-02", "ICICI Lombard", "8500", "7203", "1200", "Jan'25"),
                        row("P-1003", "AG-01", "HDFC Ergo", "8800", "7457", "0", "Feb'25"),
                        row("P-1004", "AG-03", "Tata AIG", "15400", "13050", "2500", "Feb'25"),
                        row("P-1005", "AG-02", "HDFC Ergo", "4300", "3644", "600", "Mar'25"));
        store.putView(view, headers, rows);
        List<SheetRecord> records = rows.stream().map(r -> SheetRecord.of("Policy number", r)).toList();
        store.setStats(new FilteredStatsCalculator(StatsColumns.DEFAULT).calculate(records));
    }

    private static Map<String, String> row(
            String policy, String agent, String insurer, String gross, String net, String cutpay, String month) {
        return Map.of(
                "Policy number", policy,
                "Agent Code", agent,
                "Insurer name", insurer,
                "Gross premium", gross,
                "Net premium", net,
                "Cut Pay Amount Received From Agent", cutpay,
                "Reporting Month (mmm'yy)", month);
    }
}
