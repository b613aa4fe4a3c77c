package com.streamfirst.sheetgrid.boot;

import com.streamfirst.sheetgrid.application.SessionSettings;
import com.streamfirst.sheetgrid.application.StatsCacheSettings;
import com.streamfirst.sheetgrid.application.StatsColumns;
import com.streamfirst.sheetgrid.application.SyncSettings;
import com.streamfirst.sheetgrid.application.ValidationSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/** Settings bound from the {@code sheetgrid.*} namespace. */
@Data
@ConfigurationProperties("sheetgrid")
public class SheetGridProperties {

    /** Column holding the business identity of each row */
    private String identityColumn = "Policy number";

    /** View loaded on startup */
    private String defaultView = "Master";

    private int defaultPageSize = SessionSettings.DEFAULT_PAGE_SIZE;

    /** Fraction of rejected updates in one submission above which the view is reloaded */
    private double failureRateThreshold = SyncSettings.DEFAULT.failureRateThreshold();

    /** Quiet time before typed search input is applied */
    private Duration searchDebounce = SessionSettings.DEFAULT_SEARCH_DEBOUNCE;

    private Stats stats = new Stats();

    private Validation validation = new Validation();

    private Demo demo = new Demo();

    @Data
    public static class Stats {
        private Duration freshnessWindow = StatsCacheSettings.DEFAULT.freshnessWindow();
        private Duration graceWindow = StatsCacheSettings.DEFAULT.graceWindow();
        private String cacheKey = StatsCacheSettings.DEFAULT.cacheKey();

        /** Directory of the durable stats cache; kept in memory when unset */
        private Path cacheDirectory;

        private Columns columns = new Columns();
    }

    @Data
    public static class Columns {
        private String policyNumber = StatsColumns.DEFAULT.policyNumber();
        private String grossPremium = StatsColumns.DEFAULT.grossPremium();
        private String netPremium = StatsColumns.DEFAULT.netPremium();
        private String cutpayAmount = StatsColumns.DEFAULT.cutpayAmount();
        private String agentCode = StatsColumns.DEFAULT.agentCode();
        private String insurerName = StatsColumns.DEFAULT.insurerName();
        private String reportingMonth = StatsColumns.DEFAULT.reportingMonth();
    }

    @Data
    public static class Validation {
        private Set<String> numericColumns = new LinkedHashSet<>();
        private Set<String> dateColumns = new LinkedHashSet<>();
        private Set<String> readOnlyColumns = new LinkedHashSet<>();
    }

    @Data
    public static class Demo {
        /** Seed the in-memory store and walk through a filter/edit/submit cycle on startup */
        private boolean enabled;
    }

    public SessionSettings toSessionSettings() {
        return new SessionSettings(identityColumn, defaultPageSize, searchDebounce);
    }

    public SyncSettings toSyncSettings() {
        return new SyncSettings(failureRateThreshold);
    }

    public StatsCacheSettings toStatsCacheSettings() {
        return new StatsCacheSettings(stats.freshnessWindow, stats.graceWindow, stats.cacheKey);
    }

    public StatsColumns toStatsColumns() {
        Columns c = stats.columns;
        return new StatsColumns(
                c.policyNumber, c.grossPremium, c.netPremium, c.cutpayAmount, c.agentCode, c.insurerName, c.reportingMonth);
    }

    public ValidationSettings toValidationSettings() {
        return new ValidationSettings(
                identityColumn, validation.numericColumns, validation.dateColumns, validation.readOnlyColumns);
    }
}
