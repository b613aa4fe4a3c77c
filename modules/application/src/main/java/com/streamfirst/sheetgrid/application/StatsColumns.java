package com.streamfirst.sheetgrid.application;

import java.util.Objects;

/** Names of the sheet columns that feed {@link FilteredStatsCalculator}. */
public record StatsColumns(
        String policyNumber,
        String grossPremium,
        String netPremium,
        String cutpayAmount,
        String agentCode,
        String insurerName,
        String reportingMonth) {

    public static final StatsColumns DEFAULT =
            new StatsColumns(
                    "Policy number",
                    "Gross premium",
                    "Net premium",
                    "Cut Pay Amount Received From Agent",
                    "Agent Code",
                    "Insurer name",
                    "Reporting Month (mmm'yy)");

    public StatsColumns {
        Objects.requireNonNull(policyNumber, "Policy number column cannot be null");
        Objects.requireNonNull(grossPremium, "Gross premium column cannot be null");
        Objects.requireNonNull(netPremium, "Net premium column cannot be null");
        Objects.requireNonNull(cutpayAmount, "Cut pay column cannot be null");
        Objects.requireNonNull(agentCode, "Agent column cannot be null");
        Objects.requireNonNull(insurerName, "Insurer column cannot be null");
        Objects.requireNonNull(reportingMonth, "Reporting month column cannot be null");
    }
}
