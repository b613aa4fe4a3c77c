package com.streamfirst.sheetgrid.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate figures over a set of sheet rows. The same shape is returned by the remote store for
 * the whole sheet and computed locally over the filtered rows.
 */
public record SheetStats(
        int totalRecords,
        int totalPolicies,
        int totalCutpayTransactions,
        BigDecimal totalGrossPremium,
        BigDecimal totalNetPremium,
        BigDecimal totalCutpayAmount,
        List<RankedTotal> topAgents,
        List<RankedTotal> topInsurers,
        List<MonthlyTotal> monthlySummary) {

    public static final SheetStats EMPTY =
            new SheetStats(0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, List.of(), List.of(), List.of());

    public SheetStats {
        topAgents = topAgents == null ? List.of() : List.copyOf(topAgents);
        topInsurers = topInsurers == null ? List.of() : List.copyOf(topInsurers);
        monthlySummary = monthlySummary == null ? List.of() : List.copyOf(monthlySummary);
    }

    /** Gross premium accumulated under one key (an agent code or an insurer name). */
    public record RankedTotal(String key, BigDecimal totalGrossPremium) {}

    /** Gross premium and distinct policy count for one reporting month. */
    public record MonthlyTotal(String month, BigDecimal totalGrossPremium, int totalPolicies) {}
}
