package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.CellValues;
import com.streamfirst.sheetgrid.domain.SheetRecord;
import com.streamfirst.sheetgrid.domain.SheetStats;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregates the rows currently passing the filters into the same shape the remote store reports
 * for the whole sheet. Unparsable amounts count as zero.
 */
@RequiredArgsConstructor
public class FilteredStatsCalculator {

    static final int TOP_LIMIT = 10;

    private final StatsColumns columns;

    public SheetStats calculate(List<SheetRecord> records) {
        if (records.isEmpty()) {
            return SheetStats.EMPTY;
        }

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;
        BigDecimal cutpay = BigDecimal.ZERO;
        int cutpayTransactions = 0;
        Set<String> policies = new HashSet<>();
        Map<String, BigDecimal> byAgent = new LinkedHashMap<>();
        Map<String, BigDecimal> byInsurer = new LinkedHashMap<>();
        Map<String, MonthAccumulator> byMonth = new TreeMap<>();

        for (SheetRecord record : records) {
            BigDecimal recordGross = amount(record, columns.grossPremium());
            BigDecimal recordCutpay = amount(record, columns.cutpayAmount());
            gross = gross.add(recordGross);
            net = net.add(amount(record, columns.netPremium()));
            cutpay = cutpay.add(recordCutpay);
            if (recordCutpay.signum() > 0) {
                cutpayTransactions++;
            }

            String policy = text(record, columns.policyNumber());
            if (!policy.isEmpty()) {
                policies.add(policy);
            }
            String agent = text(record, columns.agentCode());
            if (!agent.isEmpty()) {
                byAgent.merge(agent, recordGross, BigDecimal::add);
            }
            String insurer = text(record, columns.insurerName());
            if (!insurer.isEmpty()) {
                byInsurer.merge(insurer, recordGross, BigDecimal::add);
            }
            String month = text(record, columns.reportingMonth());
            if (!month.isEmpty()) {
                byMonth.computeIfAbsent(month, m -> new MonthAccumulator()).add(recordGross, policy);
            }
        }

        List<SheetStats.MonthlyTotal> monthly =
                byMonth.entrySet().stream()
                        .map(e -> new SheetStats.MonthlyTotal(e.getKey(), e.getValue().premium, e.getValue().policies.size()))
                        .toList();

        return new SheetStats(
                records.size(),
                policies.size(),
                cutpayTransactions,
                gross,
                net,
                cutpay,
                top(byAgent),
                top(byInsurer),
                monthly);
    }

    private static List<SheetStats.RankedTotal> top(Map<String, BigDecimal> totals) {
        return totals.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_LIMIT)
                .map(e -> new SheetStats.RankedTotal(e.getKey(), e.getValue()))
                .toList();
    }

    private static BigDecimal amount(SheetRecord record, String column) {
        return CellValues.parseNumber(record.get(column)).orElse(BigDecimal.ZERO);
    }

    private static String text(SheetRecord record, String column) {
        return CellValues.stringify(record.get(column)).trim();
    }

    private static final class MonthAccumulator {
        private BigDecimal premium = BigDecimal.ZERO;
        private final Set<String> policies = new HashSet<>();

        void add(BigDecimal amount, String policy) {
            premium = premium.add(amount);
            if (!policy.isEmpty()) {
                policies.add(policy);
            }
        }
    }
}
