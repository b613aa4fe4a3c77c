package com.streamfirst.sheetgrid.perf;

import com.streamfirst.sheetgrid.application.FilterEngine;
import com.streamfirst.sheetgrid.application.FilteredStatsCalculator;
import com.streamfirst.sheetgrid.application.Paginator;
import com.streamfirst.sheetgrid.application.SortEngine;
import com.streamfirst.sheetgrid.application.StatsColumns;
import com.streamfirst.sheetgrid.domain.ColumnFilter;
import com.streamfirst.sheetgrid.domain.FilterState;
import com.streamfirst.sheetgrid.domain.Page;
import com.streamfirst.sheetgrid.domain.PaginationState;
import com.streamfirst.sheetgrid.domain.SheetRecord;
import com.streamfirst.sheetgrid.domain.SheetStats;
import com.streamfirst.sheetgrid.domain.SortDirection;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/** Filter, sort and page a synthetic policy sheet, the work done on every keystroke. */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class FilterPipelineBenchmark {

    private static final String[] INSURERS = {"HDFC Ergo", "ICICI Lombard", "Tata AIG", "Bajaj Allianz", "New India"};
    private static final String[] MONTHS = {"Jan'25", "Feb'25", "Mar'25", "Apr'25", "May'25", "Jun'25"};

    @Param({"1000", "10000", "50000"})
    private int rows;

    private final FilterEngine filterEngine = new FilterEngine();
    private final SortEngine sortEngine = new SortEngine();
    private final Paginator paginator = new Paginator();
    private final FilteredStatsCalculator statsCalculator = new FilteredStatsCalculator(StatsColumns.DEFAULT);

    private List<SheetRecord> records;
    private FilterState searchAndRange;

    @Setup
    public void setup() {
        Random random = new Random(42);
        records = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("Policy number", "P-" + (100000 + i));
            fields.put("Agent Code", "AG-" + random.nextInt(200));
            fields.put("Insurer name", INSURERS[random.nextInt(INSURERS.length)]);
            fields.put("Gross premium", String.valueOf(1000 + random.nextInt(20000)));
            fields.put("Net premium", String.valueOf(800 + random.nextInt(17000)));
            fields.put("Cut Pay Amount Received From Agent", random.nextInt(4) == 0 ? "500" : "0");
            fields.put("Reporting Month (mmm'yy)", MONTHS[random.nextInt(MONTHS.length)]);
            records.add(SheetRecord.of("Policy number", fields));
        }
        searchAndRange =
                FilterState.EMPTY
                        .withGlobalSearch("ag-1")
                        .withColumnFilter("Insurer name", ColumnFilter.ValueSet.of("HDFC Ergo", "Tata AIG"))
                        .withColumnFilter("Gross premium", ColumnFilter.NumberRange.atLeast(new BigDecimal("5000")))
                        .withSort("Gross premium", SortDirection.DESC);
    }

    @Benchmark
    public Page filterSortAndPage() {
        List<SheetRecord> filtered = filterEngine.apply(records, searchAndRange);
        List<SheetRecord> sorted = sortEngine.apply(filtered, searchAndRange.getSortBy(), searchAndRange.getSortDirection());
        return paginator.slice(sorted, PaginationState.firstPage(50));
    }

    @Benchmark
    public List<SheetRecord> sortOnly() {
        return sortEngine.apply(records, "Agent Code", SortDirection.ASC);
    }

    @Benchmark
    public SheetStats filteredStats() {
        return statsCalculator.calculate(filterEngine.apply(records, searchAndRange));
    }
}
