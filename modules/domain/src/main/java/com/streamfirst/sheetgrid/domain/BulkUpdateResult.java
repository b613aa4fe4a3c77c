package com.streamfirst.sheetgrid.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Structured response to a bulk update. Individual items can fail while others succeed; the store
 * gives no atomicity across items.
 */
@Value
public class BulkUpdateResult {
    String message;
    int totalUpdates;
    int successfulUpdates;
    int failedUpdates;
    @NonNull List<ItemResult> results;
    @NonNull Duration processingTime;

    public static BulkUpdateResult empty() {
        return new BulkUpdateResult("No changes to save", 0, 0, 0, List.of(), Duration.ZERO);
    }

    /** Derives the counters from the item results. */
    public static BulkUpdateResult of(List<ItemResult> results, Duration processingTime) {
        int successful = (int) results.stream().filter(ItemResult::success).count();
        int failed = results.size() - successful;
        return new BulkUpdateResult(
                "Bulk update completed: " + successful + " successful, " + failed + " failed",
                results.size(),
                successful,
                failed,
                List.copyOf(results),
                processingTime);
    }

    /** Fraction of updates that failed, zero for an empty batch. */
    public double failureRate() {
        return totalUpdates == 0 ? 0.0 : (double) failedUpdates / totalUpdates;
    }

    public boolean hasFailures() {
        return failedUpdates > 0;
    }

    public List<ItemResult> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }
}
