package com.streamfirst.sheetgrid.application;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and storage key of a {@link StatsCache}.
 *
 * @param freshnessWindow how long an in-memory value is served without refetching
 * @param graceWindow how old a durable value may be to still serve as a fallback when fetching fails
 * @param cacheKey key of the durable entry
 */
public record StatsCacheSettings(Duration freshnessWindow, Duration graceWindow, String cacheKey) {
    public static final StatsCacheSettings DEFAULT =
            new StatsCacheSettings(Duration.ofMinutes(5), Duration.ofHours(1), "sheet-stats");

    public StatsCacheSettings {
        Objects.requireNonNull(freshnessWindow, "Freshness window cannot be null");
        Objects.requireNonNull(graceWindow, "Grace window cannot be null");
        Objects.requireNonNull(cacheKey, "Cache key cannot be null");
        if (freshnessWindow.isNegative() || graceWindow.isNegative()) {
            throw new IllegalArgumentException("Cache windows cannot be negative");
        }
        if (cacheKey.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be blank");
        }
    }
}
