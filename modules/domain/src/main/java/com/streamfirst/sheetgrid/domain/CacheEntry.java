package com.streamfirst.sheetgrid.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value together with the moment it was fetched.
 *
 * @param <T> type of the cached value
 */
public record CacheEntry<T>(T value, Instant fetchedAt) {
    public CacheEntry {
        Objects.requireNonNull(value, "Cached value cannot be null");
        Objects.requireNonNull(fetchedAt, "Fetch time cannot be null");
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    /** Valid while {@code now - fetchedAt < window}. */
    public boolean isWithin(Duration window, Instant now) {
        return age(now).compareTo(window) < 0;
    }
}
