package com.streamfirst.sheetgrid.application;

import java.time.Duration;
import java.util.Objects;

/**
 * Behaviour of a {@link DefaultTableSession}.
 *
 * @param identityColumn column holding the business identity of each row
 * @param defaultPageSize rows per page after loading a view
 * @param searchDebounce quiet time before typed search input is applied
 */
public record SessionSettings(String identityColumn, int defaultPageSize, Duration searchDebounce) {
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final Duration DEFAULT_SEARCH_DEBOUNCE = Duration.ofMillis(300);

    public SessionSettings {
        Objects.requireNonNull(identityColumn, "Identity column cannot be null");
        Objects.requireNonNull(searchDebounce, "Search debounce cannot be null");
        if (identityColumn.isBlank()) {
            throw new IllegalArgumentException("Identity column cannot be blank");
        }
        if (defaultPageSize < 1) {
            throw new IllegalArgumentException("Default page size must be positive, got " + defaultPageSize);
        }
    }

    public static SessionSettings withDefaults(String identityColumn) {
        return new SessionSettings(identityColumn, DEFAULT_PAGE_SIZE, DEFAULT_SEARCH_DEBOUNCE);
    }
}
