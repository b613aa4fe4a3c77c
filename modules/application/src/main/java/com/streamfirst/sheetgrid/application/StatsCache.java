package com.streamfirst.sheetgrid.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.sheetgrid.domain.CacheEntry;
import com.streamfirst.sheetgrid.ports.KeyValueStorePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Caches an expensive aggregate in memory and in a durable key/value store.
 *
 * <p>The in-memory value is served while it is younger than the freshness window. After that the
 * value is fetched again; concurrent callers share one fetch. If the fetch fails, a durable value
 * younger than the grace window is served instead. The durable entry is a JSON document
 * {@code {"value": ..., "timestamp": epochMillis}} under a single key.
 *
 * @param <T> type of the cached aggregate, must be bindable by Jackson
 */
@Slf4j
public class StatsCache<T> {

    private final Supplier<CompletableFuture<T>> fetcher;
    private final KeyValueStorePort durableStore;
    private final ObjectMapper objectMapper;
    private final JavaType durableType;
    private final StatsCacheSettings settings;
    private final Clock clock;

    private CacheEntry<T> memory;
    private CompletableFuture<T> inFlight;

    public StatsCache(
            Supplier<CompletableFuture<T>> fetcher,
            KeyValueStorePort durableStore,
            ObjectMapper objectMapper,
            Class<T> valueType,
            StatsCacheSettings settings,
            Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "Fetcher cannot be null");
        this.durableStore = Objects.requireNonNull(durableStore, "Durable store cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        Objects.requireNonNull(valueType, "Value type cannot be null");
        this.durableType = objectMapper.getTypeFactory().constructParametricType(DurableEntry.class, valueType);
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public CompletableFuture<T> get() {
        return get(false);
    }

    /**
     * Returns the aggregate.
     *
     * @param forceRefresh fetch even if the in-memory value is still fresh
     */
    public synchronized CompletableFuture<T> get(boolean forceRefresh) {
        if (!forceRefresh && memory != null && memory.isWithin(settings.freshnessWindow(), clock.instant())) {
            log.debug("Serving cached value fetched at {}", memory.fetchedAt());
            return CompletableFuture.completedFuture(memory.value());
        }
        if (inFlight != null) {
            return inFlight;
        }

        CompletableFuture<T> fetch;
        try {
            fetch = fetcher.get();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> result = fetch.handle(this::complete);
        if (!result.isDone()) {
            inFlight = result;
        }
        return result;
    }

    /** Current in-memory entry, if any. */
    public synchronized Optional<CacheEntry<T>> peek() {
        return Optional.ofNullable(memory);
    }

    /** Drops the in-memory value and the durable entry. */
    public synchronized void invalidate() {
        memory = null;
        try {
            durableStore.delete(settings.cacheKey());
        } catch (UncheckedIOException e) {
            log.warn("Could not delete durable cache entry '{}'", settings.cacheKey(), e);
        }
    }

    private synchronized T complete(T value, Throwable error) {
        inFlight = null;
        if (error == null) {
            memory = new CacheEntry<>(value, clock.instant());
            persist(memory);
            return value;
        }

        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        Instant now = clock.instant();
        Optional<CacheEntry<T>> durable = readDurable();
        if (durable.isPresent() && durable.get().isWithin(settings.graceWindow(), now)) {
            log.warn(
                    "Fetch failed, serving durable value from {} ({} old)",
                    durable.get().fetchedAt(),
                    durable.get().age(now),
                    cause);
            return durable.get().value();
        }
        log.error("Fetch failed and no durable value within {} is available", settings.graceWindow(), cause);
        throw cause instanceof RuntimeException runtime ? runtime : new CompletionException(cause);
    }

    private void persist(CacheEntry<T> entry) {
        DurableEntry<T> document = new DurableEntry<>(entry.value(), entry.fetchedAt().toEpochMilli());
        try {
            durableStore.put(settings.cacheKey(), objectMapper.writeValueAsBytes(document));
        } catch (JsonProcessingException | UncheckedIOException e) {
            log.warn("Could not persist cache entry '{}'", settings.cacheKey(), e);
        }
    }

    private Optional<CacheEntry<T>> readDurable() {
        try {
            Optional<byte[]> bytes = durableStore.get(settings.cacheKey());
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            DurableEntry<T> document = objectMapper.readValue(bytes.get(), durableType);
            if (document.value() == null || document.timestamp() == null) {
                log.warn("Ignoring incomplete durable cache entry '{}'", settings.cacheKey());
                return Optional.empty();
            }
            return Optional.of(new CacheEntry<>(document.value(), Instant.ofEpochMilli(document.timestamp())));
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read durable cache entry '{}'", settings.cacheKey(), e);
            return Optional.empty();
        }
    }

    /** Layout of the durable entry: {@code {"value": ..., "timestamp": epochMillis}}. */
    record DurableEntry<T>(T value, Long timestamp) {}
}
