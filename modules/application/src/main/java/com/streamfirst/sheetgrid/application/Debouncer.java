package com.streamfirst.sheetgrid.application;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Delays an action until its key has been quiet for the configured delay. Submitting the same key
 * again before the delay elapses cancels the earlier action. Actions of different keys are
 * independent.
 */
@Slf4j
public class Debouncer implements AutoCloseable {

    @Getter private final Duration delay;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Map<Object, ScheduledFuture<?>> scheduled = new HashMap<>();

    public Debouncer(Duration delay) {
        this(delay, newScheduler(), true);
    }

    /** Uses a caller-owned scheduler, which {@link #close()} leaves running. */
    public Debouncer(Duration delay, ScheduledExecutorService scheduler) {
        this(delay, scheduler, false);
    }

    private Debouncer(Duration delay, ScheduledExecutorService scheduler, boolean ownsScheduler) {
        Objects.requireNonNull(delay, "Delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay cannot be negative: " + delay);
        }
        this.delay = delay;
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
    }

    /** Schedules {@code action}, replacing any action still waiting under {@code key}. */
    public synchronized void submit(Object key, Runnable action) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        ScheduledFuture<?> previous = scheduled.get(key);
        if (previous != null) {
            previous.cancel(false);
        }
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        self[0] =
                scheduler.schedule(
                        () -> run(key, action, self), delay.toMillis(), TimeUnit.MILLISECONDS);
        scheduled.put(key, self[0]);
    }

    /** Cancels the action waiting under {@code key}, if any. */
    public synchronized boolean cancel(Object key) {
        ScheduledFuture<?> previous = scheduled.remove(key);
        return previous != null && previous.cancel(false);
    }

    /** Cancels every waiting action whose key satisfies {@code keyFilter}. Returns how many were cancelled. */
    public synchronized int cancelIf(Predicate<Object> keyFilter) {
        Objects.requireNonNull(keyFilter, "Key filter cannot be null");
        int cancelled = 0;
        Iterator<Map.Entry<Object, ScheduledFuture<?>>> entries = scheduled.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<Object, ScheduledFuture<?>> entry = entries.next();
            if (keyFilter.test(entry.getKey())) {
                entries.remove();
                if (entry.getValue().cancel(false)) {
                    cancelled++;
                }
            }
        }
        return cancelled;
    }

    public synchronized boolean isPending(Object key) {
        ScheduledFuture<?> future = scheduled.get(key);
        return future != null && !future.isDone();
    }

    @Override
    public synchronized void close() {
        scheduled.values().forEach(future -> future.cancel(false));
        scheduled.clear();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private void run(Object key, Runnable action, ScheduledFuture<?>[] self) {
        synchronized (this) {
            if (scheduled.get(key) == self[0]) {
                scheduled.remove(key);
            }
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Debounced action for '{}' failed", key, e);
        }
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(
                runnable -> {
                    Thread thread = new Thread(runnable, "sheetgrid-debounce");
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
