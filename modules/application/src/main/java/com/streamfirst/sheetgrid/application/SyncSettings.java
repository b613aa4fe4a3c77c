package com.streamfirst.sheetgrid.application;

/**
 * Tuning of bulk synchronisation.
 *
 * @param failureRateThreshold fraction of failed items above which the whole view is refetched
 */
public record SyncSettings(double failureRateThreshold) {
    public static final SyncSettings DEFAULT = new SyncSettings(0.10);

    public SyncSettings {
        if (failureRateThreshold < 0.0 || failureRateThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "Failure rate threshold must be between 0 and 1, got " + failureRateThreshold);
        }
    }
}
