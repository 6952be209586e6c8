package com.pagewatch.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Context carried by one recurring timer. Holds only what is needed to re-fetch; the mutable
 * monitor state is always re-read from the store on each tick.
 */
public record MonitorJob(long monitorId, String url, long userId, int intervalMinutes) {
    public MonitorJob {
        Objects.requireNonNull(url, "url is required");
        if (intervalMinutes < Monitor.MIN_INTERVAL_MINUTES) {
            throw new IllegalArgumentException("intervalMinutes must be at least " + Monitor.MIN_INTERVAL_MINUTES);
        }
    }

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    public String key() {
        return Long.toString(monitorId);
    }
}
