package com.pagewatch.core.model;

import java.time.Instant;
import java.util.Objects;

public record Monitor(
        long id,
        long userId,
        String url,
        int intervalMinutes,
        Instant lastChecked,
        String contentHash,
        boolean active
) {
    public static final int MIN_INTERVAL_MINUTES = 5;

    public Monitor {
        Objects.requireNonNull(url, "url is required");
        if (intervalMinutes < MIN_INTERVAL_MINUTES) {
            throw new IllegalArgumentException(
                    "intervalMinutes must be at least " + MIN_INTERVAL_MINUTES + " but was " + intervalMinutes
            );
        }
    }

    public static Monitor newMonitor(long userId, String url, int intervalMinutes) {
        return new Monitor(0L, userId, url, intervalMinutes, null, null, true);
    }

    public Monitor withId(long newId) {
        return new Monitor(newId, userId, url, intervalMinutes, lastChecked, contentHash, active);
    }

    public Monitor withInterval(int minutes) {
        return new Monitor(id, userId, url, minutes, lastChecked, contentHash, active);
    }

    public Monitor withActive(boolean flag) {
        return new Monitor(id, userId, url, intervalMinutes, lastChecked, contentHash, flag);
    }

    public Monitor withFields(MonitorFields fields) {
        return new Monitor(id, userId, url, intervalMinutes, fields.lastChecked(), fields.contentHash(), active);
    }

    public MonitorJob toJob() {
        return new MonitorJob(id, url, userId, intervalMinutes);
    }
}
