package com.pagewatch.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Something went wrong around a monitor without stopping the service: a page could not be fetched,
 * a user could not be notified, or a scheduled check failed outright.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String FETCH = "fetch";
    public static final String NOTIFICATION = "notification";
    public static final String SCHEDULER = "scheduler";

    public static AlertRaised forMonitor(Instant timestamp, String category, String message, long monitorId, String url) {
        return new AlertRaised(timestamp, category, message, Map.of("monitorId", monitorId, "url", url));
    }

    @Override
    public String type() {
        return "AlertRaised";
    }
}
