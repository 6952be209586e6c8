package com.pagewatch.core.events;

import java.time.Instant;

public record StatusReported(
        Instant timestamp,
        int totalMonitors,
        int activeMonitors,
        int scheduledTimers
) implements Event {
    @Override
    public String type() {
        return "StatusReported";
    }
}
