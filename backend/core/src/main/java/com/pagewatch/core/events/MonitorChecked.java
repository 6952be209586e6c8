package com.pagewatch.core.events;

import java.time.Instant;

public record MonitorChecked(
        Instant timestamp,
        long monitorId,
        String url,
        String outcome,
        String summary,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "MonitorChecked";
    }
}
