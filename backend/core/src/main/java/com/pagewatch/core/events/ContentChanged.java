package com.pagewatch.core.events;

import java.time.Instant;

public record ContentChanged(
        Instant timestamp,
        long monitorId,
        long userId,
        String url,
        String oldHash,
        String newHash
) implements Event {
    @Override
    public String type() {
        return "ContentChanged";
    }
}
