package com.pagewatch.checker.check;

import com.pagewatch.checker.api.MonitorStore;
import com.pagewatch.checker.api.Notifier;
import com.pagewatch.checker.api.PageFetcher;
import com.pagewatch.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record CheckContext(
        PageFetcher fetcher,
        MonitorStore store,
        Notifier notifier,
        EventBus eventBus,
        Clock clock
) {
    public CheckContext {
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(notifier, "notifier is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
