package com.pagewatch.service.config;

import com.pagewatch.service.store.JsonlEventStore;

import java.time.Duration;

public record PageWatchConfig(
        String stateFile,
        String eventLogFile,
        String outboxFile,
        Duration requestTimeout,
        Duration connectTimeout,
        Duration initialDelay,
        Integer workerThreads,
        Long adminUserId,
        Duration reportInterval,
        Long eventLogMaxBytes
) {
    public PageWatchConfig {
        stateFile = stateFile == null ? "state/monitors.json" : stateFile;
        eventLogFile = eventLogFile == null ? "logs/events.jsonl" : eventLogFile;
        outboxFile = outboxFile == null ? "data/outbox.jsonl" : outboxFile;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(15) : requestTimeout;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        initialDelay = initialDelay == null ? Duration.ofSeconds(10) : initialDelay;
        workerThreads = workerThreads == null ? 4 : workerThreads;
        reportInterval = reportInterval == null ? Duration.ofHours(24) : reportInterval;
        eventLogMaxBytes = eventLogMaxBytes == null ? JsonlEventStore.DEFAULT_MAX_BYTES : eventLogMaxBytes;
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        if (eventLogMaxBytes < 1) {
            throw new IllegalArgumentException("eventLogMaxBytes must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static PageWatchConfig defaults() {
        return new PageWatchConfig(null, null, null, null, null, null, null, null, null, null);
    }

    public PageWatchConfig withAdminUserId(Long adminId) {
        return new PageWatchConfig(stateFile, eventLogFile, outboxFile, requestTimeout, connectTimeout,
                initialDelay, workerThreads, adminId, reportInterval, eventLogMaxBytes);
    }
}
