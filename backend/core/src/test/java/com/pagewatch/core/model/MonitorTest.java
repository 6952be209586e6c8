package com.pagewatch.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorTest {
    @Test
    void intervalBelowMinimumIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Monitor.newMonitor(1L, "https://example.com", 4));
        assertThrows(IllegalArgumentException.class, () -> new MonitorJob(1L, "https://example.com", 1L, 0));
        assertEquals(5, Monitor.newMonitor(1L, "https://example.com", 5).intervalMinutes());
    }

    @Test
    void newMonitorStartsActiveWithoutBaseline() {
        Monitor monitor = Monitor.newMonitor(9L, "https://example.com", 60);

        assertTrue(monitor.active());
        assertNull(monitor.contentHash());
        assertNull(monitor.lastChecked());
    }

    @Test
    void withFieldsOnlyTouchesHashAndTimestamp() {
        Monitor monitor = new Monitor(3L, 9L, "https://example.com", 30, null, null, false);
        Instant now = Instant.parse("2026-02-12T20:00:00Z");

        Monitor updated = monitor.withFields(new MonitorFields("digest", now));

        assertEquals("digest", updated.contentHash());
        assertEquals(now, updated.lastChecked());
        assertEquals(30, updated.intervalMinutes());
        assertFalse(updated.active());
        assertEquals(3L, updated.id());
    }

    @Test
    void toJobCarriesOnlyRefetchParameters() {
        MonitorJob job = new Monitor(3L, 9L, "https://example.com", 30, null, "h", true).toJob();

        assertEquals(new MonitorJob(3L, "https://example.com", 9L, 30), job);
        assertEquals("3", job.key());
        assertEquals(Duration.ofMinutes(30), job.interval());
    }
}
