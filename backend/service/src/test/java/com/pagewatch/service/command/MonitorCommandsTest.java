package com.pagewatch.service.command;

import com.pagewatch.checker.check.CheckOutcome;
import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.model.Monitor;
import com.pagewatch.core.model.MonitorFields;
import com.pagewatch.service.runtime.MonitorScheduler;
import com.pagewatch.service.store.JsonFileMonitorStore;
import com.pagewatch.service.support.StubPageFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.pagewatch.service.support.TestStores.freshMonitorStore;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorCommandsTest {
    private static final String URL = "https://example.com/page";

    private JsonFileMonitorStore store;
    private MonitorScheduler scheduler;
    private StubPageFetcher fetcher;
    private MonitorCommands commands;

    @BeforeEach
    void setUp() throws Exception {
        store = freshMonitorStore("commands-");
        // Timers never fire during these tests.
        scheduler = new MonitorScheduler(store, (job, stop) -> CheckOutcome.UNCHANGED, new EventBus(),
                Clock.systemUTC(), Duration.ofHours(1), 1);
        fetcher = new StubPageFetcher();
        fetcher.respond(URL, "<html><head><title>Example Page</title></head><body>Hello</body></html>");
        commands = new MonitorCommands(store, scheduler, fetcher);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void createPersistsActiveMonitorAndSchedulesIt() {
        CommandReply reply = commands.createOrUpdateMonitor(42L, URL, 15);

        assertTrue(reply.ok());
        assertEquals("Started monitoring " + URL + " (Example Page) every 15 minutes.", reply.text());
        Monitor saved = store.findByUserAndUrl(42L, URL).orElseThrow();
        assertEquals(15, saved.intervalMinutes());
        assertTrue(saved.active());
        assertNull(saved.contentHash());
        assertTrue(scheduler.isScheduled(saved.id()));
        assertEquals(List.of(URL), fetcher.requested());
    }

    @Test
    void invalidUrlIsRejectedBeforeAnyFetchOrWrite() {
        CommandReply reply = commands.createOrUpdateMonitor(42L, "ftp://example.com", 15);

        assertFalse(reply.ok());
        assertEquals("Invalid URL. Must start with http:// or https://", reply.text());
        assertTrue(fetcher.requested().isEmpty());
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void intervalBelowMinimumOrNonNumericIsRejected() {
        CommandReply tooShort = commands.createOrUpdateMonitor(42L, URL, "3");
        CommandReply garbage = commands.createOrUpdateMonitor(42L, URL, "soon");

        assertEquals(CommandReply.failed("Minimum interval is 5 minutes."), tooShort);
        assertEquals(CommandReply.failed("Please enter a valid number."), garbage);
        assertTrue(store.listAll().isEmpty());
        assertEquals(0, scheduler.liveTimerCount());
    }

    @Test
    void unreachableUrlIsNotStored() {
        String unreachable = "https://down.example";

        CommandReply reply = commands.createOrUpdateMonitor(42L, unreachable, 10);

        assertFalse(reply.ok());
        assertEquals("Could not fetch " + unreachable + ". Please check if it works and try again.", reply.text());
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void duplicateCreateUpdatesExistingRowAndReactivatesIt() {
        commands.createOrUpdateMonitor(42L, URL, 15);
        Monitor first = store.findByUserAndUrl(42L, URL).orElseThrow();
        Instant checkedAt = Instant.parse("2026-02-12T20:00:00Z");
        store.updateMonitorFields(first.id(), new MonitorFields("digest", checkedAt));
        store.setActive(first.id(), false);

        CommandReply reply = commands.createOrUpdateMonitor(42L, URL, "30");

        assertEquals(CommandReply.ok("Updated existing monitor for " + URL + " to 30 minutes."), reply);
        List<Monitor> rows = store.listMonitorsByUser(42L);
        assertEquals(1, rows.size());
        Monitor updated = rows.get(0);
        assertEquals(first.id(), updated.id());
        assertEquals(30, updated.intervalMinutes());
        assertTrue(updated.active());
        assertNull(updated.contentHash());
        assertEquals(checkedAt, updated.lastChecked());
        assertEquals(1, scheduler.liveTimerCount());
    }

    @Test
    void removeDeletesRowAndCancelsTimer() {
        commands.createOrUpdateMonitor(42L, URL, 15);
        long id = store.findByUserAndUrl(42L, URL).orElseThrow().id();

        CommandReply reply = commands.removeMonitor(42L, id);

        assertEquals(CommandReply.ok("Stopped monitoring " + URL + "."), reply);
        assertTrue(store.getMonitor(id).isEmpty());
        assertFalse(scheduler.isScheduled(id));
        assertEquals(CommandReply.failed("Monitor not found or already deleted."), commands.removeMonitor(42L, id));
    }

    @Test
    void usersCannotTouchEachOthersMonitors() {
        commands.createOrUpdateMonitor(42L, URL, 15);
        long id = store.findByUserAndUrl(42L, URL).orElseThrow().id();

        assertFalse(commands.removeMonitor(7L, id).ok());
        assertEquals(CommandReply.failed("Monitor not found."), commands.updateInterval(7L, id, 20));
        assertFalse(commands.pauseMonitor(7L, id).ok());
        assertTrue(store.getMonitor(id).isPresent());
        assertEquals(15, store.getMonitor(id).orElseThrow().intervalMinutes());
    }

    @Test
    void updateIntervalPersistsAndReschedulesActiveMonitor() {
        commands.createOrUpdateMonitor(42L, URL, 15);
        long id = store.findByUserAndUrl(42L, URL).orElseThrow().id();

        CommandReply reply = commands.updateInterval(42L, id, "45");

        assertEquals(CommandReply.ok("Updated frequency to 45 minutes for " + URL + "."), reply);
        assertEquals(45, store.getMonitor(id).orElseThrow().intervalMinutes());
        assertTrue(scheduler.isScheduled(id));
        assertEquals(CommandReply.failed("Minimum interval is 5 minutes."), commands.updateInterval(42L, id, 4));
        assertEquals(CommandReply.failed("Monitor not found."), commands.updateInterval(42L, 999L, 10));
    }

    @Test
    void updateIntervalOnPausedMonitorDoesNotScheduleIt() {
        commands.createOrUpdateMonitor(42L, URL, 15);
        long id = store.findByUserAndUrl(42L, URL).orElseThrow().id();
        commands.pauseMonitor(42L, id);

        assertTrue(commands.updateInterval(42L, id, 20).ok());

        assertFalse(scheduler.isScheduled(id));
    }

    @Test
    void pauseAndResumeToggleActiveFlagAndTimer() {
        commands.createOrUpdateMonitor(42L, URL, 15);
        long id = store.findByUserAndUrl(42L, URL).orElseThrow().id();

        assertEquals(CommandReply.ok("Paused monitoring " + URL + "."), commands.pauseMonitor(42L, id));
        assertFalse(store.getMonitor(id).orElseThrow().active());
        assertFalse(scheduler.isScheduled(id));

        assertEquals(CommandReply.ok("Resumed monitoring " + URL + "."), commands.resumeMonitor(42L, id));
        assertTrue(store.getMonitor(id).orElseThrow().active());
        assertTrue(scheduler.isScheduled(id));
    }

    @Test
    void listShowsEachMonitorWithStatus() {
        assertEquals(CommandReply.ok("You are not monitoring any URLs."), commands.listMonitors(42L));

        String other = "https://example.org/";
        fetcher.respond(other, "<p>Other</p>");
        commands.createOrUpdateMonitor(42L, URL, 15);
        commands.createOrUpdateMonitor(42L, other, 60);
        long otherId = store.findByUserAndUrl(42L, other).orElseThrow().id();
        commands.pauseMonitor(42L, otherId);
        long firstId = store.findByUserAndUrl(42L, URL).orElseThrow().id();

        CommandReply reply = commands.listMonitors(42L);

        assertEquals("Your monitored pages:\n"
                + "- #" + firstId + " " + URL + " (15m) [Active]\n"
                + "- #" + otherId + " " + other + " (60m) [Inactive]", reply.text());
        assertEquals(CommandReply.ok("You are not monitoring any URLs."), commands.listMonitors(7L));
    }
}
