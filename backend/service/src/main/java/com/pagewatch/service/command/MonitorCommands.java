package com.pagewatch.service.command;

import com.pagewatch.checker.api.FetchResult;
import com.pagewatch.checker.api.MonitorStore;
import com.pagewatch.checker.api.PageFetcher;
import com.pagewatch.core.model.Monitor;
import com.pagewatch.core.util.HtmlUtils;
import com.pagewatch.service.runtime.MonitorScheduler;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * User-facing monitor operations. Each call validates its input before touching the store and
 * returns the text the chat layer should deliver.
 */
public class MonitorCommands {
    private static final Logger LOGGER = Logger.getLogger(MonitorCommands.class.getName());
    static final String NOT_FOUND = "Monitor not found.";

    private final MonitorStore store;
    private final MonitorScheduler scheduler;
    private final PageFetcher fetcher;

    public MonitorCommands(MonitorStore store, MonitorScheduler scheduler, PageFetcher fetcher) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
    }

    public CommandReply createOrUpdateMonitor(long userId, String url, String intervalText) {
        try {
            return createOrUpdateMonitor(userId, url, MonitorValidation.parseInterval(intervalText));
        } catch (ValidationException e) {
            return CommandReply.failed(e.getMessage());
        }
    }

    /**
     * Verifies the URL answers, then creates the monitor or refreshes the user's existing one for
     * the same URL. The stored digest is cleared so the next check records a fresh baseline.
     */
    public CommandReply createOrUpdateMonitor(long userId, String url, int intervalMinutes) {
        String target;
        try {
            target = MonitorValidation.requireHttpUrl(url);
            MonitorValidation.requireInterval(intervalMinutes);
        } catch (ValidationException e) {
            return CommandReply.failed(e.getMessage());
        }

        FetchResult verification = fetcher.fetch(target);
        if (!verification.success()) {
            LOGGER.info("Verification of " + target + " failed: " + verification.failureMessage());
            return CommandReply.failed("Could not fetch " + target + ". Please check if it works and try again.");
        }

        Optional<Monitor> existing = store.findByUserAndUrl(userId, target);
        Monitor candidate = existing
                .map(row -> new Monitor(row.id(), userId, target, intervalMinutes, row.lastChecked(), null, true))
                .orElseGet(() -> Monitor.newMonitor(userId, target, intervalMinutes));
        Monitor saved = store.insertOrUpdateMonitor(candidate);
        scheduler.schedule(saved.toJob());

        if (existing.isPresent()) {
            return CommandReply.ok("Updated existing monitor for " + target + " to " + intervalMinutes + " minutes.");
        }
        String title = HtmlUtils.extractTitle(verification.body()).map(t -> " (" + t + ")").orElse("");
        return CommandReply.ok("Started monitoring " + target + title + " every " + intervalMinutes + " minutes.");
    }

    public CommandReply removeMonitor(long userId, long monitorId) {
        Optional<Monitor> owned = ownedBy(userId, monitorId);
        if (owned.isEmpty()) {
            return CommandReply.failed("Monitor not found or already deleted.");
        }
        store.deleteMonitor(monitorId);
        scheduler.cancel(monitorId);
        return CommandReply.ok("Stopped monitoring " + owned.get().url() + ".");
    }

    public CommandReply updateInterval(long userId, long monitorId, String intervalText) {
        try {
            return updateInterval(userId, monitorId, MonitorValidation.parseInterval(intervalText));
        } catch (ValidationException e) {
            return CommandReply.failed(e.getMessage());
        }
    }

    public CommandReply updateInterval(long userId, long monitorId, int intervalMinutes) {
        try {
            MonitorValidation.requireInterval(intervalMinutes);
        } catch (ValidationException e) {
            return CommandReply.failed(e.getMessage());
        }
        if (ownedBy(userId, monitorId).isEmpty()) {
            return CommandReply.failed(NOT_FOUND);
        }
        Optional<Monitor> updated = store.updateInterval(monitorId, intervalMinutes);
        if (updated.isEmpty()) {
            return CommandReply.failed(NOT_FOUND);
        }
        if (updated.get().active()) {
            scheduler.schedule(updated.get().toJob());
        }
        return CommandReply.ok("Updated frequency to " + intervalMinutes + " minutes for " + updated.get().url() + ".");
    }

    public CommandReply pauseMonitor(long userId, long monitorId) {
        if (ownedBy(userId, monitorId).isEmpty()) {
            return CommandReply.failed(NOT_FOUND);
        }
        Optional<Monitor> paused = store.setActive(monitorId, false);
        if (paused.isEmpty()) {
            return CommandReply.failed(NOT_FOUND);
        }
        scheduler.cancel(monitorId);
        return CommandReply.ok("Paused monitoring " + paused.get().url() + ".");
    }

    public CommandReply resumeMonitor(long userId, long monitorId) {
        if (ownedBy(userId, monitorId).isEmpty()) {
            return CommandReply.failed(NOT_FOUND);
        }
        Optional<Monitor> resumed = store.setActive(monitorId, true);
        if (resumed.isEmpty()) {
            return CommandReply.failed(NOT_FOUND);
        }
        scheduler.schedule(resumed.get().toJob());
        return CommandReply.ok("Resumed monitoring " + resumed.get().url() + ".");
    }

    public CommandReply listMonitors(long userId) {
        List<Monitor> monitors = store.listMonitorsByUser(userId);
        if (monitors.isEmpty()) {
            return CommandReply.ok("You are not monitoring any URLs.");
        }
        StringBuilder text = new StringBuilder("Your monitored pages:\n");
        for (Monitor monitor : monitors) {
            text.append("- #").append(monitor.id()).append(' ')
                    .append(monitor.url())
                    .append(" (").append(monitor.intervalMinutes()).append("m) [")
                    .append(monitor.active() ? "Active" : "Inactive")
                    .append("]\n");
        }
        return CommandReply.ok(text.toString().trim());
    }

    private Optional<Monitor> ownedBy(long userId, long monitorId) {
        return store.getMonitor(monitorId).filter(monitor -> monitor.userId() == userId);
    }
}
