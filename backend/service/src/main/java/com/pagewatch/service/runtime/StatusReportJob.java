package com.pagewatch.service.runtime;

import com.pagewatch.checker.api.MonitorStore;
import com.pagewatch.checker.api.Notifier;
import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.events.StatusReported;
import com.pagewatch.core.model.Monitor;
import com.pagewatch.service.store.EventStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic liveness report sent to the administrator.
 */
public class StatusReportJob implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(StatusReportJob.class.getName());
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final MonitorStore store;
    private final MonitorScheduler scheduler;
    private final EventStore eventStore;
    private final Notifier notifier;
    private final EventBus eventBus;
    private final Clock clock;
    private final long adminUserId;
    private Instant lastReport;

    public StatusReportJob(
            MonitorStore store,
            MonitorScheduler scheduler,
            EventStore eventStore,
            Notifier notifier,
            EventBus eventBus,
            Clock clock,
            long adminUserId
    ) {
        this.store = store;
        this.scheduler = scheduler;
        this.eventStore = eventStore;
        this.notifier = notifier;
        this.eventBus = eventBus;
        this.clock = clock;
        this.adminUserId = adminUserId;
        this.lastReport = clock.instant();
    }

    @Override
    public synchronized void run() {
        Instant now = clock.instant();
        List<Monitor> all = store.listAll();
        int active = (int) all.stream().filter(Monitor::active).count();
        int timers = scheduler.liveTimerCount();
        long changes = eventStore.countEvents("ContentChanged", lastReport, now);
        lastReport = now;

        String text = "PageWatch report\n\n"
                + "Service is alive and running.\n"
                + "Total monitors: " + all.size() + "\n"
                + "Active monitors: " + active + "\n"
                + "Live timers: " + timers + "\n"
                + "Changes since last report: " + changes + "\n"
                + "Time: " + TIME_FORMAT.format(now) + " UTC";
        try {
            notifier.send(adminUserId, text);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Failed to send admin report", e);
        }
        eventBus.publish(new StatusReported(now, all.size(), active, timers));
    }
}
