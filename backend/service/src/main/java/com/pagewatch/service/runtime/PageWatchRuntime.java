package com.pagewatch.service.runtime;

import com.pagewatch.checker.api.MonitorStore;
import com.pagewatch.checker.api.Notifier;
import com.pagewatch.checker.api.PageFetcher;
import com.pagewatch.checker.check.CheckContext;
import com.pagewatch.checker.check.MonitorCheckJob;
import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.events.Event;
import com.pagewatch.service.command.MonitorCommands;
import com.pagewatch.service.config.PageWatchConfig;
import com.pagewatch.service.http.HttpClientFactory;
import com.pagewatch.service.http.HttpPageFetcher;
import com.pagewatch.service.notify.DevOutboxNotifier;
import com.pagewatch.service.store.JsonFileMonitorStore;
import com.pagewatch.service.store.JsonlEventStore;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Owns the store, scheduler and command surface of one process. {@link #startup()} initializes the
 * store and rehydrates timers before any command is accepted.
 */
public class PageWatchRuntime {
    private static final Logger LOGGER = Logger.getLogger(PageWatchRuntime.class.getName());
    static final String STATUS_REPORT_TASK = "status-report";

    private final MonitorStore store;
    private final MonitorScheduler scheduler;
    private final MonitorCommands commands;
    private final StatusReportJob statusReport;
    private final Duration reportFirstDelay;
    private final Duration reportInterval;
    private volatile boolean started;

    public PageWatchRuntime(
            MonitorStore store,
            MonitorScheduler scheduler,
            MonitorCommands commands,
            StatusReportJob statusReport,
            Duration reportFirstDelay,
            Duration reportInterval
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.commands = Objects.requireNonNull(commands, "commands is required");
        this.statusReport = statusReport;
        this.reportFirstDelay = reportFirstDelay;
        this.reportInterval = reportInterval;
    }

    public static PageWatchRuntime create(PageWatchConfig config, Clock clock) {
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(Path.of(config.eventLogFile()), config.eventLogMaxBytes());
        eventBus.subscribe(Event.class, eventStore::append);

        JsonFileMonitorStore store = new JsonFileMonitorStore(Path.of(config.stateFile()));
        HttpClient httpClient = HttpClientFactory.create(config.connectTimeout());
        PageFetcher fetcher = new HttpPageFetcher(httpClient, config.requestTimeout());
        Notifier notifier = new DevOutboxNotifier(Path.of(config.outboxFile()), clock);

        MonitorCheckJob checkJob = new MonitorCheckJob(new CheckContext(fetcher, store, notifier, eventBus, clock));
        MonitorScheduler scheduler = new MonitorScheduler(
                store,
                checkJob,
                eventBus,
                clock,
                config.initialDelay(),
                config.workerThreads()
        );

        StatusReportJob statusReport = null;
        if (config.adminUserId() != null) {
            statusReport = new StatusReportJob(
                    store,
                    scheduler,
                    eventStore,
                    notifier,
                    eventBus,
                    clock,
                    config.adminUserId()
            );
        } else {
            LOGGER.info("No admin user configured; status reports are disabled.");
        }

        return new PageWatchRuntime(
                store,
                scheduler,
                new MonitorCommands(store, scheduler, fetcher),
                statusReport,
                config.initialDelay(),
                config.reportInterval()
        );
    }

    public synchronized void startup() {
        if (started) {
            throw new IllegalStateException("PageWatch runtime already started");
        }
        store.init();
        int restored = scheduler.rehydrate();
        if (statusReport != null) {
            scheduler.scheduleSystemTask(STATUS_REPORT_TASK, reportFirstDelay, reportInterval, statusReport);
        }
        started = true;
        LOGGER.info("PageWatch started with " + restored + " active monitors.");
    }

    public MonitorCommands commands() {
        if (!started) {
            throw new IllegalStateException("PageWatch runtime has not been started");
        }
        return commands;
    }

    public MonitorScheduler scheduler() {
        return scheduler;
    }

    public boolean isStarted() {
        return started;
    }

    public synchronized void shutdown() {
        scheduler.shutdown();
        started = false;
    }
}
