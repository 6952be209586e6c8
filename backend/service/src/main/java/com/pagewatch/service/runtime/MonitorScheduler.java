package com.pagewatch.service.runtime;

import com.pagewatch.checker.api.MonitorStore;
import com.pagewatch.checker.check.CheckOutcome;
import com.pagewatch.checker.check.MonitorTickHandler;
import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.events.AlertRaised;
import com.pagewatch.core.model.Monitor;
import com.pagewatch.core.model.MonitorJob;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps exactly one recurring timer per scheduled monitor id. Timers only dispatch; ticks run on a
 * separate worker pool so a slow check never holds up another monitor's timer. Two ticks for the
 * same id never run at once: a tick that comes due while its predecessor is still running is skipped.
 */
public class MonitorScheduler {
    private static final Logger LOGGER = Logger.getLogger(MonitorScheduler.class.getName());

    private final MonitorStore store;
    private final MonitorTickHandler handler;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration initialDelay;
    private final Duration minuteLength;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService tickExecutor;
    private final Map<Long, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> systemTasks = new ConcurrentHashMap<>();
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public MonitorScheduler(
            MonitorStore store,
            MonitorTickHandler handler,
            EventBus eventBus,
            Clock clock,
            Duration initialDelay,
            int workerThreads
    ) {
        this(store, handler, eventBus, clock, initialDelay, workerThreads, Duration.ofMinutes(1));
    }

    MonitorScheduler(
            MonitorStore store,
            MonitorTickHandler handler,
            EventBus eventBus,
            Clock clock,
            Duration initialDelay,
            int workerThreads,
            Duration minuteLength
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.handler = Objects.requireNonNull(handler, "handler is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay is required");
        this.minuteLength = Objects.requireNonNull(minuteLength, "minuteLength is required");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        this.timerExecutor = Executors.newSingleThreadScheduledExecutor(namedThreads("pagewatch-timer"));
        this.tickExecutor = Executors.newFixedThreadPool(workerThreads, namedThreads("pagewatch-check"));
    }

    public void schedule(long monitorId, String url, long userId, int intervalMinutes) {
        schedule(new MonitorJob(monitorId, url, userId, intervalMinutes));
    }

    /**
     * Installs the recurring timer for {@code job.monitorId()}, replacing any timer already
     * registered under that id.
     */
    public void schedule(MonitorJob job) {
        ensureRunning();
        long periodMillis = minuteLength.toMillis() * job.intervalMinutes();
        timers.compute(job.monitorId(), (id, existing) -> {
            if (existing != null) {
                existing.cancel();
            }
            Timer timer = new Timer(job);
            timer.attach(timerExecutor.scheduleAtFixedRate(
                    () -> dispatch(timer),
                    initialDelay.toMillis(),
                    periodMillis,
                    TimeUnit.MILLISECONDS
            ));
            return timer;
        });
        LOGGER.fine(() -> "Scheduled monitor " + job.monitorId() + " every " + job.intervalMinutes() + "m");
    }

    public boolean cancel(long monitorId) {
        Timer removed = timers.remove(monitorId);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        LOGGER.fine(() -> "Cancelled timer for monitor " + monitorId);
        return true;
    }

    /**
     * Schedules every active monitor found in the store. This is the only way timers come back
     * after a restart.
     */
    public int rehydrate() {
        LOGGER.info("Restoring monitor timers from store...");
        List<Monitor> active = store.listActiveMonitors();
        for (Monitor monitor : active) {
            schedule(monitor.toJob());
        }
        LOGGER.info("Restored " + active.size() + " monitor timers.");
        return active.size();
    }

    public void scheduleSystemTask(String name, Duration firstDelay, Duration period, Runnable task) {
        ensureRunning();
        systemTasks.compute(name, (key, existing) -> {
            if (existing != null) {
                existing.cancel(false);
            }
            return timerExecutor.scheduleAtFixedRate(
                    () -> submitQuietly(() -> runSystemTask(name, task)),
                    firstDelay.toMillis(),
                    period.toMillis(),
                    TimeUnit.MILLISECONDS
            );
        });
    }

    public boolean isScheduled(long monitorId) {
        return timers.containsKey(monitorId);
    }

    public Set<Long> scheduledIds() {
        return Set.copyOf(timers.keySet());
    }

    public int liveTimerCount() {
        return timers.size();
    }

    public void shutdown() {
        timers.values().forEach(Timer::cancel);
        timers.clear();
        systemTasks.values().forEach(task -> task.cancel(false));
        systemTasks.clear();
        timerExecutor.shutdown();
        tickExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            tickExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Monitor scheduler stopped.");
    }

    private void dispatch(Timer timer) {
        if (timer.cancelled) {
            return;
        }
        long id = timer.job.monitorId();
        if (!inFlight.add(id)) {
            LOGGER.warning("Previous check of monitor " + id + " still running; skipping this tick");
            return;
        }
        boolean submitted = submitQuietly(() -> {
            try {
                runTick(timer);
            } finally {
                inFlight.remove(id);
            }
        });
        if (!submitted) {
            inFlight.remove(id);
        }
    }

    private void runTick(Timer timer) {
        MonitorJob job = timer.job;
        if (timer.cancelled) {
            return;
        }
        try {
            CheckOutcome outcome = handler.onTick(job, () -> stopTimer(timer));
            LOGGER.fine(() -> "Monitor " + job.monitorId() + " check finished: " + outcome);
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Check of monitor " + job.monitorId() + " failed", ex);
            eventBus.publish(AlertRaised.forMonitor(
                    clock.instant(),
                    AlertRaised.SCHEDULER,
                    "Monitor check failed: " + job.monitorId() + " - " + ex.getMessage(),
                    job.monitorId(),
                    job.url()
            ));
        }
    }

    private void runSystemTask(String name, Runnable task) {
        try {
            task.run();
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "System task " + name + " failed", ex);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    AlertRaised.SCHEDULER,
                    "System task failed: " + name + " - " + ex.getMessage(),
                    Map.of("task", name)
            ));
        }
    }

    // Only removes the registry entry if it still belongs to the timer that fired.
    private void stopTimer(Timer timer) {
        timers.remove(timer.job.monitorId(), timer);
        timer.cancel();
    }

    private boolean submitQuietly(Runnable work) {
        try {
            tickExecutor.submit(work);
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Tick rejected; scheduler is shutting down");
            return false;
        }
    }

    private void ensureRunning() {
        if (timerExecutor.isShutdown()) {
            throw new IllegalStateException("Monitor scheduler has been shut down");
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Timer {
        private final MonitorJob job;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private Timer(MonitorJob job) {
            this.job = job;
        }

        private void attach(ScheduledFuture<?> scheduled) {
            future = scheduled;
            if (cancelled) {
                scheduled.cancel(false);
            }
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
