package com.pagewatch.checker.check;

import com.pagewatch.checker.detect.ChangeCheck;
import com.pagewatch.checker.detect.ChangeDetector;
import com.pagewatch.core.events.AlertRaised;
import com.pagewatch.core.events.ContentChanged;
import com.pagewatch.core.events.MonitorChecked;
import com.pagewatch.core.model.Monitor;
import com.pagewatch.core.model.MonitorFields;
import com.pagewatch.core.model.MonitorJob;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One scheduled check of one monitor. The row is read fresh at the start of every tick and written
 * back through {@code updateMonitorFields}, so a concurrent interval update or removal is never
 * overwritten. Storage failures propagate to the caller.
 */
public class MonitorCheckJob implements MonitorTickHandler {
    private static final Logger LOGGER = Logger.getLogger(MonitorCheckJob.class.getName());

    private final CheckContext ctx;
    private final ChangeDetector detector;

    public MonitorCheckJob(CheckContext ctx) {
        this(ctx, new ChangeDetector(ctx.fetcher()));
    }

    public MonitorCheckJob(CheckContext ctx, ChangeDetector detector) {
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
    }

    @Override
    public CheckOutcome onTick(MonitorJob job, Runnable stopTimer) {
        Instant startedAt = ctx.clock().instant();
        LOGGER.fine(() -> "Checking " + job.url() + " for user " + job.userId());

        Optional<Monitor> current = ctx.store().getMonitor(job.monitorId());
        if (current.isEmpty() || !current.get().active()) {
            LOGGER.info("Monitor " + job.monitorId() + " is gone or inactive; stopping its timer");
            stopTimer.run();
            publishChecked(job, CheckOutcome.STOPPED, "monitor removed or inactive", startedAt);
            return CheckOutcome.STOPPED;
        }

        String oldDigest = current.get().contentHash();
        ChangeCheck check = detector.checkForChanges(job.url(), oldDigest);

        CheckOutcome outcome;
        if (check.changed()) {
            notifyOwner(job, check);
            persist(job, check);
            ctx.eventBus().publish(new ContentChanged(
                    ctx.clock().instant(),
                    job.monitorId(),
                    job.userId(),
                    job.url(),
                    oldDigest,
                    check.newDigest()
            ));
            outcome = CheckOutcome.CHANGED;
        } else if (!Objects.equals(check.newDigest(), oldDigest)) {
            persist(job, check);
            outcome = CheckOutcome.BASELINED;
        } else {
            outcome = check.fetched() ? CheckOutcome.UNCHANGED : CheckOutcome.FETCH_FAILED;
        }

        if (outcome == CheckOutcome.FETCH_FAILED) {
            ctx.eventBus().publish(AlertRaised.forMonitor(
                    ctx.clock().instant(),
                    AlertRaised.FETCH,
                    check.summary(),
                    job.monitorId(),
                    job.url()
            ));
        }
        publishChecked(job, outcome, check.summary(), startedAt);
        return outcome;
    }

    private void notifyOwner(MonitorJob job, ChangeCheck check) {
        String text = "Update detected!\n\n" + job.url() + "\n\n" + check.summary();
        try {
            ctx.notifier().send(job.userId(), text);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Failed to send notification to " + job.userId(), e);
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    AlertRaised.NOTIFICATION,
                    "Failed to notify user " + job.userId() + ": " + e.getMessage(),
                    Map.of("monitorId", job.monitorId(), "userId", job.userId())
            ));
        }
    }

    private void persist(MonitorJob job, ChangeCheck check) {
        MonitorFields fields = new MonitorFields(check.newDigest(), ctx.clock().instant());
        if (ctx.store().updateMonitorFields(job.monitorId(), fields).isEmpty()) {
            LOGGER.info("Monitor " + job.monitorId() + " was removed during its check; result discarded");
        }
    }

    private void publishChecked(MonitorJob job, CheckOutcome outcome, String summary, Instant startedAt) {
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new MonitorChecked(
                ctx.clock().instant(),
                job.monitorId(),
                job.url(),
                outcome.name(),
                summary,
                durationMillis
        ));
    }
}
