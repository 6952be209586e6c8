package com.pagewatch.checker.check;

import com.pagewatch.core.model.MonitorJob;

@FunctionalInterface
public interface MonitorTickHandler {
    /**
     * Runs one tick for {@code job}. {@code stopTimer} cancels the timer that fired this tick.
     */
    CheckOutcome onTick(MonitorJob job, Runnable stopTimer);
}
