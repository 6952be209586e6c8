package com.pagewatch.checker.check;

public enum CheckOutcome {
    /** Monitor gone or paused; the timer was asked to stop. */
    STOPPED,
    /** First successful observation, digest stored without notifying. */
    BASELINED,
    UNCHANGED,
    CHANGED,
    FETCH_FAILED
}
