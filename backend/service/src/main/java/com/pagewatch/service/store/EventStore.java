package com.pagewatch.service.store;

import com.pagewatch.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Audit trail of monitor checks, detected changes, alerts and status reports.
 */
public interface EventStore {
    void append(Event event);

    /**
     * Most recent events at or after {@code since}, oldest first, at most {@code limit} of them.
     */
    List<Event> query(Instant since, Optional<String> type, int limit);

    /**
     * Counts events of {@code type} whose timestamp falls in {@code [from, until)}. Consecutive windows
     * that share a boundary never count the same event twice.
     */
    long countEvents(String type, Instant from, Instant until);
}
