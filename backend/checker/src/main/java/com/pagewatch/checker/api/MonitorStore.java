package com.pagewatch.checker.api;

import com.pagewatch.core.model.Monitor;
import com.pagewatch.core.model.MonitorFields;

import java.util.List;
import java.util.Optional;

/**
 * Durable monitor rows. Every operation is atomic for a single row; implementations signal an
 * unavailable backing store with {@link IllegalStateException}.
 */
public interface MonitorStore {
    /**
     * Prepares the backing storage. Called once at startup before any other operation.
     */
    default void init() {
    }

    /**
     * Inserts the monitor, or updates the existing row for the same user and URL in place. A new
     * row gets a freshly assigned id; an updated row keeps its id.
     */
    Monitor insertOrUpdateMonitor(Monitor monitor);

    Optional<Monitor> getMonitor(long id);

    Optional<Monitor> findByUserAndUrl(long userId, String url);

    boolean deleteMonitor(long id);

    List<Monitor> listMonitorsByUser(long userId);

    List<Monitor> listActiveMonitors();

    List<Monitor> listAll();

    /**
     * Re-reads the row and writes only the hash and timestamp. Empty when the row no longer exists.
     */
    Optional<Monitor> updateMonitorFields(long id, MonitorFields fields);

    Optional<Monitor> updateInterval(long id, int intervalMinutes);

    Optional<Monitor> setActive(long id, boolean active);
}
