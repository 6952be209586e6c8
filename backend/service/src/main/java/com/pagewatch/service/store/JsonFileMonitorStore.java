package com.pagewatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagewatch.checker.api.MonitorStore;
import com.pagewatch.core.model.Monitor;
import com.pagewatch.core.model.MonitorFields;
import com.pagewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Monitor rows held in memory and rewritten to a JSON snapshot after every mutation. All access
 * goes through one lock, so each operation is atomic for the row it touches.
 */
public class JsonFileMonitorStore implements MonitorStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileMonitorStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Monitor> monitors = new TreeMap<>();
    private long nextId = 1;
    private boolean initialized;

    public JsonFileMonitorStore(Path file) {
        this.file = file;
    }

    @Override
    public void init() {
        lock.lock();
        try {
            if (!initialized) {
                loadIfPresent();
                initialized = true;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Monitor insertOrUpdateMonitor(Monitor monitor) {
        lock.lock();
        try {
            requireInitialized();
            Optional<Monitor> existing = findByUserAndUrl(monitor.userId(), monitor.url());
            long allocatedNextId = nextId;
            Monitor stored;
            if (existing.isPresent()) {
                stored = monitor.withId(existing.get().id());
            } else {
                stored = monitor.withId(allocatedNextId++);
            }
            Map<Long, Monitor> next = new TreeMap<>(monitors);
            next.put(stored.id(), stored);
            commit(next, allocatedNextId);
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Monitor> getMonitor(long id) {
        lock.lock();
        try {
            requireInitialized();
            return Optional.ofNullable(monitors.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Monitor> findByUserAndUrl(long userId, String url) {
        List<Monitor> matches = select(row -> row.userId() == userId && row.url().equals(url));
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    @Override
    public boolean deleteMonitor(long id) {
        lock.lock();
        try {
            requireInitialized();
            if (!monitors.containsKey(id)) {
                return false;
            }
            Map<Long, Monitor> next = new TreeMap<>(monitors);
            next.remove(id);
            commit(next, nextId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Monitor> listMonitorsByUser(long userId) {
        return select(row -> row.userId() == userId);
    }

    @Override
    public List<Monitor> listActiveMonitors() {
        return select(Monitor::active);
    }

    @Override
    public List<Monitor> listAll() {
        return select(row -> true);
    }

    @Override
    public Optional<Monitor> updateMonitorFields(long id, MonitorFields fields) {
        return update(id, row -> row.withFields(fields));
    }

    @Override
    public Optional<Monitor> updateInterval(long id, int intervalMinutes) {
        return update(id, row -> row.withInterval(intervalMinutes));
    }

    @Override
    public Optional<Monitor> setActive(long id, boolean active) {
        return update(id, row -> row.withActive(active));
    }

    private Optional<Monitor> update(long id, UnaryOperator<Monitor> change) {
        lock.lock();
        try {
            requireInitialized();
            Monitor current = monitors.get(id);
            if (current == null) {
                return Optional.empty();
            }
            Monitor updated = change.apply(current);
            Map<Long, Monitor> next = new TreeMap<>(monitors);
            next.put(id, updated);
            commit(next, nextId);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    private List<Monitor> select(Predicate<Monitor> filter) {
        lock.lock();
        try {
            requireInitialized();
            return monitors.values().stream().filter(filter).toList();
        } finally {
            lock.unlock();
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Monitor store " + file + " has not been initialized");
        }
    }

    private void loadIfPresent() {
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                MonitorSnapshotFile loaded = MAPPER.readValue(in, MonitorSnapshotFile.class);
                long highestId = 0;
                if (loaded.monitors() != null) {
                    for (Monitor monitor : loaded.monitors()) {
                        monitors.put(monitor.id(), monitor);
                        highestId = Math.max(highestId, monitor.id());
                    }
                }
                nextId = Math.max(loaded.nextId(), highestId + 1);
            }
            LOGGER.info("Loaded " + monitors.size() + " monitors from " + file);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading monitors from " + file, e);
        }
    }

    // Callers hold the lock. Memory only changes once the snapshot is on disk, so a failed write
    // leaves the store exactly as it was.
    private void commit(Map<Long, Monitor> next, long nextIdAfter) {
        persist(next, nextIdAfter);
        monitors.clear();
        monitors.putAll(next);
        nextId = nextIdAfter;
    }

    private void persist(Map<Long, Monitor> rowsById, long nextIdToWrite) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = parent.resolve(file.getFileName() + ".tmp");
            List<Monitor> rows = new ArrayList<>(rowsById.values());
            rows.sort(Comparator.comparingLong(Monitor::id));
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new MonitorSnapshotFile(nextIdToWrite, rows));
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing monitors to " + file, e);
        }
    }

    private record MonitorSnapshotFile(long nextId, List<Monitor> monitors) {
    }
}
