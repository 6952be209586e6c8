package com.pagewatch.service.store;

import com.pagewatch.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Append-only audit log of check results, changes and alerts, one JSON document per line. Once the
 * live file reaches {@code maxBytes} it is rolled over to {@code <file>.1}, replacing the previous
 * rollover, so the log never holds much more than two generations.
 */
public class JsonlEventStore implements EventStore {
    public static final long DEFAULT_MAX_BYTES = 16L * 1024 * 1024;
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final Path rolledFile;
    private final long maxBytes;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this(file, DEFAULT_MAX_BYTES);
    }

    public JsonlEventStore(Path file, long maxBytes) {
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.file = file;
        this.rolledFile = file.resolveSibling(file.getFileName() + ".1");
        this.maxBytes = maxBytes;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            rollOverIfFull();
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        Deque<Event> recent = new ArrayDeque<>();
        scan(event -> {
            if (event.timestamp().isBefore(since)) {
                return;
            }
            if (type.isPresent() && !type.get().equals(event.type())) {
                return;
            }
            recent.addLast(event);
            if (recent.size() > limit) {
                recent.removeFirst();
            }
        });
        return new ArrayList<>(recent);
    }

    @Override
    public long countEvents(String type, Instant from, Instant until) {
        long[] count = {0};
        scan(event -> {
            if (type.equals(event.type())
                    && !event.timestamp().isBefore(from)
                    && event.timestamp().isBefore(until)) {
                count[0]++;
            }
        });
        return count[0];
    }

    private void scan(Consumer<Event> sink) {
        lock.lock();
        try {
            readLines(rolledFile, sink);
            readLines(file, sink);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private static void readLines(Path source, Consumer<Event> sink) throws IOException {
        if (!Files.exists(source)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException(
                            "Invalid JSONL event at line " + lineNumber + " of " + source, decodeError);
                }
                sink.accept(event);
            }
        }
    }

    // Callers hold the lock.
    private void rollOverIfFull() throws IOException {
        if (Files.exists(file) && Files.size(file) >= maxBytes) {
            Files.move(file, rolledFile, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Rolled event log over to " + rolledFile);
        }
    }
}
