package com.pagewatch.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagewatch.checker.api.Notifier;
import com.pagewatch.core.util.JsonUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Writes outgoing chat messages to a local JSONL outbox instead of a chat service.
 */
public class DevOutboxNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(DevOutboxNotifier.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path outboxFile;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public DevOutboxNotifier(Path outboxFile, Clock clock) {
        this.outboxFile = outboxFile;
        this.clock = clock;
    }

    @Override
    public void send(long userId, String text) {
        OutboxMessage message = new OutboxMessage(clock.instant(), userId, text);
        lock.lock();
        try {
            Files.createDirectories(outboxFile.toAbsolutePath().getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    outboxFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(MAPPER.writeValueAsString(message));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed delivering message to outbox " + outboxFile, e);
        } finally {
            lock.unlock();
        }
        LOGGER.info("Message for user " + userId + ": " + text.replace('\n', ' '));
    }

    public List<OutboxMessage> messages() {
        lock.lock();
        try {
            if (!Files.exists(outboxFile)) {
                return List.of();
            }
            List<OutboxMessage> messages = new ArrayList<>();
            for (String line : Files.readAllLines(outboxFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    messages.add(parse(line));
                }
            }
            return messages;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading outbox " + outboxFile, e);
        } finally {
            lock.unlock();
        }
    }

    private static OutboxMessage parse(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, new TypeReference<>() {
        });
    }

    public record OutboxMessage(Instant timestamp, long userId, String text) {
    }
}
