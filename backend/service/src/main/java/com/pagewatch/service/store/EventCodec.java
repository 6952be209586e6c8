package com.pagewatch.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagewatch.core.events.AlertRaised;
import com.pagewatch.core.events.ContentChanged;
import com.pagewatch.core.events.Event;
import com.pagewatch.core.events.MonitorChecked;
import com.pagewatch.core.events.StatusReported;
import com.pagewatch.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "MonitorChecked", MonitorChecked.class,
            "ContentChanged", ContentChanged.class,
            "AlertRaised", AlertRaised.class,
            "StatusReported", StatusReported.class
    );

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
