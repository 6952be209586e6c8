package com.pagewatch.checker.support;

import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.events.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class EventCapture {
    private final List<Event> events = new CopyOnWriteArrayList<>();

    public EventCapture(EventBus bus) {
        bus.subscribe(Event.class, events::add);
    }

    public <T extends Event> List<T> byType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<Event> all() {
        return List.copyOf(events);
    }
}
