package com.pagewatch.service.support;

import com.pagewatch.checker.api.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotifier implements Notifier {
    private final List<String> texts = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<String> texts() {
        return List.copyOf(texts);
    }

    @Override
    public void send(long userId, String text) {
        if (failing) {
            throw new IllegalStateException("chat unavailable");
        }
        texts.add(userId + ":" + text);
    }
}
