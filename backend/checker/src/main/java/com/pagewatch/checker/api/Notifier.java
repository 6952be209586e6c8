package com.pagewatch.checker.api;

public interface Notifier {
    void send(long userId, String text);
}
