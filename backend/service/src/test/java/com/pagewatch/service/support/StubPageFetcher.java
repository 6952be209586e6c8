package com.pagewatch.service.support;

import com.pagewatch.checker.api.FetchResult;
import com.pagewatch.checker.api.PageFetcher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class StubPageFetcher implements PageFetcher {
    private final Map<String, FetchResult> responses = new ConcurrentHashMap<>();
    private final List<String> requested = new CopyOnWriteArrayList<>();

    public void respond(String url, String body) {
        responses.put(url, FetchResult.success(200, body));
    }

    public List<String> requested() {
        return List.copyOf(requested);
    }

    @Override
    public FetchResult fetch(String url) {
        requested.add(url);
        return responses.getOrDefault(url, FetchResult.failure("connection refused"));
    }
}
