package com.pagewatch.checker.api;

import java.util.Objects;

public record FetchResult(boolean success, String body, int status, String failureMessage) {
    public static FetchResult success(int status, String body) {
        return new FetchResult(true, Objects.requireNonNull(body, "body is required"), status, null);
    }

    public static FetchResult failure(int status, String failureMessage) {
        return new FetchResult(false, null, status, failureMessage);
    }

    public static FetchResult failure(String failureMessage) {
        return failure(0, failureMessage);
    }
}
