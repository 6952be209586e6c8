package com.pagewatch.service.http;

import com.pagewatch.checker.api.FetchResult;
import com.pagewatch.checker.api.PageFetcher;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class HttpPageFetcher implements PageFetcher {
    static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/120.0.0.0 Safari/537.36";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpPageFetcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }

    @Override
    public FetchResult fetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .GET()
                    .header("User-Agent", USER_AGENT)
                    .timeout(requestTimeout)
                    .build();
        } catch (IllegalArgumentException e) {
            return FetchResult.failure("Invalid URL " + url + ": " + e.getMessage());
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return FetchResult.failure(classifyFailureMessage(url, error));
                    }
                    if (response.statusCode() >= 400) {
                        return FetchResult.failure(
                                response.statusCode(),
                                "HTTP status " + response.statusCode() + " from " + url
                        );
                    }
                    return FetchResult.success(response.statusCode(), response.body());
                })
                .join();
    }

    static String classifyFailureMessage(String url, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        String host = URI.create(url).getHost();
        if ((host != null && host.endsWith(".invalid"))
                || root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return "Request timed out while fetching " + url;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        if (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
