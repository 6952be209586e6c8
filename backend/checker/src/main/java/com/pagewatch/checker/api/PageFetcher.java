package com.pagewatch.checker.api;

/**
 * Retrieves the raw content of a page. Implementations bound every call with a timeout and report
 * network errors and error statuses as a failed {@link FetchResult} instead of throwing.
 */
public interface PageFetcher {
    FetchResult fetch(String url);
}
