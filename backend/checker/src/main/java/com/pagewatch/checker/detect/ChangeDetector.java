package com.pagewatch.checker.detect;

import com.pagewatch.checker.api.FetchResult;
import com.pagewatch.checker.api.PageFetcher;
import com.pagewatch.core.util.HashingUtils;
import com.pagewatch.core.util.HtmlUtils;

import java.util.Objects;
import java.util.logging.Logger;

public class ChangeDetector {
    private static final Logger LOGGER = Logger.getLogger(ChangeDetector.class.getName());

    static final String INITIAL_SUMMARY = "initial check, monitoring started";
    static final String UNCHANGED_SUMMARY = "no changes";

    private final PageFetcher fetcher;

    public ChangeDetector(PageFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
    }

    public static String digestOf(String rawMarkup) {
        return HashingUtils.sha256(HtmlUtils.normalize(rawMarkup));
    }

    /**
     * Fetches {@code url} and compares the digest of its normalized text with {@code previousDigest}.
     * A first observation ({@code previousDigest == null}) is never reported as changed, but its
     * digest must still be stored by the caller. A failed fetch hands back {@code previousDigest}.
     */
    public ChangeCheck checkForChanges(String url, String previousDigest) {
        FetchResult fetched = fetcher.fetch(url);
        if (!fetched.success()) {
            LOGGER.warning("Fetch failed for " + url + ": " + fetched.failureMessage());
            return ChangeCheck.fetchFailed(previousDigest, fetched.failureMessage());
        }

        String text = HtmlUtils.normalize(fetched.body());
        String newDigest = HashingUtils.sha256(text);

        if (previousDigest == null) {
            return new ChangeCheck(newDigest, false, INITIAL_SUMMARY, true);
        }
        if (newDigest.equals(previousDigest)) {
            return new ChangeCheck(newDigest, false, UNCHANGED_SUMMARY, true);
        }
        return new ChangeCheck(newDigest, true, "content changed, length=" + text.length(), true);
    }
}
