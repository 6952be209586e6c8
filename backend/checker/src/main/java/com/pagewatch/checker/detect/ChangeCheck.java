package com.pagewatch.checker.detect;

public record ChangeCheck(String newDigest, boolean changed, String summary, boolean fetched) {
    public static ChangeCheck fetchFailed(String previousDigest, String reason) {
        return new ChangeCheck(previousDigest, false, "fetch failed: " + reason, false);
    }
}
