package com.pagewatch.service.command;

import com.pagewatch.core.model.Monitor;

import java.net.URI;
import java.util.Locale;

public final class MonitorValidation {
    static final int MAX_URL_LENGTH = 2048;

    private MonitorValidation() {
    }

    public static String requireHttpUrl(String url) {
        String candidate = url == null ? "" : url.trim();
        if (candidate.isEmpty() || candidate.length() > MAX_URL_LENGTH) {
            throw new ValidationException("Invalid URL. Must start with http:// or https://");
        }
        try {
            URI uri = URI.create(candidate);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new ValidationException("Invalid URL. Must start with http:// or https://");
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ValidationException("Invalid URL. Host is missing.");
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid URL: " + candidate);
        }
        return candidate;
    }

    public static int requireInterval(int intervalMinutes) {
        if (intervalMinutes < Monitor.MIN_INTERVAL_MINUTES) {
            throw new ValidationException("Minimum interval is " + Monitor.MIN_INTERVAL_MINUTES + " minutes.");
        }
        return intervalMinutes;
    }

    public static int parseInterval(String text) {
        if (text == null) {
            throw new ValidationException("Please enter a valid number.");
        }
        try {
            return requireInterval(Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            throw new ValidationException("Please enter a valid number.");
        }
    }
}
