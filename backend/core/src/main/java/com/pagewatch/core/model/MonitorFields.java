package com.pagewatch.core.model;

import java.time.Instant;

// Fields written back by a check; nothing else on the row is touched.
public record MonitorFields(String contentHash, Instant lastChecked) {
}
