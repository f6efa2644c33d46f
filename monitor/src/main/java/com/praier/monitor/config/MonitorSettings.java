package com.praier.monitor.config;

import java.time.Duration;
import java.util.List;

/**
 * Scalar monitoring settings plus the raw repository entries as configured.
 * A repository entry is either {@code owner/name} (polled on every server)
 * or {@code server:owner/name}.
 */
public record MonitorSettings(
        int pollIntervalSeconds,
        int maxConcurrentRequests,
        List<String> repositories,
        boolean autoApproveActions,
        boolean autoFixWithCopilot,
        int evictionCycles,
        int requestTimeoutSeconds
) {

    public static final int DEFAULT_POLL_INTERVAL = 60;
    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final int DEFAULT_EVICTION_CYCLES = 1;
    public static final int DEFAULT_REQUEST_TIMEOUT = 30;

    public MonitorSettings {
        repositories = repositories == null ? List.of() : repositories.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(String::trim)
                .toList();
    }

    public static MonitorSettings defaults() {
        return new MonitorSettings(DEFAULT_POLL_INTERVAL, DEFAULT_MAX_CONCURRENT, List.of(),
                true, true, DEFAULT_EVICTION_CYCLES, DEFAULT_REQUEST_TIMEOUT);
    }

    public MonitorSettings withRepositories(List<String> repos) {
        return new MonitorSettings(pollIntervalSeconds, maxConcurrentRequests, repos,
                autoApproveActions, autoFixWithCopilot, evictionCycles, requestTimeoutSeconds);
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
