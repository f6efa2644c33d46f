package com.praier.monitor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * YAML configuration file layout. Absent values fall back to defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ConfigFile(
        @JsonProperty("github_servers") List<Server> githubServers,
        @JsonProperty("monitoring") Monitoring monitoring,
        @JsonProperty("log_level") String logLevel
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Server(
            @JsonProperty("name") String name,
            @JsonProperty("url") String url,
            @JsonProperty("token") String token
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Monitoring(
            @JsonProperty("poll_interval") Integer pollInterval,
            @JsonProperty("max_concurrent_requests") Integer maxConcurrentRequests,
            @JsonProperty("repositories") List<String> repositories,
            @JsonProperty("auto_approve_actions") Boolean autoApproveActions,
            @JsonProperty("auto_fix_with_copilot") Boolean autoFixWithCopilot,
            @JsonProperty("eviction_cycles") Integer evictionCycles,
            @JsonProperty("request_timeout") Integer requestTimeout
    ) {}
}
