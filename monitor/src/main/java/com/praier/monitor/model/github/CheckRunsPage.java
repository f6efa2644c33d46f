package com.praier.monitor.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of check runs for a commit.
 * Maps from: /repos/{owner}/{repo}/commits/{ref}/check-runs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckRunsPage(
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("check_runs") List<CheckRunItem> checkRuns
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckRunItem(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("status") String status,
            @JsonProperty("conclusion") String conclusion,
            @JsonProperty("html_url") String htmlUrl
    ) {}
}
