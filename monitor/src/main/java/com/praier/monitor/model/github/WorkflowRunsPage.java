package com.praier.monitor.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of workflow runs.
 * Maps from: /repos/{owner}/{repo}/actions/runs?head_sha={sha}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowRunsPage(
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("workflow_runs") List<WorkflowRunItem> workflowRuns
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkflowRunItem(
            @JsonProperty("id") Long id,
            @JsonProperty("name") String name,
            @JsonProperty("status") String status,
            @JsonProperty("conclusion") String conclusion,
            @JsonProperty("head_sha") String headSha,
            @JsonProperty("html_url") String htmlUrl,
            @JsonProperty("pull_requests") List<PullRequestLink> pullRequests
    ) {

        /**
         * Runs from forks carry no pull request association, so an empty list
         * counts as belonging to whichever pull request owns the head commit.
         */
        public boolean belongsTo(int prNumber) {
            return pullRequests == null || pullRequests.isEmpty()
                    || pullRequests.stream().anyMatch(pr -> pr.number() == prNumber);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequestLink(@JsonProperty("number") int number) {}
}
