package com.praier.monitor.model;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time read of an open pull request: its check runs and the workflow runs
 * for its head commit, both in the order the server reported them.
 */
public record PullRequestSnapshot(
        PullRequestRef ref,
        String title,
        String headSha,
        List<CheckRun> checkRuns,
        List<WorkflowRun> workflowRuns
) {

    public PullRequestSnapshot {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(headSha, "headSha");
        if (headSha.isBlank()) {
            throw new IllegalArgumentException("Head SHA must not be blank for " + ref);
        }
        title = title == null ? "" : title;
        checkRuns = checkRuns == null ? List.of() : List.copyOf(checkRuns);
        workflowRuns = workflowRuns == null ? List.of() : List.copyOf(workflowRuns);
    }

    public Fingerprint fingerprint() {
        return Fingerprint.of(this);
    }

    public List<CheckRun> failingChecks() {
        return checkRuns.stream().filter(CheckRun::isFailure).toList();
    }

    public List<WorkflowRun> runsAwaitingApproval() {
        return workflowRuns.stream().filter(WorkflowRun::isAwaitingApproval).toList();
    }
}
