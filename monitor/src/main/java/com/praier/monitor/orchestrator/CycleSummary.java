package com.praier.monitor.orchestrator;

import com.praier.monitor.dispatch.ActionResult;
import com.praier.monitor.model.PullRequestRef;

import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one poll cycle across all repository targets.
 */
public record CycleSummary(
        long cycle,
        List<RepositoryResult> repositories,
        List<ActionResult> actions,
        List<PullRequestRef> evicted,
        Map<String, Integer> trackedByServer,
        long durationMs
) {

    public CycleSummary {
        repositories = List.copyOf(repositories);
        actions = List.copyOf(actions);
        evicted = List.copyOf(evicted);
        trackedByServer = Map.copyOf(trackedByServer);
    }

    public int pullRequestsSeen() {
        return repositories.stream().mapToInt(RepositoryResult::pullRequests).sum();
    }

    public int actionsSucceeded() {
        return (int) actions.stream().filter(ActionResult::succeeded).count();
    }

    public int actionsFailed() {
        return (int) actions.stream()
                .filter(r -> r.outcome() == ActionResult.Outcome.FAILED)
                .count();
    }

    public int repositoryFailures() {
        return (int) repositories.stream().filter(r -> !r.succeeded()).count();
    }

    public boolean hasFailures() {
        return actionsFailed() > 0 || repositoryFailures() > 0;
    }

    public int tracked() {
        return trackedByServer.values().stream().mapToInt(Integer::intValue).sum();
    }
}
