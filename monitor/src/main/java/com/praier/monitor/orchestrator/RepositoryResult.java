package com.praier.monitor.orchestrator;

import com.praier.monitor.client.ErrorKind;
import com.praier.monitor.config.RepositoryTarget;

/**
 * Outcome of one repository within a poll cycle. A failed fetch has an error and no
 * pull requests; an aborted dispatch has both.
 */
public record RepositoryResult(
        RepositoryTarget target,
        int pullRequests,
        ErrorKind error,
        String errorMessage
) {

    public static RepositoryResult success(RepositoryTarget target, int pullRequests) {
        return new RepositoryResult(target, pullRequests, null, null);
    }

    public static RepositoryResult failure(RepositoryTarget target, int pullRequests,
                                           ErrorKind error, String message) {
        return new RepositoryResult(target, pullRequests, error, message);
    }

    public boolean succeeded() {
        return error == null;
    }
}
