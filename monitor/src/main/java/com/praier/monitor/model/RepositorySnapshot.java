package com.praier.monitor.model;

import java.util.List;

/**
 * The open pull requests of one repository as read in a single fetch.
 * {@code unresolved} holds pull requests that are listed as open but whose checks or
 * runs could not be read, for example because the head commit vanished after a
 * force-push. They are still open, so they count as seen, but carry no snapshot.
 */
public record RepositorySnapshot(List<PullRequestSnapshot> pullRequests, List<PullRequestRef> unresolved) {

    public RepositorySnapshot {
        pullRequests = List.copyOf(pullRequests);
        unresolved = List.copyOf(unresolved);
    }

    public static RepositorySnapshot of(List<PullRequestSnapshot> pullRequests) {
        return new RepositorySnapshot(pullRequests, List.of());
    }

    public static RepositorySnapshot of(PullRequestSnapshot... pullRequests) {
        return of(List.of(pullRequests));
    }
}
