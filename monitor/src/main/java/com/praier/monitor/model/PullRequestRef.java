package com.praier.monitor.model;

import java.util.Objects;

/**
 * Identifies a monitored pull request: the server it lives on, its repository
 * ({@code owner/name}) and its number. Stable for the lifetime of the pull request.
 */
public record PullRequestRef(String server, String repository, int number) {

    public PullRequestRef {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(repository, "repository");
        if (number <= 0) {
            throw new IllegalArgumentException("Pull request number must be positive: " + number);
        }
    }

    public boolean belongsTo(String serverName, String repositoryName) {
        return server.equals(serverName) && repository.equalsIgnoreCase(repositoryName);
    }

    @Override
    public String toString() {
        return server + ":" + repository + "#" + number;
    }
}
