package com.praier.monitor.config;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A repository to poll on a specific server.
 */
public record RepositoryTarget(String server, String repository) {

    static final Pattern REPOSITORY_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+");

    public RepositoryTarget {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(repository, "repository");
    }

    public String owner() {
        return repository.substring(0, repository.indexOf('/'));
    }

    public String name() {
        return repository.substring(repository.indexOf('/') + 1);
    }

    static boolean isValidRepository(String repository) {
        return repository != null && REPOSITORY_PATTERN.matcher(repository).matches();
    }

    @Override
    public String toString() {
        return server + ":" + repository;
    }
}
