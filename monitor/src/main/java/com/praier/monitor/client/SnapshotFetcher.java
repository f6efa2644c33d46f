package com.praier.monitor.client;

import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.model.RepositorySnapshot;

import java.io.IOException;

/**
 * Reads the current state of every open pull request in a repository.
 */
public interface SnapshotFetcher {

    /**
     * A pull request whose own checks or runs are gone is reported in
     * {@link RepositorySnapshot#unresolved()} rather than failing the repository.
     *
     * @throws RateLimitException         when the server is throttling
     * @throws PermissionDeniedException  when the token cannot read the repository
     * @throws NotFoundException          when the repository does not exist
     * @throws IOException                on any other transport failure
     */
    RepositorySnapshot fetchOpenPullRequests(ServerConfig server, String repository)
            throws IOException;
}
