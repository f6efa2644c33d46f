package com.praier.monitor.client;

import com.praier.monitor.config.ServerConfig;

import java.io.IOException;

/**
 * Mutating calls against a GitHub server. Each call is a single remote request.
 */
public interface RemoteActions {

    void approveWorkflowRun(ServerConfig server, String repository, String runId) throws IOException;

    void postComment(ServerConfig server, String repository, int prNumber, String body) throws IOException;
}
