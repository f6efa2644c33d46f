package com.praier.monitor.client;

import java.io.IOException;

/**
 * A GitHub API call completed with an error response. Plain instances are
 * transport-level failures that are retried on the next poll cycle.
 */
public class GitHubApiException extends IOException {

    private final int statusCode;

    public GitHubApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
