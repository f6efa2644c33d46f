package com.praier.monitor.client;

/**
 * The repository, pull request or workflow run no longer exists (404/410).
 */
public class NotFoundException extends GitHubApiException {

    public NotFoundException(int statusCode, String message) {
        super(statusCode, message);
    }
}
