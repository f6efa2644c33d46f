package com.praier.monitor.client;

/**
 * The token is invalid or lacks the scope required for the call (401/403).
 */
public class PermissionDeniedException extends GitHubApiException {

    public PermissionDeniedException(int statusCode, String message) {
        super(statusCode, message);
    }
}
