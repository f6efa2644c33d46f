package com.praier.monitor.client;

import java.time.Instant;

/**
 * The server is throttling this token. Callers back off until the next scheduled cycle.
 */
public class RateLimitException extends GitHubApiException {

    private final Instant resetAt;

    public RateLimitException(int statusCode, String message, Instant resetAt) {
        super(statusCode, message);
        this.resetAt = resetAt;
    }

    /** When the limit resets, or {@code null} if the server did not say. */
    public Instant getResetAt() {
        return resetAt;
    }
}
