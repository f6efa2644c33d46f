package com.praier.monitor.client;

/**
 * Coarse classification of remote failures, used to decide how far a failure reaches.
 */
public enum ErrorKind {

    /** Network or HTTP failure; retried next cycle. */
    TRANSPORT,
    /** Throttled; the repository is skipped for the rest of the cycle. */
    RATE_LIMITED,
    /** Token lacks scope; the repository is skipped for the rest of the cycle. */
    PERMISSION_DENIED,
    /** Resource vanished; only what vanished is treated as stale. */
    NOT_FOUND;

    public static ErrorKind classify(Throwable error) {
        if (error instanceof RateLimitException) {
            return RATE_LIMITED;
        }
        if (error instanceof PermissionDeniedException) {
            return PERMISSION_DENIED;
        }
        if (error instanceof NotFoundException) {
            return NOT_FOUND;
        }
        return TRANSPORT;
    }

    /** Whether this failure stops further work on the same repository in the current cycle. */
    public boolean abortsRepository() {
        return this == RATE_LIMITED || this == PERMISSION_DENIED;
    }
}
