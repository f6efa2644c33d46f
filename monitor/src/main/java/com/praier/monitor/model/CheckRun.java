package com.praier.monitor.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A check run reported against the head commit of a pull request.
 * {@code status} and {@code conclusion} are normalized to lower case;
 * {@code conclusion} is {@code null} until the check completes.
 */
public record CheckRun(String name, String status, String conclusion) {

    public static final String CONCLUSION_FAILURE = "failure";

    public CheckRun {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Check run name must not be blank");
        }
        status = normalize(status);
        conclusion = normalize(conclusion);
    }

    public boolean isFailure() {
        return CONCLUSION_FAILURE.equals(conclusion);
    }

    static String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
