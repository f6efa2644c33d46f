package com.praier.monitor.model;

import java.util.Objects;
import java.util.Set;

/**
 * A GitHub Actions workflow run triggered for the head commit of a pull request.
 */
public record WorkflowRun(String id, String name, String status) {

    /** Statuses of runs that sit waiting for a maintainer to approve them. */
    public static final Set<String> AWAITING_APPROVAL = Set.of("queued", "waiting");

    public WorkflowRun {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Workflow run id must not be blank");
        }
        name = name == null ? "" : name;
        status = CheckRun.normalize(status);
    }

    public boolean isAwaitingApproval() {
        return status != null && AWAITING_APPROVAL.contains(status);
    }
}
