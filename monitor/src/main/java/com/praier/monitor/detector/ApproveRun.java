package com.praier.monitor.detector;

import com.praier.monitor.state.ActionKind;

import java.util.Objects;

/**
 * Approve a workflow run that is waiting for approval.
 */
public record ApproveRun(String runId, String runName) implements RequiredAction {

    public ApproveRun {
        Objects.requireNonNull(runId, "runId");
        runName = runName == null ? "" : runName;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.APPROVE_RUN;
    }

    @Override
    public String target() {
        return runId;
    }
}
