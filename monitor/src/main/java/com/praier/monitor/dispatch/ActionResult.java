package com.praier.monitor.dispatch;

import com.praier.monitor.client.ErrorKind;
import com.praier.monitor.model.PullRequestRef;
import com.praier.monitor.state.ActionKind;

/**
 * Outcome of dispatching one action. Failures carry the error classification that
 * decides whether the rest of the repository is processed in this cycle.
 */
public record ActionResult(
        PullRequestRef ref,
        ActionKind kind,
        String target,
        Outcome outcome,
        ErrorKind error,
        String errorMessage,
        long durationMs
) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        /** The target vanished between fetch and dispatch. */
        SKIPPED
    }

    public static ActionResult success(PullRequestRef ref, ActionKind kind, String target, long durationMs) {
        return new ActionResult(ref, kind, target, Outcome.SUCCEEDED, null, null, durationMs);
    }

    public static ActionResult failure(PullRequestRef ref, ActionKind kind, String target,
                                       ErrorKind error, String message, long durationMs) {
        Outcome outcome = error == ErrorKind.NOT_FOUND ? Outcome.SKIPPED : Outcome.FAILED;
        return new ActionResult(ref, kind, target, outcome, error, message, durationMs);
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCEEDED;
    }
}
