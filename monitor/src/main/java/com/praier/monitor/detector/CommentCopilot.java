package com.praier.monitor.detector;

import com.praier.monitor.model.CheckRun;
import com.praier.monitor.state.ActionKind;

import java.util.List;

/**
 * Post one comment asking Copilot to fix every currently failing check.
 */
public record CommentCopilot(List<CheckRun> failingChecks) implements RequiredAction {

    public CommentCopilot {
        failingChecks = List.copyOf(failingChecks);
        if (failingChecks.isEmpty()) {
            throw new IllegalArgumentException("CommentCopilot needs at least one failing check");
        }
    }

    public List<String> checkNames() {
        return failingChecks.stream().map(CheckRun::name).toList();
    }

    @Override
    public ActionKind kind() {
        return ActionKind.COMMENT_COPILOT;
    }

    @Override
    public String target() {
        return "";
    }
}
