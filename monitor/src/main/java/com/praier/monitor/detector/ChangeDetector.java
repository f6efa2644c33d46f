package com.praier.monitor.detector;

import com.praier.monitor.model.CheckRun;
import com.praier.monitor.model.Fingerprint;
import com.praier.monitor.model.PullRequestSnapshot;
import com.praier.monitor.model.WorkflowRun;
import com.praier.monitor.state.ActionKind;
import com.praier.monitor.state.StateEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which actions a pull request needs, given what was stored for it
 * previously and a fresh snapshot. Pure: it reads the stored entry and never
 * performs or records anything.
 *
 * <p>A snapshot whose fingerprint equals the stored one yields nothing. Otherwise
 * two independent rules run:</p>
 * <ol>
 *   <li>every workflow run that is queued or waiting and has no approval record for
 *       the current fingerprint yields an {@link ApproveRun}, in snapshot order;</li>
 *   <li>if any check failed and no comment was recorded for the current fingerprint,
 *       a single {@link CommentCopilot} covers all failing checks.</li>
 * </ol>
 * Approvals always precede the comment.
 */
public class ChangeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private final boolean autoApprove;
    private final boolean autoFix;

    public ChangeDetector(boolean autoApprove, boolean autoFix) {
        this.autoApprove = autoApprove;
        this.autoFix = autoFix;
    }

    public List<RequiredAction> detect(Optional<StateEntry> previous, PullRequestSnapshot current) {
        Fingerprint fingerprint = current.fingerprint();

        if (previous.isPresent() && fingerprint.equals(previous.get().fingerprint())) {
            logger.trace("{} unchanged at {}", current.ref(), fingerprint);
            return List.of();
        }

        List<RequiredAction> actions = new ArrayList<>();

        if (autoApprove) {
            Set<String> seenRuns = new HashSet<>();
            for (WorkflowRun run : current.runsAwaitingApproval()) {
                if (seenRuns.add(run.id())
                        && !alreadyDone(previous, ActionKind.APPROVE_RUN, fingerprint, run.id())) {
                    actions.add(new ApproveRun(run.id(), run.name()));
                }
            }
        }

        if (autoFix) {
            List<CheckRun> failing = current.failingChecks();
            if (!failing.isEmpty()
                    && !alreadyDone(previous, ActionKind.COMMENT_COPILOT, fingerprint, "")) {
                actions.add(new CommentCopilot(failing));
            }
        }

        if (!actions.isEmpty()) {
            logger.debug("{} changed to {}: {} action(s) required", current.ref(), fingerprint, actions.size());
        }
        return List.copyOf(actions);
    }

    private static boolean alreadyDone(Optional<StateEntry> previous, ActionKind kind,
                                       Fingerprint fingerprint, String target) {
        return previous.map(entry -> entry.hasAction(kind, fingerprint, target)).orElse(false);
    }
}
