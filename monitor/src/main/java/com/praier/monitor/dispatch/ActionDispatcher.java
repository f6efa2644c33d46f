package com.praier.monitor.dispatch;

import com.praier.monitor.client.ErrorKind;
import com.praier.monitor.client.RemoteActions;
import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.detector.ApproveRun;
import com.praier.monitor.detector.CommentCopilot;
import com.praier.monitor.detector.RequiredAction;
import com.praier.monitor.model.Fingerprint;
import com.praier.monitor.model.PullRequestRef;
import com.praier.monitor.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Performs required actions against the owning server. An action is recorded in
 * the {@link StateStore} only after its remote call succeeded, so a failed action
 * is detected again on the next cycle.
 */
public class ActionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ActionDispatcher.class);

    private final Map<String, ServerConfig> servers = new HashMap<>();
    private final RemoteActions remote;
    private final StateStore store;

    public ActionDispatcher(Collection<ServerConfig> servers, RemoteActions remote, StateStore store) {
        servers.forEach(server -> this.servers.put(server.name(), server));
        this.remote = remote;
        this.store = store;
    }

    /**
     * Performs one action for {@code ref} as observed with {@code fingerprint}.
     * Remote errors are returned in the result, never thrown.
     */
    public ActionResult dispatch(PullRequestRef ref, Fingerprint fingerprint, RequiredAction action) {
        ServerConfig server = servers.get(ref.server());
        if (server == null) {
            throw new IllegalArgumentException("No server configured with name '" + ref.server() + "'");
        }

        long start = System.currentTimeMillis();
        try {
            if (action instanceof ApproveRun) {
                ApproveRun approve = (ApproveRun) action;
                logger.info("Approving workflow run {} '{}' for {}", approve.runId(), approve.runName(), ref);
                remote.approveWorkflowRun(server, ref.repository(), approve.runId());
            } else if (action instanceof CommentCopilot) {
                CommentCopilot comment = (CommentCopilot) action;
                logger.info("Requesting Copilot fix for {} ({} failing: {})",
                        ref, comment.failingChecks().size(), String.join(", ", comment.checkNames()));
                remote.postComment(server, ref.repository(), ref.number(),
                        CopilotComment.format(comment.failingChecks()));
            } else {
                throw new IllegalArgumentException("Unsupported action: " + action);
            }

            store.recordAction(ref, fingerprint, action.kind(), action.target());
            return ActionResult.success(ref, action.kind(), action.target(), System.currentTimeMillis() - start);

        } catch (IOException e) {
            ErrorKind kind = ErrorKind.classify(e);
            logFailure(ref, action, kind, e);
            return ActionResult.failure(ref, action.kind(), action.target(), kind,
                    e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    private static void logFailure(PullRequestRef ref, RequiredAction action, ErrorKind kind, IOException e) {
        switch (kind) {
            case PERMISSION_DENIED:
                logger.error("Permission denied for {} {} on {}. Check the token's scopes: {}",
                        action.kind(), action.target(), ref, e.getMessage());
                break;
            case NOT_FOUND:
                logger.warn("{} {} on {} not found or already handled: {}",
                        action.kind(), action.target(), ref, e.getMessage());
                break;
            case RATE_LIMITED:
                logger.warn("Rate limited during {} on {}: {}", action.kind(), ref, e.getMessage());
                break;
            default:
                logger.warn("Failed {} {} on {}, will retry next cycle: {}",
                        action.kind(), action.target(), ref, e.getMessage());
        }
    }
}
