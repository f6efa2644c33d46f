package com.praier.monitor.state;

/**
 * Remediation actions the monitor can take on a pull request.
 */
public enum ActionKind {

    APPROVE_RUN("approve-run"),
    COMMENT_COPILOT("comment-copilot");

    private final String label;

    ActionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
