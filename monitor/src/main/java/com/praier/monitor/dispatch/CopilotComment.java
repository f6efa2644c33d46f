package com.praier.monitor.dispatch;

import com.praier.monitor.model.CheckRun;

import java.util.List;

/**
 * Body of the comment that asks Copilot to look at failing checks.
 */
public final class CopilotComment {

    static final String MENTION = "@copilot";

    private CopilotComment() {
    }

    public static String format(List<CheckRun> failingChecks) {
        StringBuilder body = new StringBuilder()
                .append(MENTION).append(" The following checks are failing in this PR:\n\n");
        for (CheckRun check : failingChecks) {
            body.append("- ").append(check.name())
                    .append(" (").append(check.conclusion() != null ? check.conclusion() : "unknown").append(")\n");
        }
        body.append("""

                Please analyze the failing checks and suggest fixes for the issues. Focus on:
                1. Test failures and their root causes
                2. Linting/formatting issues
                3. Build failures
                4. Security vulnerabilities

                Provide specific code changes that would resolve these issues.""");
        return body.toString();
    }
}
