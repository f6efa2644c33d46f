package com.praier.monitor.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Order-independent digest of the parts of a snapshot that drive actions:
 * head commit, check run conclusions and workflow run statuses.
 */
public record Fingerprint(String value) {

    public Fingerprint {
        Objects.requireNonNull(value, "value");
    }

    public static Fingerprint of(PullRequestSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        for (CheckRun check : snapshot.checkRuns()) {
            lines.add("check|" + check.name() + "|" + check.status() + "|" + check.conclusion());
        }
        for (WorkflowRun run : snapshot.workflowRuns()) {
            lines.add("run|" + run.id() + "|" + run.status());
        }
        Collections.sort(lines);

        StringBuilder canonical = new StringBuilder("head|").append(snapshot.headSha()).append('\n');
        lines.forEach(line -> canonical.append(line).append('\n'));
        return new Fingerprint(sha256(canonical.toString()));
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Short form for log lines. */
    public String abbreviated() {
        return value.substring(0, Math.min(12, value.length()));
    }

    @Override
    public String toString() {
        return abbreviated();
    }
}
