package com.praier.monitor.state;

import com.praier.monitor.model.Fingerprint;
import com.praier.monitor.model.PullRequestRef;

import java.util.Objects;

/**
 * Proof that an action was taken for a pull request while it had a given fingerprint.
 * {@code target} is the workflow run id for approvals and empty for comments, so a
 * comment is recorded at most once per fingerprint and an approval at most once per
 * run and fingerprint.
 */
public record ActionRecord(PullRequestRef ref, ActionKind kind, Fingerprint fingerprint, String target) {

    public ActionRecord {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(fingerprint, "fingerprint");
        target = target == null ? "" : target;
    }
}
