package com.praier.monitor.state;

import com.praier.monitor.model.Fingerprint;
import com.praier.monitor.model.PullRequestRef;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only copy of what the store knows about one pull request.
 *
 * @param fingerprint  last fingerprint fully handled, or {@code null} if none yet
 * @param actions      actions recorded for the current (or a pending) fingerprint
 * @param missedCycles consecutive full polls in which the pull request was absent
 */
public record StateEntry(
        PullRequestRef ref,
        Fingerprint fingerprint,
        Set<ActionRecord> actions,
        int missedCycles,
        Instant firstSeen,
        Instant lastUpdated
) {

    public StateEntry {
        actions = Set.copyOf(actions);
    }

    public boolean hasAction(ActionKind kind, Fingerprint fp, String target) {
        return actions.contains(new ActionRecord(ref, kind, fp, target));
    }

    public boolean hasAction(ActionKind kind, Fingerprint fp) {
        return hasAction(kind, fp, "");
    }
}
