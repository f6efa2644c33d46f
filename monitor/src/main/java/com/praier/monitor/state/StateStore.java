package com.praier.monitor.state;

import com.praier.monitor.model.Fingerprint;
import com.praier.monitor.model.PullRequestRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * In-memory record of the last handled fingerprint and the actions taken per pull
 * request. All access goes through one monitor lock. Nothing is persisted: after a
 * restart every pull request is a first sighting again.
 */
public class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    private final int evictionCycles;
    private final Clock clock;
    private final Map<PullRequestRef, Tracked> entries = new HashMap<>();

    public StateStore(int evictionCycles) {
        this(evictionCycles, Clock.systemUTC());
    }

    StateStore(int evictionCycles, Clock clock) {
        if (evictionCycles < 1) {
            throw new IllegalArgumentException("evictionCycles must be >= 1: " + evictionCycles);
        }
        this.evictionCycles = evictionCycles;
        this.clock = clock;
    }

    public synchronized Optional<StateEntry> get(PullRequestRef ref) {
        Tracked tracked = entries.get(ref);
        return tracked == null ? Optional.empty() : Optional.of(tracked.view(ref));
    }

    /**
     * Records that {@code kind} was performed on {@code target} for {@code fingerprint}.
     * Records of any other fingerprint are dropped, so a ref holds records for at
     * most one fingerprint.
     *
     * @return {@code false} if the same record already existed
     */
    public synchronized boolean recordAction(PullRequestRef ref, Fingerprint fingerprint,
                                             ActionKind kind, String target) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Tracked tracked = track(ref);
        tracked.actions.removeIf(record -> !record.fingerprint().equals(fingerprint));
        boolean added = tracked.actions.add(new ActionRecord(ref, kind, fingerprint, target));
        if (added) {
            logger.debug("Recorded {} {} for {} at {}", kind, target, ref, fingerprint);
        }
        return added;
    }

    public boolean recordAction(PullRequestRef ref, Fingerprint fingerprint, ActionKind kind) {
        return recordAction(ref, fingerprint, kind, "");
    }

    /**
     * Marks {@code fingerprint} as fully handled. Records that belong to other
     * fingerprints can no longer suppress anything and are dropped.
     */
    public synchronized void updateFingerprint(PullRequestRef ref, Fingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Tracked tracked = track(ref);
        tracked.fingerprint = fingerprint;
        tracked.lastUpdated = clock.instant();
        tracked.actions.removeIf(record -> !record.fingerprint().equals(fingerprint));
    }

    /**
     * Ages every tracked ref absent from {@code seenRefs} by one cycle and removes
     * those absent for the configured number of consecutive cycles. Call once per
     * full poll across all repositories.
     *
     * @return the evicted refs
     */
    public synchronized List<PullRequestRef> evictStale(Set<PullRequestRef> seenRefs) {
        List<PullRequestRef> evicted = new ArrayList<>();
        Iterator<Map.Entry<PullRequestRef, Tracked>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<PullRequestRef, Tracked> entry = it.next();
            if (seenRefs.contains(entry.getKey())) {
                entry.getValue().missedCycles = 0;
                continue;
            }
            if (++entry.getValue().missedCycles >= evictionCycles) {
                it.remove();
                evicted.add(entry.getKey());
            }
        }
        if (!evicted.isEmpty()) {
            logger.debug("Evicted {} stale pull requests: {}", evicted.size(), evicted);
        }
        return evicted;
    }

    /** Drops a single entry immediately. */
    public synchronized boolean evict(PullRequestRef ref) {
        return entries.remove(ref) != null;
    }

    public synchronized Set<PullRequestRef> refsFor(String server, String repository) {
        return entries.keySet().stream()
                .filter(ref -> ref.belongsTo(server, repository))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Number of tracked pull requests per server name, sorted by name. */
    public synchronized Map<String, Integer> countByServer() {
        Map<String, Integer> counts = new TreeMap<>();
        entries.keySet().forEach(ref -> counts.merge(ref.server(), 1, Integer::sum));
        return counts;
    }

    public synchronized int size() {
        return entries.size();
    }

    private Tracked track(PullRequestRef ref) {
        return entries.computeIfAbsent(ref, r -> {
            logger.info("Started tracking {}", r);
            return new Tracked(clock.instant());
        });
    }

    private static final class Tracked {
        private Fingerprint fingerprint;
        private final Set<ActionRecord> actions = new LinkedHashSet<>();
        private int missedCycles;
        private final Instant firstSeen;
        private Instant lastUpdated;

        private Tracked(Instant now) {
            this.firstSeen = now;
            this.lastUpdated = now;
        }

        private StateEntry view(PullRequestRef ref) {
            return new StateEntry(ref, fingerprint, actions, missedCycles, firstSeen, lastUpdated);
        }
    }
}
