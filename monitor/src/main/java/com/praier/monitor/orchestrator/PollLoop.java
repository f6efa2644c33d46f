package com.praier.monitor.orchestrator;

import com.praier.monitor.client.ErrorKind;
import com.praier.monitor.client.GitHubGateway;
import com.praier.monitor.client.SnapshotFetcher;
import com.praier.monitor.config.AppConfig;
import com.praier.monitor.config.MonitorSettings;
import com.praier.monitor.config.RepositoryTarget;
import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.detector.ChangeDetector;
import com.praier.monitor.detector.RequiredAction;
import com.praier.monitor.dispatch.ActionDispatcher;
import com.praier.monitor.dispatch.ActionResult;
import com.praier.monitor.model.Fingerprint;
import com.praier.monitor.model.PullRequestRef;
import com.praier.monitor.model.PullRequestSnapshot;
import com.praier.monitor.model.RepositorySnapshot;
import com.praier.monitor.state.ActionKind;
import com.praier.monitor.state.StateEntry;
import com.praier.monitor.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives fetch, detect and dispatch for every repository target, once per poll interval.
 *
 * <p>Fetches within a cycle run concurrently, bounded by the configured request limit.
 * Detection and dispatch run on the calling thread in target order, so the
 * {@link StateStore} is only written from one place at a time. Cycles never overlap.</p>
 */
public class PollLoop {

    private static final Logger logger = LoggerFactory.getLogger(PollLoop.class);

    public enum LoopState {
        IDLE,
        FETCHING,
        DETECTING,
        DISPATCHING,
        SLEEPING,
        STOPPED
    }

    private final List<RepositoryTarget> targets;
    private final Map<String, ServerConfig> servers = new HashMap<>();
    private final SnapshotFetcher fetcher;
    private final ChangeDetector detector;
    private final ActionDispatcher dispatcher;
    private final StateStore store;
    private final MonitorEvents events;
    private final int maxConcurrentRequests;
    private final Duration pollInterval;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile LoopState state = LoopState.IDLE;
    private long cycles;

    public PollLoop(List<RepositoryTarget> targets, List<ServerConfig> servers, MonitorSettings settings,
                    SnapshotFetcher fetcher, ChangeDetector detector, ActionDispatcher dispatcher,
                    StateStore store, MonitorEvents events) {
        this.targets = List.copyOf(targets);
        servers.forEach(server -> this.servers.put(server.name(), server));
        this.fetcher = fetcher;
        this.detector = detector;
        this.dispatcher = dispatcher;
        this.store = store;
        this.events = events;
        this.maxConcurrentRequests = settings.maxConcurrentRequests();
        this.pollInterval = settings.pollInterval();
    }

    /**
     * Wires the loop against live GitHub servers. The configuration must already be validated.
     */
    public static PollLoop create(AppConfig config) {
        MonitorSettings settings = config.getMonitoring();
        List<ServerConfig> servers = config.activeServers();
        GitHubGateway gateway = new GitHubGateway(settings.requestTimeout());
        StateStore store = new StateStore(settings.evictionCycles());
        return new PollLoop(config.targets(), servers, settings, gateway,
                new ChangeDetector(settings.autoApproveActions(), settings.autoFixWithCopilot()),
                new ActionDispatcher(servers, gateway, store), store, new LoggingMonitorEvents());
    }

    /**
     * Runs cycles until {@link #stop()} is called. The stop request is honored
     * between cycles; a cycle in progress completes first.
     */
    public void run() {
        logger.info("Starting poll loop over {} repository target(s), interval {}s",
                targets.size(), pollInterval.toSeconds());
        while (stopSignal.getCount() > 0) {
            try {
                runCycle();
            } catch (RuntimeException e) {
                logger.error("Poll cycle failed unexpectedly", e);
            }

            state = LoopState.SLEEPING;
            try {
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        state = LoopState.STOPPED;
        logger.info("Poll loop stopped after {} cycle(s)", cycles);
    }

    public void stop() {
        stopSignal.countDown();
    }

    public LoopState state() {
        return state;
    }

    /**
     * Performs one full cycle: fetch every target, detect and dispatch per pull
     * request, then age out pull requests that were not seen.
     */
    public synchronized CycleSummary runCycle() {
        long start = System.currentTimeMillis();
        long cycle = ++cycles;
        logger.debug("Starting cycle {}", cycle);

        state = LoopState.FETCHING;
        Map<RepositoryTarget, FetchOutcome> fetched = fetchAll();

        List<RepositoryResult> repositoryResults = new ArrayList<>();
        List<ActionResult> actionResults = new ArrayList<>();
        Set<PullRequestRef> seen = new HashSet<>();

        for (RepositoryTarget target : targets) {
            FetchOutcome outcome = fetched.get(target);
            if (outcome.error != null) {
                repositoryResults.add(fetchFailed(target, outcome.error, seen));
                continue;
            }
            try {
                repositoryResults.add(process(target, outcome.fetched, seen, actionResults));
            } catch (RuntimeException e) {
                logger.error("Unexpected failure while processing {}", target, e);
                seen.addAll(store.refsFor(target.server(), target.repository()));
                outcome.fetched.pullRequests().forEach(snapshot -> seen.add(snapshot.ref()));
                seen.addAll(outcome.fetched.unresolved());
                repositoryResults.add(RepositoryResult.failure(target, outcome.fetched.pullRequests().size(),
                        ErrorKind.TRANSPORT, e.toString()));
            }
        }

        List<PullRequestRef> evicted = store.evictStale(seen);
        evicted.forEach(ref -> logger.info("Stopped tracking {}", ref));

        CycleSummary summary = new CycleSummary(cycle, repositoryResults, actionResults, evicted,
                store.countByServer(), System.currentTimeMillis() - start);
        state = LoopState.IDLE;
        events.cycleCompleted(summary);
        return summary;
    }

    private RepositoryResult fetchFailed(RepositoryTarget target, Exception error, Set<PullRequestRef> seen) {
        ErrorKind kind = ErrorKind.classify(error);
        if (kind == ErrorKind.NOT_FOUND) {
            logger.warn("Repository {} not found; its pull requests will age out", target);
        } else {
            // Unknown is not gone: keep what is tracked for this repository alive.
            seen.addAll(store.refsFor(target.server(), target.repository()));
            if (kind == ErrorKind.PERMISSION_DENIED) {
                logger.error("Permission denied reading {}. Check the token's scopes: {}", target, error.getMessage());
            } else {
                logger.warn("Failed to fetch {} ({}): {}", target, kind, error.getMessage());
            }
        }
        return RepositoryResult.failure(target, 0, kind, error.getMessage());
    }

    private RepositoryResult process(RepositoryTarget target, RepositorySnapshot fetched,
                                     Set<PullRequestRef> seen, List<ActionResult> actionResults) {
        List<PullRequestSnapshot> snapshots = fetched.pullRequests();
        snapshots.forEach(snapshot -> seen.add(snapshot.ref()));
        seen.addAll(fetched.unresolved());

        for (PullRequestSnapshot snapshot : snapshots) {
            PullRequestRef ref = snapshot.ref();
            Fingerprint fingerprint = snapshot.fingerprint();

            state = LoopState.DETECTING;
            Optional<StateEntry> previous = store.get(ref);
            List<RequiredAction> actions = detector.detect(previous, snapshot);

            if (actions.isEmpty()) {
                if (previous.isEmpty() || !fingerprint.equals(previous.get().fingerprint())) {
                    store.updateFingerprint(ref, fingerprint);
                }
                continue;
            }

            state = LoopState.DISPATCHING;
            boolean allSucceeded = true;
            boolean pullRequestGone = false;
            for (RequiredAction action : actions) {
                ActionResult result = dispatcher.dispatch(ref, fingerprint, action);
                actionResults.add(result);
                events.actionCompleted(result);
                if (result.succeeded()) {
                    continue;
                }
                if (result.error() == ErrorKind.NOT_FOUND) {
                    if (result.kind() == ActionKind.COMMENT_COPILOT) {
                        // The pull request itself is gone
                        store.evict(ref);
                        pullRequestGone = true;
                        break;
                    }
                    // The run was deleted or already approved; nothing is left to do for it
                    continue;
                }
                allSucceeded = false;
                if (result.error().abortsRepository()) {
                    logger.warn("Skipping the rest of {} this cycle after {}", target, result.error());
                    return RepositoryResult.failure(target, snapshots.size(), result.error(), result.errorMessage());
                }
            }

            if (allSucceeded && !pullRequestGone) {
                store.updateFingerprint(ref, fingerprint);
            }
        }
        return RepositoryResult.success(target, snapshots.size());
    }

    private Map<RepositoryTarget, FetchOutcome> fetchAll() {
        Map<RepositoryTarget, FetchOutcome> outcomes = new LinkedHashMap<>();
        if (targets.isEmpty()) {
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(maxConcurrentRequests, targets.size()), new FetchThreadFactory());
        try {
            Map<RepositoryTarget, Future<RepositorySnapshot>> futures = new LinkedHashMap<>();
            for (RepositoryTarget target : targets) {
                ServerConfig server = servers.get(target.server());
                futures.put(target, executor.submit(() -> fetcher.fetchOpenPullRequests(server, target.repository())));
            }

            for (Map.Entry<RepositoryTarget, Future<RepositorySnapshot>> entry : futures.entrySet()) {
                try {
                    RepositorySnapshot fetched = entry.getValue().get();
                    logger.debug("Fetched {} open pull request(s) from {}, {} unresolved",
                            fetched.pullRequests().size(), entry.getKey(), fetched.unresolved().size());
                    outcomes.put(entry.getKey(), new FetchOutcome(fetched, null));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    Exception error = cause instanceof Exception ? (Exception) cause : e;
                    outcomes.put(entry.getKey(), new FetchOutcome(RepositorySnapshot.of(), error));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.values().forEach(future -> future.cancel(true));
                    outcomes.put(entry.getKey(), new FetchOutcome(RepositorySnapshot.of(), e));
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        // Targets skipped by an interrupt count as transport failures
        for (RepositoryTarget target : targets) {
            outcomes.putIfAbsent(target, new FetchOutcome(RepositorySnapshot.of(),
                    new InterruptedException("Fetch interrupted")));
        }
        return outcomes;
    }

    private static final class FetchOutcome {
        private final RepositorySnapshot fetched;
        private final Exception error;

        private FetchOutcome(RepositorySnapshot fetched, Exception error) {
            this.fetched = fetched;
            this.error = error;
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "praier-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
