package com.praier.monitor.orchestrator;

import com.praier.monitor.dispatch.ActionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.TreeMap;

/**
 * Writes monitor events as key=value log lines.
 */
public class LoggingMonitorEvents implements MonitorEvents {

    private static final Logger logger = LoggerFactory.getLogger(LoggingMonitorEvents.class);

    @Override
    public void actionCompleted(ActionResult result) {
        if (result.succeeded()) {
            logger.info("action ref={} kind={} target={} outcome={} durationMs={}",
                    result.ref(), result.kind().label(), result.target(), result.outcome(), result.durationMs());
        } else {
            logger.warn("action ref={} kind={} target={} outcome={} error={} durationMs={} message=\"{}\"",
                    result.ref(), result.kind().label(), result.target(), result.outcome(),
                    result.error(), result.durationMs(), result.errorMessage());
        }
    }

    @Override
    public void cycleCompleted(CycleSummary summary) {
        logger.info("cycle={} repositories={} pullRequests={} actions={} failed={} evicted={} tracked={} byServer={} durationMs={}",
                summary.cycle(), summary.repositories().size(), summary.pullRequestsSeen(),
                summary.actionsSucceeded(), summary.actionsFailed(), summary.evicted().size(),
                summary.tracked(), new TreeMap<>(summary.trackedByServer()), summary.durationMs());

        if (summary.repositoryFailures() > 0) {
            summary.repositories().stream()
                    .filter(r -> !r.succeeded())
                    .forEach(r -> logger.warn("  FAILED: {} [{}]: {}", r.target(), r.error(), r.errorMessage()));
        }
    }
}
