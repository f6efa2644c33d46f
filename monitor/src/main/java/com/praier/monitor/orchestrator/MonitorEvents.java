package com.praier.monitor.orchestrator;

import com.praier.monitor.dispatch.ActionResult;

/**
 * Receives structured events from the poll loop.
 */
public interface MonitorEvents {

    void actionCompleted(ActionResult result);

    void cycleCompleted(CycleSummary summary);
}
