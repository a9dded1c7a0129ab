package com.policyparser.discovery.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call record of phase events and worker reports. Owned by the orchestrator thread.
 */
public class DiscoverySession {
    private static final Logger log = LoggerFactory.getLogger(DiscoverySession.class);

    private final String domain;
    private final TimeBudget budget;
    private final DiscoveryModels.ProgressListener listener;
    private final List<DiscoveryModels.PhaseEvent> events = new ArrayList<>();
    private final List<DiscoveryModels.WorkerReport> reports = new ArrayList<>();
    private DiscoveryModels.Phase phase = DiscoveryModels.Phase.IDLE;

    public DiscoverySession(String domain, TimeBudget budget, DiscoveryModels.ProgressListener listener) {
        this.domain = domain;
        this.budget = budget;
        this.listener = listener == null ? DiscoveryModels.ProgressListener.NONE : listener;
    }

    public void enter(DiscoveryModels.Phase next, String message) {
        phase = next;
        DiscoveryModels.PhaseEvent event = new DiscoveryModels.PhaseEvent(next, message, budget.elapsedMs());
        events.add(event);
        log.info("[{}] {}: {}", domain, next, message);
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {}: {}", next, e.getMessage());
        }
    }

    public void report(DiscoveryModels.WorkerReport report) {
        reports.add(report);
    }

    public DiscoveryModels.Phase phase() {
        return phase;
    }

    public TimeBudget budget() {
        return budget;
    }

    public List<DiscoveryModels.PhaseEvent> events() {
        return List.copyOf(events);
    }

    public List<DiscoveryModels.WorkerReport> reports() {
        return List.copyOf(reports);
    }
}
