package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;

import java.util.List;

public class DiscoveryModels {

    public enum Phase {
        IDLE, DISPATCHING, COLLECTING, VERIFYING, DONE
    }

    public enum WorkerStatus {
        OK, FAILED, TIMED_OUT, CANCELLED
    }

    public record PhaseEvent(Phase phase, String message, long elapsedMs) {
    }

    public record WorkerReport(DomainModels.StrategyKind strategy,
                               WorkerStatus status,
                               int candidates,
                               long elapsedMs,
                               String error) {
    }

    /**
     * Outcome of checking one candidate during verification.
     */
    public record VerificationRecord(String url,
                                     DomainModels.StrategyKind strategy,
                                     boolean accepted,
                                     String rejection,
                                     DomainModels.DocumentType type,
                                     double confidence) {
    }

    public record WorkerContext(String domain, String baseUrl, TimeBudget budget) {
    }

    public record DiscoveryRequest(String domain, Long budgetMs, Boolean forceRefresh) {
    }

    public record DiscoveryOutcome(String domain,
                                   boolean success,
                                   List<DomainModels.PolicyDocument> documents,
                                   int candidatesConsidered,
                                   List<VerificationRecord> verifications,
                                   List<WorkerReport> workerReports,
                                   List<PhaseEvent> events,
                                   List<DomainModels.LabeledExample> labels,
                                   String error,
                                   long elapsedMs,
                                   boolean fromCache) {
    }

    /**
     * Receives progress events in order. Implementations must not block for long.
     */
    @FunctionalInterface
    public interface ProgressListener {
        void onEvent(PhaseEvent event);

        ProgressListener NONE = event -> {
        };
    }
}
