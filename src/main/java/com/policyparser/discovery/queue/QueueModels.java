package com.policyparser.discovery.queue;

import com.policyparser.discovery.domain.DomainModels;

import java.util.List;

public class QueueModels {

    public enum ProcessKind {
        EMPTY, CONTENDED, COMPLETED, FAILED
    }

    public record AddDomainsRequest(List<String> domains) {
    }

    public record AddDomainsResponse(int added, int skipped) {
    }

    public record ProcessOutcome(ProcessKind kind, String domain, List<DocumentSummary> documents, String error, int trainedExamples) {
        public static ProcessOutcome empty() {
            return new ProcessOutcome(ProcessKind.EMPTY, null, List.of(), null, 0);
        }

        /**
         * Pending items exist but other processors claimed every one we tried.
         */
        public static ProcessOutcome contended() {
            return new ProcessOutcome(ProcessKind.CONTENDED, null, List.of(), null, 0);
        }

        public boolean queueEmpty() {
            return kind == ProcessKind.EMPTY;
        }
    }

    public record DocumentSummary(String url, String title, DomainModels.DocumentType type, double confidence,
                                  DomainModels.StrategyKind source) {
    }

    public record QueueStatus(long pending, long processing, long completed, long failed) {
        public long total() {
            return pending + processing + completed + failed;
        }
    }

    public record ClearResult(String domain, int documentsRemoved, boolean jobRemoved) {
    }
}
