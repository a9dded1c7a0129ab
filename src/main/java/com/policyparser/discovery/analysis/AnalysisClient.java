package com.policyparser.discovery.analysis;

import java.util.Optional;

/**
 * Second opinion on whether a text excerpt is a legal document. Implementations return empty
 * when the service is disabled, slow or unreadable.
 */
public interface AnalysisClient {

    record Verdict(boolean legalDocument, String documentType, double confidence, String reasoning) {
    }

    Optional<Verdict> analyze(String excerpt, long timeoutMs);
}
