package com.policyparser.discovery.domain;

import java.time.Instant;
import java.util.Locale;

public class DomainModels {

    public enum LinkContext {
        FOOTER, NAV, BODY, LEGAL_HUB, UNKNOWN
    }

    public enum DocumentType {
        PRIVACY, TERMS, COOKIE, DATA_PROCESSING_AGREEMENT, OTHER;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum StrategyKind {
        DIRECT_PROBE, SEARCH_ENGINE, HOMEPAGE_CRAWL, LEGAL_HUB_CRAWL, SITEMAP, KNOWN_POLICY
    }

    public enum JobStatus {
        PENDING, PROCESSING, COMPLETED, FAILED;

        public String dbValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static JobStatus fromDb(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    /**
     * An anchor found on a page, before any scoring. Produced by the link extractor.
     */
    public record RawLink(String url, String anchorText, LinkContext context, boolean visible) {
    }

    /**
     * A scored candidate. Never persisted.
     */
    public record CandidateLink(String url,
                                String anchorText,
                                LinkContext context,
                                int heuristicScore,
                                double[] features,
                                double neuralScore,
                                StrategyKind strategy,
                                boolean visible) {

        public CandidateLink withScores(double[] newFeatures, double newNeuralScore) {
            return new CandidateLink(url, anchorText, context, heuristicScore, newFeatures, newNeuralScore, strategy, visible);
        }
    }

    public record PolicyDocument(String url,
                                 String title,
                                 String text,
                                 DocumentType type,
                                 double confidence,
                                 StrategyKind source) {
    }

    public record DiscoveryJob(String domain,
                               JobStatus status,
                               String result,
                               String error,
                               int attempts,
                               Instant createdAt,
                               Instant updatedAt) {
    }

    public record LabeledExample(String url, double[] features, int target) {
    }

    public static String normalizeDomain(String input) {
        if (input == null) return "";
        String d = input.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^(https?://)?(www\\.)?", "");
        int slash = d.indexOf('/');
        if (slash >= 0) d = d.substring(0, slash);
        return d;
    }

    public static String normalizeUrl(String url) {
        if (url == null) return "";
        String u = url.trim().toLowerCase(Locale.ROOT);
        int hash = u.indexOf('#');
        if (hash >= 0) u = u.substring(0, hash);
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }
}
