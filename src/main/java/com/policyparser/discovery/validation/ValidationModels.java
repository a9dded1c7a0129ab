package com.policyparser.discovery.validation;

import com.policyparser.discovery.domain.DomainModels;

import java.util.List;

public class ValidationModels {

    public enum RejectionReason {
        TOO_SHORT, LOW_KEYWORD_DENSITY, GARBAGE, LOGIN_WALL, NOT_A_POLICY
    }

    public record ValidationResult(boolean valid, RejectionReason reason, String detail) {
        public static ValidationResult ok() {
            return new ValidationResult(true, null, null);
        }

        public static ValidationResult rejected(RejectionReason reason, String detail) {
            return new ValidationResult(false, reason, detail);
        }
    }

    public record CategoryMatch(String category, List<String> matches, double score) {
    }

    public record ClassificationResult(boolean policy,
                                       double confidence,
                                       DomainModels.DocumentType type,
                                       double typeConfidence,
                                       List<CategoryMatch> keywordMatches,
                                       List<String> structureIndicators,
                                       boolean highConfidence,
                                       boolean aiAssisted,
                                       String reasoning) {
    }

    public record ClassifyRequest(String text) {
    }
}
