package com.policyparser.discovery.fetch;

public class FetchModels {

    public enum FetchMode {
        LIGHTWEIGHT, RENDERED
    }

    public record FetchOptions(long timeoutMs, long retryBudgetMs) {
        public static FetchOptions of(long timeoutMs, long retryBudgetMs) {
            return new FetchOptions(timeoutMs, retryBudgetMs);
        }

        public FetchOptions capTo(long remainingMs) {
            long budget = Math.max(0, Math.min(retryBudgetMs, remainingMs));
            return new FetchOptions(Math.min(timeoutMs, Math.max(1, budget)), budget);
        }
    }

    public record FetchResult(int status, String finalUrl, String html, int attempts, FetchMode mode) {
    }
}
