package com.policyparser.discovery.discovery;

public class TimeBudget {
    private final long startMs;
    private final long deadlineMs;

    public TimeBudget(long totalMs) {
        this.startMs = System.currentTimeMillis();
        this.deadlineMs = startMs + Math.max(0, totalMs);
    }

    public long deadlineMs() {
        return deadlineMs;
    }

    public long remainingMs() {
        return Math.max(0, deadlineMs - System.currentTimeMillis());
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startMs;
    }

    public boolean exhausted() {
        return remainingMs() <= 0;
    }
}
