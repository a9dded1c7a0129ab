package com.policyparser.discovery;

import com.policyparser.discovery.fetch.HostRateLimiter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class HostRateLimiterTest {
    private final AtomicLong nanos = new AtomicLong();
    private final HostRateLimiter limiter = new HostRateLimiter(2, Duration.ofMinutes(10), nanos::get);

    private void advance(long minutes) {
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(minutes));
    }

    @Test
    void hostsShareOneBucketRegardlessOfPathOrCase() {
        assertTrue(limiter.acquire("https://acme.test/privacy", 0));
        assertTrue(limiter.acquire("https://ACME.test/terms", 0));
        assertFalse(limiter.acquire("https://acme.test/cookies", 0));
        assertTrue(limiter.acquire("https://other.test/", 0));
        assertEquals(2, limiter.trackedHosts());
    }

    @Test
    void idleHostsAreDropped() {
        limiter.acquire("https://acme.test/privacy", 0);
        advance(5);
        limiter.acquire("https://other.test/privacy", 0);
        assertEquals(2, limiter.trackedHosts());

        advance(6);
        assertEquals(1, limiter.trackedHosts());

        advance(10);
        assertEquals(0, limiter.trackedHosts());
    }
}
