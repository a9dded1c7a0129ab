package com.policyparser.discovery.fetch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.policyparser.discovery.config.FetchProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Per-host token bucket. Callers wait for a token at most for the time they have left.
 * Buckets of hosts that have not been contacted for the idle expiry are dropped.
 */
@Component
public class HostRateLimiter {

    private final Cache<String, Bucket> buckets;
    private final int requestsPerSecond;

    @Autowired
    public HostRateLimiter(FetchProperties properties) {
        this(properties.requestsPerSecond(), Duration.ofMillis(properties.hostIdleExpiryMs()), Ticker.systemTicker());
    }

    public HostRateLimiter(int requestsPerSecond, Duration idleExpiry, Ticker ticker) {
        this.requestsPerSecond = requestsPerSecond;
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiry)
                .ticker(ticker)
                .build();
    }

    public boolean acquire(String url, long maxWaitMs) {
        Bucket bucket = buckets.get(hostOf(url), k -> newBucket());
        if (bucket.tryConsume(1)) return true;
        if (maxWaitMs <= 0) return false;
        try {
            return bucket.asBlocking().tryConsume(1, Duration.ofMillis(maxWaitMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long trackedHosts() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private Bucket newBucket() {
        Refill refill = Refill.greedy(requestsPerSecond, Duration.ofSeconds(1));
        Bandwidth limit = Bandwidth.classic(requestsPerSecond, refill);
        return Bucket.builder().addLimit(limit).build();
    }

    static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
