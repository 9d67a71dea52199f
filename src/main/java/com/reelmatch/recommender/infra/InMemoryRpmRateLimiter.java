package com.reelmatch.recommender.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blocking requests-per-window limiter with one token bucket per key.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int limit;
    private final Duration window;

    public InMemoryRpmRateLimiter(int requestsPerMinute) {
        this(requestsPerMinute, Duration.ofMinutes(1));
    }

    public InMemoryRpmRateLimiter(int limit, Duration window) {
        if (limit < 1) {
            throw new IllegalArgumentException("Rate limit must be positive: " + limit);
        }
        this.limit = limit;
        this.window = window;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(limit, Refill.greedy(limit, window)))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int permits) {
        buckets.computeIfAbsent(key, k -> createBucket())
            .asBlocking()
            .consume(permits);
    }
}
