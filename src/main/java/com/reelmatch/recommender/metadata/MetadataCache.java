package com.reelmatch.recommender.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Read-through cache for metadata lookups, bounded in size and entry lifetime. Reads are
 * lock-free, writes go through a single lock. Empty lookups are not stored, so they are
 * retried on the next call. Two threads missing the same key may both load it; the last
 * write wins.
 */
@Slf4j
public class MetadataCache<K, V> {

    private final String name;
    private final Cache<K, V> entries;
    private final ReentrantLock writeLock = new ReentrantLock();

    public MetadataCache(String name, long maximumSize, Duration timeToLive) {
        this(name, maximumSize, timeToLive, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    MetadataCache(String name, long maximumSize, Duration timeToLive, Ticker ticker, Executor maintenance) {
        this.name = name;
        this.entries = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(timeToLive)
            .ticker(ticker)
            .executor(maintenance)
            .build();
    }

    public Optional<V> get(K key, Function<K, Optional<V>> loader) {
        V cached = entries.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<V> loaded = loader.apply(key);
        loaded.ifPresent(value -> put(key, value));
        return loaded;
    }

    private void put(K key, V value) {
        writeLock.lock();
        try {
            entries.put(key, value);
        } finally {
            writeLock.unlock();
        }
        log.debug("Cached {} entry for {}", name, key);
    }

    Optional<V> peek(K key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
