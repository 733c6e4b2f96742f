package com.panelgate.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded key/value cache for credential validation results.
 * <p>
 * Entries expire a fixed time after they were written. One instance is shared by
 * blocking HTTP handlers and relay workers; Caffeine provides the only
 * synchronization, so callers never hold a lock of their own around it.
 *
 * @param <K> cache key (a credential, or a credential/capability pair)
 * @param <V> cached validation result
 */
public class CredentialCache<K, V> {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final long DEFAULT_MAX_SIZE = 1000;

    private final Cache<K, V> cache;
    private final Duration ttl;

    public CredentialCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE, Ticker.systemTicker());
    }

    public CredentialCache(Duration ttl) {
        this(ttl, DEFAULT_MAX_SIZE, Ticker.systemTicker());
    }

    /** Constructor for testing – allows injecting a controllable ticker. */
    public CredentialCache(Duration ttl, long maxSize, Ticker ticker) {
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(K key, V value) {
        cache.put(key, value);
    }

    /**
     * Remove an entry ahead of its expiry (explicit revocation).
     *
     * @return the value that was cached, if any
     */
    public Optional<V> pop(K key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.asMap().remove(key));
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public Duration getTtl() {
        return ttl;
    }
}
