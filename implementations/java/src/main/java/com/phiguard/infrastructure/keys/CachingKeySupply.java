package com.phiguard.infrastructure.keys;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Caffeine cache in front of a slow key supply.
 *
 * <p>Only present keys are cached; a miss goes to the delegate every time so a key added
 * to the supply is seen on the next rotation start. Cached arrays are copied on the way out.
 */
@Slf4j
public class CachingKeySupply implements KeySupply {

    private final KeySupply delegate;
    private final Cache<String, byte[]> cache;

    public CachingKeySupply(KeySupply delegate, Duration ttl) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .maximumSize(256)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    @Override
    public Optional<byte[]> getKey(String label) {
        byte[] cached = cache.getIfPresent(label);
        if (cached != null) {
            return Optional.of(cached.clone());
        }
        Optional<byte[]> loaded = delegate.getKey(label);
        loaded.ifPresent(bytes -> {
            cache.put(label, bytes.clone());
            log.debug("Cached key material for {}", label);
        });
        return loaded;
    }

    @Override
    public SortedSet<String> listVersions() {
        return delegate.listVersions();
    }

    @Override
    public void invalidate(String label) {
        cache.invalidate(label);
        log.debug("Dropped cached key material for {}", label);
    }

    long hitCount() {
        return cache.stats().hitCount();
    }
}
