package com.chommie.jobsearch.data.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-process store with per-entry expiry taken from {@link CacheEntry#expiresAt()}.
 */
public class CaffeineCacheStore implements CacheStore, AutoCloseable {
    private final Cache<String, CacheEntry> cache;

    public CaffeineCacheStore(int maximumEntries, Clock clock) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumEntries)
            .expireAfter(new Expiry<String, CacheEntry>() {
                @Override
                public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
                    return remainingNanos(value, clock);
                }

                @Override
                public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
                    return remainingNanos(value, clock);
                }

                @Override
                public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, CacheEntry entry) {
        cache.put(key, entry);
    }

    @Override
    public boolean remove(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public int removeByPrefix(String prefix) {
        List<String> matching = new ArrayList<>();
        for (String key : cache.asMap().keySet()) {
            if (key.startsWith(prefix)) {
                matching.add(key);
            }
        }
        int removed = 0;
        for (String key : matching) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    private static long remainingNanos(CacheEntry entry, Clock clock) {
        if (entry.expiresAt() == null) {
            return Long.MAX_VALUE;
        }
        Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
        return remaining.isNegative() ? 0L : remaining.toNanos();
    }
}
