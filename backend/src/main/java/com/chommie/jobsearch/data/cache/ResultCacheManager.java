package com.chommie.jobsearch.data.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * TTL cache for derived results. Store failures never escape: reads degrade to a miss and
 * writes are dropped. Concurrent misses on one key may both load; the last write wins.
 */
public class ResultCacheManager {
    private static final Logger log = LoggerFactory.getLogger(ResultCacheManager.class);

    private final CacheStore store;
    private final CachedValueCodec codec;
    private final Clock clock;

    public ResultCacheManager(CacheStore store, CachedValueCodec codec, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, codec.objectMapper().getTypeFactory().constructType(type));
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, codec.objectMapper().getTypeFactory().constructType(type));
    }

    public void set(String key, Object value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }
        try {
            CachedValueCodec.Encoded encoded = codec.encode(value);
            store.put(key, new CacheEntry(encoded.payload(), encoded.compressed(), clock.instant().plus(ttl)));
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Values for the keys that hit; missing and expired keys are left out.
     */
    public <T> Map<String, T> multiGet(Collection<String> keys, Class<T> type) {
        Map<String, T> out = new LinkedHashMap<>();
        if (keys == null) {
            return out;
        }
        JavaType javaType = codec.objectMapper().getTypeFactory().constructType(type);
        for (String key : keys) {
            Optional<T> value = get(key, javaType);
            value.ifPresent(v -> out.put(key, v));
        }
        return out;
    }

    public void multiSet(Map<String, ?> values, Duration ttl) {
        if (values == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            set(entry.getKey(), entry.getValue(), ttl);
        }
    }

    public boolean delete(String key) {
        try {
            return store.remove(key);
        } catch (RuntimeException e) {
            log.warn("Cache delete failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    public int invalidateByPrefix(String prefix) {
        try {
            int removed = store.removeByPrefix(prefix);
            log.debug("Invalidated {} cache entries under {}", removed, prefix);
            return removed;
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed for prefix {}: {}", prefix, e.getMessage());
            return 0;
        }
    }

    public <T> T getOrLoad(String key, TypeReference<T> type, Duration ttl, Supplier<T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T loaded = loader.get();
        set(key, loaded, ttl);
        return loaded;
    }

    public void clear() {
        try {
            store.clear();
        } catch (RuntimeException e) {
            log.warn("Cache clear failed: {}", e.getMessage());
        }
    }

    private <T> Optional<T> get(String key, JavaType type) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            Optional<CacheEntry> entry = store.get(key);
            if (entry.isEmpty()) {
                log.debug("Cache miss {}", key);
                return Optional.empty();
            }
            if (entry.get().isExpired(clock.instant())) {
                store.remove(key);
                log.debug("Cache expired {}", key);
                return Optional.empty();
            }
            T value = codec.decode(entry.get(), type);
            log.debug("Cache hit {}", key);
            return Optional.ofNullable(value);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
