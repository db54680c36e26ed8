package com.chommie.jobsearch.data.cache;

import java.util.Optional;

/**
 * Key-value storage behind {@link ResultCacheManager}. Implementations may be remote and may
 * fail; the manager treats any runtime failure as a miss.
 */
public interface CacheStore {

    Optional<CacheEntry> get(String key);

    void put(String key, CacheEntry entry);

    boolean remove(String key);

    int removeByPrefix(String prefix);

    void clear();
}
