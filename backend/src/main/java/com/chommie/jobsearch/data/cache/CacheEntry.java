package com.chommie.jobsearch.data.cache;

import java.time.Instant;

/**
 * Serialized cache value. Replaced wholesale on refresh, never edited.
 */
public record CacheEntry(byte[] payload, boolean compressed, Instant expiresAt) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
