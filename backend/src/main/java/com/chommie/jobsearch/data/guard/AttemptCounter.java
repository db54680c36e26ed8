package com.chommie.jobsearch.data.guard;

import java.time.Instant;

/**
 * Attempts recorded for one actor and action inside the current window.
 */
public record AttemptCounter(int count, Instant windowExpiresAt) {
    public boolean isExpired(Instant now) {
        return windowExpiresAt != null && !now.isBefore(windowExpiresAt);
    }
}
