package com.chommie.jobsearch.data.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-actor attempt counting for one action. An actor is locked once its count reaches
 * {@code maxAttempts} inside the window, and unlocked when the window expires or
 * {@link #recordAttempt(String, boolean)} reports a success. Every check and update runs
 * inside {@link ConcurrentHashMap#compute}, so concurrent attempts cannot slip past the limit.
 * Never throws for bad input; an unusable actor key is simply never locked.
 */
public class AttemptGuard {
    private static final Logger log = LoggerFactory.getLogger(AttemptGuard.class);

    private final String action;
    private final int maxAttempts;
    private final Duration window;
    private final Clock clock;
    private final Map<String, AttemptCounter> counters = new ConcurrentHashMap<>();

    public AttemptGuard(String action, int maxAttempts, Duration window, Clock clock) {
        this.action = action;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.window = window;
        this.clock = clock;
    }

    public void recordAttempt(String actorKey, boolean success) {
        String key = counterKey(actorKey);
        if (key == null) {
            return;
        }
        if (success) {
            counters.remove(key);
            return;
        }
        Instant now = clock.instant();
        AttemptCounter updated = counters.compute(key, (ignored, current) -> {
            int base = current == null || current.isExpired(now) ? 0 : current.count();
            return new AttemptCounter(Math.min(maxAttempts, base + 1), now.plus(window));
        });
        if (updated.count() >= maxAttempts) {
            log.info("{} locked for {} until {}", action, actorKey, updated.windowExpiresAt());
        }
    }

    public boolean isLocked(String actorKey) {
        String key = counterKey(actorKey);
        if (key == null) {
            return false;
        }
        Instant now = clock.instant();
        AttemptCounter counter = counters.computeIfPresent(key, (ignored, current) -> current.isExpired(now) ? null : current);
        return counter != null && counter.count() >= maxAttempts;
    }

    /**
     * Counts one attempt and reports whether it is allowed. Refused attempts do not move the
     * counter or the window.
     */
    public boolean tryAcquire(String actorKey) {
        String key = counterKey(actorKey);
        if (key == null) {
            return true;
        }
        Instant now = clock.instant();
        AtomicBoolean allowed = new AtomicBoolean(false);
        counters.compute(key, (ignored, current) -> {
            if (current == null || current.isExpired(now)) {
                allowed.set(true);
                return new AttemptCounter(1, now.plus(window));
            }
            if (current.count() >= maxAttempts) {
                return current;
            }
            allowed.set(true);
            return new AttemptCounter(current.count() + 1, current.windowExpiresAt());
        });
        if (!allowed.get()) {
            log.debug("{} rate limited for {}", action, actorKey);
        }
        return allowed.get();
    }

    /**
     * Counts an attempt as failed before its outcome is known and refreshes the window, unless
     * the actor is already locked. A caller whose attempt then succeeds reports it through
     * {@link #recordAttempt(String, boolean)}; one that never reached a verdict hands the slot
     * back with {@link #releaseAttempt(String)}.
     */
    public boolean reserveAttempt(String actorKey) {
        String key = counterKey(actorKey);
        if (key == null) {
            return true;
        }
        Instant now = clock.instant();
        AtomicBoolean allowed = new AtomicBoolean(false);
        AttemptCounter updated = counters.compute(key, (ignored, current) -> {
            int base = current == null || current.isExpired(now) ? 0 : current.count();
            if (base >= maxAttempts) {
                return current;
            }
            allowed.set(true);
            return new AttemptCounter(base + 1, now.plus(window));
        });
        if (allowed.get() && updated.count() >= maxAttempts) {
            log.info("{} locked for {} until {}", action, actorKey, updated.windowExpiresAt());
        }
        return allowed.get();
    }

    public void releaseAttempt(String actorKey) {
        String key = counterKey(actorKey);
        if (key == null) {
            return;
        }
        counters.computeIfPresent(key, (ignored, current) ->
            current.count() <= 1 ? null : new AttemptCounter(current.count() - 1, current.windowExpiresAt()));
    }

    public void reset(String actorKey) {
        String key = counterKey(actorKey);
        if (key != null) {
            counters.remove(key);
        }
    }

    public Optional<AttemptCounter> counter(String actorKey) {
        String key = counterKey(actorKey);
        if (key == null) {
            return Optional.empty();
        }
        AttemptCounter counter = counters.get(key);
        if (counter == null || counter.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(counter);
    }

    /**
     * Drops counters whose window has passed.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = counters.size();
        counters.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return before - counters.size();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String action() {
        return action;
    }

    private String counterKey(String actorKey) {
        if (actorKey == null || actorKey.isBlank()) {
            return null;
        }
        return actorKey.trim().toLowerCase(Locale.ROOT) + "|" + action;
    }
}
