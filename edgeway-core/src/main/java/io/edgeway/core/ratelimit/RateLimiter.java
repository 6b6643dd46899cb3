package io.edgeway.core.ratelimit;

import io.edgeway.core.config.model.RateLimitConfig;
import io.edgeway.core.security.SessionKeys;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window message rate limiter keyed by session. Every mutation of a window, including
 * eviction by {@link #sweep()}, runs inside the map's per-key compute so a sweep never races a
 * concurrent {@link #checkAndRecord(String)} for the same key.
 */
public final class RateLimiter {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);
    private static final long SECOND_MS = 1_000L;
    private static final long MINUTE_MS = 60_000L;

    private final int maxPerSecond;
    private final int maxPerMinute;
    private final long idleEvictionMs;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimiter(int maxPerSecond, int maxPerMinute, Duration idleEviction, Clock clock) {
        if (maxPerSecond <= 0) {
            throw new IllegalArgumentException("maxPerSecond must be > 0");
        }
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be > 0");
        }
        this.maxPerSecond = maxPerSecond;
        this.maxPerMinute = maxPerMinute;
        this.idleEvictionMs = Objects.requireNonNull(idleEviction, "idleEviction must not be null").toMillis();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static RateLimiter fromConfig(RateLimitConfig config, Clock clock) {
        return new RateLimiter(
            config.maxPerSecond(),
            config.maxPerMinute(),
            Duration.ofSeconds(Math.max(1, config.idleEvictionSeconds())),
            clock
        );
    }

    public boolean checkAndRecord(String sessionKey) {
        String key = SessionKeys.normalize(sessionKey);
        boolean[] allowed = new boolean[1];
        windows.compute(key, (k, existing) -> {
            Window window = existing == null ? new Window() : existing;
            long now = clock.millis();
            window.lastTouchedMs = now;
            window.prune(now - MINUTE_MS);

            int lastSecond = window.countSince(now - SECOND_MS);
            if (lastSecond >= maxPerSecond) {
                LOG.warn("Rate limit exceeded for session {}: {} messages in last second", SessionKeys.mask(k), lastSecond);
                return window;
            }
            if (window.timestamps.size() >= maxPerMinute) {
                LOG.warn(
                    "Rate limit exceeded for session {}: {} messages in last minute",
                    SessionKeys.mask(k),
                    window.timestamps.size()
                );
                return window;
            }
            window.timestamps.addLast(now);
            allowed[0] = true;
            return window;
        });
        return allowed[0];
    }

    /**
     * Drops windows that have not been touched within the idle eviction period.
     *
     * @return number of windows removed
     */
    public int sweep() {
        long cutoff = clock.millis() - idleEvictionMs;
        int removed = 0;
        for (String key : windows.keySet()) {
            boolean[] evicted = new boolean[1];
            windows.computeIfPresent(key, (k, window) -> {
                if (window.lastTouchedMs < cutoff) {
                    evicted[0] = true;
                    return null;
                }
                return window;
            });
            if (evicted[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Rate limiter sweep removed {} idle windows", removed);
        }
        return removed;
    }

    public int trackedSessions() {
        return windows.size();
    }

    public int windowSize(String sessionKey) {
        int[] size = new int[1];
        windows.computeIfPresent(SessionKeys.normalize(sessionKey), (k, window) -> {
            window.prune(clock.millis() - MINUTE_MS);
            size[0] = window.timestamps.size();
            return window;
        });
        return size[0];
    }

    private static final class Window {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private long lastTouchedMs;

        void prune(long cutoffExclusive) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoffExclusive) {
                timestamps.pollFirst();
            }
        }

        int countSince(long cutoffExclusive) {
            int count = 0;
            var iterator = timestamps.descendingIterator();
            while (iterator.hasNext() && iterator.next() > cutoffExclusive) {
                count++;
            }
            return count;
        }
    }
}
