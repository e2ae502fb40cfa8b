package io.fareway.mcp.server.security;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts requests per caller in fixed windows. A caller's window opens with its first request
 * and admits {@code maxRequests} until it expires.
 */
public final class FixedWindowRateLimiter {
    private static final int PRUNE_THRESHOLD = 10_000;

    private final Clock clock;
    private final long windowMillis;
    private final int maxRequests;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(Duration window, int maxRequests, Clock clock) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        this.windowMillis = window.toMillis();
        this.maxRequests = maxRequests;
        this.clock = clock;
    }

    public Decision tryAcquire(String caller) {
        long now = clock.millis();
        if (windows.size() > PRUNE_THRESHOLD) {
            windows.values().removeIf(window -> window.expired(now, windowMillis));
        }
        Window window = windows.compute(caller, (key, current) ->
            current == null || current.expired(now, windowMillis) ? new Window(now, 1) : current.next()
        );
        if (window.count() <= maxRequests) {
            return new Decision(true, maxRequests - window.count(), 0);
        }
        long waitMillis = window.startedAt() + windowMillis - now;
        return new Decision(false, 0, Math.max(1, (waitMillis + 999) / 1000));
    }

    public record Decision(boolean allowed, int remaining, long retryAfterSeconds) {
    }

    private record Window(long startedAt, int count) {
        Window next() {
            return new Window(startedAt, count + 1);
        }

        boolean expired(long now, long windowMillis) {
            return now - startedAt >= windowMillis;
        }
    }
}
