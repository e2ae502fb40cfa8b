package io.fareway.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public final class Deadline {
    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public static Deadline none() {
        return new Deadline(Clock.systemUTC(), Instant.MAX);
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt.equals(Instant.MAX)) {
            return Duration.ofDays(365);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Returns the smaller of {@code limit} and the time left before this deadline.
     */
    public Duration cap(Duration limit) {
        Duration left = remaining();
        return left.compareTo(limit) < 0 ? left : limit;
    }
}
