package com.docfederation.util;

import com.docfederation.exception.SyncDeadlineExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock deadline of one sync job, checked cooperatively between phases
 * and polled by the git transport.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration duration) {
        return after(Clock.systemUTC(), duration);
    }

    public static Deadline after(Clock clock, Duration duration) {
        return new Deadline(clock, clock.instant().plus(duration));
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * @throws SyncDeadlineExceededException if the deadline has passed
     */
    public void check(String phase) {
        if (isExpired()) {
            throw new SyncDeadlineExceededException(phase);
        }
    }
}
