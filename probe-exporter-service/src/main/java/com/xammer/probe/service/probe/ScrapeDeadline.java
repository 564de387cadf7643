package com.xammer.probe.service.probe;

import com.xammer.probe.exception.ProbeTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single cancellable time bound shared by every probe of one scrape.
 * Cancellation is cooperative: provider calls derive their own timeouts from
 * {@link #remaining()} and probes check {@link #isExpired()} at every step.
 */
public final class ScrapeDeadline {

    private final Clock clock;
    private final Instant expiresAt;
    private volatile boolean cancelled;

    private ScrapeDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static ScrapeDeadline after(Duration timeout, Clock clock) {
        return new ScrapeDeadline(clock, clock.instant().plus(timeout));
    }

    public boolean isExpired() {
        return cancelled || !clock.instant().isBefore(expiresAt);
    }

    /** Time left before expiry, never negative. */
    public Duration remaining() {
        if (cancelled) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void cancel() {
        cancelled = true;
    }

    public void checkNotExpired(String what) {
        if (isExpired()) {
            throw new ProbeTimeoutException("deadline exceeded before " + what);
        }
    }

    @Override
    public String toString() {
        return "ScrapeDeadline{expiresAt=" + expiresAt + ", cancelled=" + cancelled + "}";
    }
}
