package com.xammer.probe.service.probe;

import com.xammer.probe.exception.ProbeTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Polls a readiness check with exponential backoff until it yields a value or
 * the deadline expires. Never sleeps past the deadline.
 */
public class ReadinessPoller {

    private static final Logger logger = LoggerFactory.getLogger(ReadinessPoller.class);

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    public ReadinessPoller(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
        this.multiplier = multiplier <= 1.0 ? 1.0 : multiplier;
    }

    /**
     * @throws ProbeTimeoutException if the deadline expires first
     */
    public <T> T await(String what, ScrapeDeadline deadline, Supplier<Optional<T>> check) {
        Duration delay = initialDelay;
        for (int attempt = 1; ; attempt++) {
            deadline.checkNotExpired(what);
            Optional<T> result = check.get();
            if (result.isPresent()) {
                logger.debug("{} ready after {} attempt(s)", what, attempt);
                return result.get();
            }
            Duration remaining = deadline.remaining();
            if (remaining.isZero()) {
                throw new ProbeTimeoutException("deadline exceeded waiting for " + what);
            }
            try {
                Thread.sleep(min(delay, remaining).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProbeTimeoutException("interrupted waiting for " + what);
            }
            delay = min(Duration.ofMillis((long) (delay.toMillis() * multiplier)), maxDelay);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
