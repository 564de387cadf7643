package com.xammer.probe.service;

import com.xammer.probe.config.ProbeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Turns the optional {@code timeout} query parameter into the scrape timeout.
 * Accepts {@code 30s}, {@code 2m}, {@code 1500ms}, ISO-8601 and bare seconds.
 */
@Component
public class ScrapeTimeoutResolver {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeTimeoutResolver.class);

    private final Duration defaultTimeout;
    private final Duration maxTimeout;

    public ScrapeTimeoutResolver(ProbeProperties properties) {
        this.defaultTimeout = properties.getRequestTimeout();
        this.maxTimeout = properties.getMaxRequestTimeout();
    }

    public Duration resolve(String requested) {
        if (requested == null || requested.isBlank()) {
            return defaultTimeout;
        }
        Duration parsed;
        try {
            parsed = DurationStyle.detectAndParse(requested.trim(), ChronoUnit.SECONDS);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring invalid timeout '{}', using default {}", requested, defaultTimeout);
            return defaultTimeout;
        }
        if (parsed.isZero() || parsed.isNegative()) {
            logger.warn("Ignoring non-positive timeout '{}', using default {}", requested, defaultTimeout);
            return defaultTimeout;
        }
        if (parsed.compareTo(maxTimeout) > 0) {
            logger.warn("Requested timeout {} exceeds the maximum, using {}", parsed, maxTimeout);
            return maxTimeout;
        }
        return parsed;
    }
}
