package com.xammer.probe.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
@AllArgsConstructor
public class GcCandidate {
    private final TrackedResource resource;
    private final Duration age;

    public static GcCandidate of(TrackedResource resource, Instant now) {
        return new GcCandidate(resource, Duration.between(resource.getName().getCreatedAt(), now));
    }

    public boolean isOlderThan(Duration retention) {
        return age.compareTo(retention) > 0;
    }
}
