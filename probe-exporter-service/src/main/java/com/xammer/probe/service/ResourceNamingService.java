package com.xammer.probe.service;

import com.xammer.probe.domain.ResourceName;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.temporal.ChronoUnit;

/**
 * Names every resource the probes create. Lowercase alphanumerics only, so the
 * same name is valid for instances, key pairs, addresses and buckets.
 */
@Service
public class ResourceNamingService {

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ResourceNamingService(Clock clock) {
        this.clock = clock;
    }

    public ResourceName createName() {
        char[] suffix = new char[ResourceName.SUFFIX_LENGTH];
        for (int i = 0; i < suffix.length; i++) {
            suffix[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new ResourceName(new String(suffix), clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }
}
