package com.xammer.probe.support;

import com.xammer.probe.config.ProbeProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

public final class TestProperties {

    private TestProperties() {
    }

    public static ProbeProperties defaults() {
        return with(true, true);
    }

    public static ProbeProperties with(boolean computeEnabled, boolean storageEnabled) {
        return new ProbeProperties(
                Duration.ofSeconds(59),
                Duration.ofMinutes(5),
                new ProbeProperties.Compute(computeEnabled, "t3.small", "ami-12345678", "subnet-1", "amazon", "ubuntu", 22),
                new ProbeProperties.Storage(storageEnabled, DataSize.ofKilobytes(4)),
                new ProbeProperties.Gc(true, Duration.ofMinutes(1), Duration.ofMinutes(15), Duration.ofSeconds(50)),
                new ProbeProperties.Executor(4));
    }

    public static ProbeProperties withGcInterval(Duration interval, boolean enabled) {
        return new ProbeProperties(
                Duration.ofSeconds(59),
                Duration.ofMinutes(5),
                new ProbeProperties.Compute(true, "t3.small", "ami-12345678", "subnet-1", "amazon", "ubuntu", 22),
                new ProbeProperties.Storage(true, DataSize.ofKilobytes(4)),
                new ProbeProperties.Gc(enabled, interval, Duration.ofMinutes(15), Duration.ofSeconds(50)),
                new ProbeProperties.Executor(4));
    }
}
