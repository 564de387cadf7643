package com.xammer.probe.config;

import com.xammer.probe.domain.ProbeKind;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Immutable exporter configuration, bound once at startup and handed to the
 * orchestrator, the probes and the garbage collector.
 */
@Getter
@ConstructorBinding
@ConfigurationProperties("probe")
public class ProbeProperties {

    private final Duration requestTimeout;
    private final Duration maxRequestTimeout;
    private final Compute compute;
    private final Storage storage;
    private final Gc gc;
    private final Executor executor;

    public ProbeProperties(@DefaultValue("59s") Duration requestTimeout,
                           @DefaultValue("5m") Duration maxRequestTimeout,
                           @DefaultValue Compute compute,
                           @DefaultValue Storage storage,
                           @DefaultValue Gc gc,
                           @DefaultValue Executor executor) {
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("probe.request-timeout must be positive, got " + requestTimeout);
        }
        if (maxRequestTimeout.compareTo(requestTimeout) < 0) {
            throw new IllegalArgumentException("probe.max-request-timeout (" + maxRequestTimeout
                    + ") must not be shorter than probe.request-timeout (" + requestTimeout + ")");
        }
        // Anything younger than the longest possible scrape may still belong to a live probe.
        if (gc.getRetention().compareTo(maxRequestTimeout) <= 0) {
            throw new IllegalArgumentException("probe.gc.retention (" + gc.getRetention()
                    + ") must exceed probe.max-request-timeout (" + maxRequestTimeout + ")");
        }
        this.requestTimeout = requestTimeout;
        this.maxRequestTimeout = maxRequestTimeout;
        this.compute = compute;
        this.storage = storage;
        this.gc = gc;
        this.executor = executor;
    }

    public boolean isEnabled(ProbeKind kind) {
        switch (kind) {
            case COMPUTE:
                return compute.isEnabled();
            case STORAGE:
                return storage.isEnabled();
            default:
                return false;
        }
    }

    @Getter
    public static class Compute {
        private final boolean enabled;
        private final String flavor;
        private final String image;
        private final String internalNetwork;
        private final String externalNetwork;
        private final String user;
        private final int sshPort;

        public Compute(@DefaultValue("true") boolean enabled,
                       @DefaultValue("t3.small") String flavor,
                       @DefaultValue("ubuntu/images/hvm-ssd/ubuntu-jammy-22.04-amd64-server-*") String image,
                       @DefaultValue("") String internalNetwork,
                       @DefaultValue("amazon") String externalNetwork,
                       @DefaultValue("ubuntu") String user,
                       @DefaultValue("22") int sshPort) {
            this.enabled = enabled;
            this.flavor = flavor;
            this.image = image;
            this.internalNetwork = internalNetwork;
            this.externalNetwork = externalNetwork;
            this.user = user;
            this.sshPort = sshPort;
        }
    }

    @Getter
    public static class Storage {
        private final boolean enabled;
        private final DataSize payloadSize;

        public Storage(@DefaultValue("true") boolean enabled,
                       @DefaultValue("64KB") DataSize payloadSize) {
            if (payloadSize.toBytes() <= 0 || payloadSize.toBytes() > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("probe.storage.payload-size out of range: " + payloadSize);
            }
            this.enabled = enabled;
            this.payloadSize = payloadSize;
        }
    }

    @Getter
    public static class Gc {
        private final boolean enabled;
        private final Duration interval;
        private final Duration retention;
        private final Duration sweepTimeout;

        public Gc(@DefaultValue("true") boolean enabled,
                  @DefaultValue("1m") Duration interval,
                  @DefaultValue("15m") Duration retention,
                  @DefaultValue("50s") Duration sweepTimeout) {
            this.enabled = enabled;
            this.interval = interval;
            this.retention = retention;
            this.sweepTimeout = sweepTimeout;
        }
    }

    @Getter
    public static class Executor {
        private final int poolSize;

        public Executor(@DefaultValue("4") int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
