package com.xammer.probe.service;

import com.xammer.probe.ProbeExporterApplication;
import com.xammer.probe.service.gc.GarbageCollectorStatistics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Every scrape gets a fresh registry, so a metric only shows up if it was
 * produced by that scrape's probe round.
 */
@Component
public class ScrapeRegistryFactory {

    static final String BUILD_INFO_METRIC = "cloud.probe.exporter.build.info";

    private final GarbageCollectorStatistics gcStatistics;
    private final String version;

    public ScrapeRegistryFactory(GarbageCollectorStatistics gcStatistics) {
        this.gcStatistics = gcStatistics;
        String implementationVersion = ProbeExporterApplication.class.getPackage().getImplementationVersion();
        this.version = implementationVersion == null ? "unknown" : implementationVersion;
    }

    public PrometheusMeterRegistry newRegistry() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Gauge.builder(BUILD_INFO_METRIC, () -> 1)
                .description("Exporter build information")
                .tag("version", version)
                .tag("java_version", System.getProperty("java.version", "unknown"))
                .register(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        gcStatistics.bindTo(registry);
        return registry;
    }
}
