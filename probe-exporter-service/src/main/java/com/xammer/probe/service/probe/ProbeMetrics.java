package com.xammer.probe.service.probe;

import com.xammer.probe.domain.ProbeOutcome;
import com.xammer.probe.domain.ProbeRun;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

public final class ProbeMetrics {

    public static final String SUCCESS_METRIC = "cloud.probe.success";
    public static final String DURATION_METRIC = "cloud.probe.duration";
    public static final String OUTCOME_METRIC = "cloud.probe.outcome";

    private ProbeMetrics() {
    }

    public static void publishOutcome(MeterRegistry registry, ProbeRun run) {
        Tags probe = Tags.of("probe", run.getKind().getLabel());
        Gauge.builder(SUCCESS_METRIC, run, r -> r.getOutcome() == ProbeOutcome.SUCCESS ? 1 : 0)
                .description("Whether the last probe run completed every step")
                .tags(probe)
                .strongReference(true)
                .register(registry);
        Gauge.builder(DURATION_METRIC, run, r -> r.getDuration().toMillis() / 1000.0)
                .description("Wall-clock duration of the probe run")
                .baseUnit("seconds")
                .tags(probe)
                .strongReference(true)
                .register(registry);
        for (ProbeOutcome outcome : ProbeOutcome.values()) {
            Gauge.builder(OUTCOME_METRIC, run, r -> r.getOutcome() == outcome ? 1 : 0)
                    .description("Terminal outcome of the probe run")
                    .tags(probe.and("outcome", outcome.getLabel()))
                    .strongReference(true)
                    .register(registry);
        }
    }
}
