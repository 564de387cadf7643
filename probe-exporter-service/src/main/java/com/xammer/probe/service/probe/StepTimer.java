package com.xammer.probe.service.probe;

import com.xammer.probe.domain.ProbeRun;
import com.xammer.probe.exception.ProbeTimeoutException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronous checkpoint at every phase boundary of a probe.
 * <p>
 * The completion instant is published before the deadline is checked, so a
 * scrape cut short still exposes how far each probe got.
 */
public class StepTimer {

    public static final String STEP_METRIC = "cloud.probe.step.timestamp";

    private final ProbeRun run;
    private final MeterRegistry registry;
    private final ScrapeDeadline deadline;
    private final Clock clock;

    public StepTimer(ProbeRun run, MeterRegistry registry, ScrapeDeadline deadline, Clock clock) {
        this.run = run;
        this.registry = registry;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Records that {@code stepName} completed now.
     *
     * @throws ProbeTimeoutException if the shared deadline has already fired
     */
    public void step(String stepName) {
        Instant now = clock.instant();
        AtomicLong holder = new AtomicLong(now.toEpochMilli());
        Gauge.builder(STEP_METRIC, holder, millis -> millis.get() / 1000.0)
                .description("Completion time of a probe step since the epoch")
                .baseUnit("seconds")
                .tags(Tags.of("probe", run.getKind().getLabel(), "step", stepName))
                .strongReference(true)
                .register(registry);
        run.recordStep(stepName, now);

        if (deadline.isExpired()) {
            throw new ProbeTimeoutException("timeout after " + stepName);
        }
    }
}
