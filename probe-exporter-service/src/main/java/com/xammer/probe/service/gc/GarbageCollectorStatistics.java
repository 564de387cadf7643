package com.xammer.probe.service.gc;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of the garbage collector, outliving the per-scrape registries
 * they are exposed through.
 */
@Component
public class GarbageCollectorStatistics {

    private final AtomicLong sweeps = new AtomicLong();
    private final AtomicLong deleted = new AtomicLong();
    private final AtomicLong failedDeletions = new AtomicLong();
    private final AtomicLong lastSweepEpochMillis = new AtomicLong();

    void record(SweepReport report) {
        sweeps.incrementAndGet();
        deleted.addAndGet(report.getDeleted().size());
        failedDeletions.addAndGet(report.getFailed().size());
        lastSweepEpochMillis.set(report.getStartedAt().toEpochMilli());
    }

    public long getSweeps() {
        return sweeps.get();
    }

    public long getDeleted() {
        return deleted.get();
    }

    public long getFailedDeletions() {
        return failedDeletions.get();
    }

    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("cloud.probe.gc.sweeps", sweeps, AtomicLong::get)
                .description("Garbage collection sweeps run since startup")
                .register(registry);
        FunctionCounter.builder("cloud.probe.gc.deleted.resources", deleted, AtomicLong::get)
                .description("Leftover resources deleted since startup")
                .register(registry);
        FunctionCounter.builder("cloud.probe.gc.failed.deletions", failedDeletions, AtomicLong::get)
                .description("Leftover resources the collector failed to delete")
                .register(registry);
        Gauge.builder("cloud.probe.gc.last.sweep.timestamp", lastSweepEpochMillis, millis -> millis.get() / 1000.0)
                .description("Start time of the last sweep since the epoch")
                .baseUnit("seconds")
                .register(registry);
    }
}
