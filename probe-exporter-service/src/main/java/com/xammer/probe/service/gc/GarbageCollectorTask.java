package com.xammer.probe.service.gc;

import com.xammer.probe.config.ProbeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs a sweep every {@code probe.gc.interval} for the lifetime of the
 * application context, first one interval after startup.
 */
@Slf4j
@Component
public class GarbageCollectorTask implements SmartLifecycle {

    private final ResourceGarbageCollector collector;
    private final TaskScheduler scheduler;
    private final ProbeProperties.Gc config;
    private final Clock clock;

    private ScheduledFuture<?> scheduled;

    public GarbageCollectorTask(ResourceGarbageCollector collector,
                                @Qualifier("gcTaskScheduler") TaskScheduler scheduler,
                                ProbeProperties properties,
                                Clock clock) {
        this.collector = collector;
        this.scheduler = scheduler;
        this.config = properties.getGc();
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (!config.isEnabled()) {
            log.info("Resource garbage collection is disabled");
            return;
        }
        if (scheduled != null) {
            return;
        }
        Duration interval = config.getInterval();
        scheduled = scheduler.scheduleWithFixedDelay(this::runSweep, clock.instant().plus(interval), interval);
        log.info("Resource garbage collection scheduled every {}, retention {}", interval, config.getRetention());
    }

    @Override
    public synchronized void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
            collector.cancelRunningSweep();
            log.info("Resource garbage collection stopped");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduled != null;
    }

    void runSweep() {
        // An exception escaping here would cancel every later execution.
        try {
            collector.sweep();
        } catch (RuntimeException e) {
            log.error("Garbage collection sweep failed", e);
        }
    }
}
