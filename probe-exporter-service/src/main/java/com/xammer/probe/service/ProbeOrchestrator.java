package com.xammer.probe.service;

import com.xammer.probe.config.ProbeProperties;
import com.xammer.probe.domain.ProbeKind;
import com.xammer.probe.domain.ProbeOutcome;
import com.xammer.probe.domain.ProbeRun;
import com.xammer.probe.dto.ScrapeResult;
import com.xammer.probe.exception.ProbeException;
import com.xammer.probe.service.probe.Probe;
import com.xammer.probe.service.probe.ProbeContext;
import com.xammer.probe.service.probe.ProbeMetrics;
import com.xammer.probe.service.probe.ScrapeDeadline;
import com.xammer.probe.service.provider.CloudSession;
import com.xammer.probe.service.provider.CloudSessionFactory;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs one probe round per scrape. Every enabled probe runs concurrently under
 * one shared deadline; the round only completes once every probe has returned,
 * so the exposed metrics are a complete picture of the request window.
 */
@Service
public class ProbeOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ProbeOrchestrator.class);

    static final String AUTHENTICATION_METRIC = "cloud.probe.authentication.success";
    static final String SCRAPE_DURATION_METRIC = "cloud.probe.scrape.duration";

    private final List<Probe> probes;
    private final CloudSessionFactory sessionFactory;
    private final ProbeProperties properties;
    private final Executor executor;
    private final Clock clock;

    public ProbeOrchestrator(List<Probe> probes,
                             CloudSessionFactory sessionFactory,
                             ProbeProperties properties,
                             @Qualifier("probeTaskExecutor") Executor executor,
                             Clock clock) {
        this.probes = probes;
        this.sessionFactory = sessionFactory;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public ScrapeResult handleScrape(Duration timeout, MeterRegistry registry) {
        Instant start = clock.instant();
        ScrapeDeadline deadline = ScrapeDeadline.after(timeout, clock);
        List<Probe> enabled = probes.stream()
                .filter(probe -> properties.isEnabled(probe.kind()))
                .collect(Collectors.toList());

        List<ProbeRun> runs = enabled.isEmpty() ? Collections.emptyList() : runRound(enabled, deadline, registry);

        Duration elapsed = Duration.between(start, clock.instant());
        Gauge.builder(SCRAPE_DURATION_METRIC, elapsed, d -> d.toMillis() / 1000.0)
                .description("Time taken by the whole probe round")
                .baseUnit("seconds")
                .strongReference(true)
                .register(registry);
        return new ScrapeResult(start, elapsed, runs);
    }

    private List<ProbeRun> runRound(List<Probe> enabled, ScrapeDeadline deadline, MeterRegistry registry) {
        AtomicInteger authenticated = new AtomicInteger(0);
        Gauge.builder(AUTHENTICATION_METRIC, authenticated, AtomicInteger::get)
                .description("Whether the provider accepted our credentials for this scrape")
                .strongReference(true)
                .register(registry);

        CloudSession session;
        try {
            session = sessionFactory.openSession(deadline);
        } catch (ProbeException e) {
            // Not fatal for the process: the next scrape authenticates again.
            logger.error("Cannot open provider session, skipping probe round: {}", e.getMessage());
            return enabled.stream()
                    .map(probe -> failedRun(probe.kind(), e.outcome(), e.getMessage(), registry))
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            logger.error("Unexpected error opening provider session, skipping probe round", e);
            return enabled.stream()
                    .map(probe -> failedRun(probe.kind(), ProbeOutcome.UNEXPECTED_ERROR, e.toString(), registry))
                    .collect(Collectors.toList());
        }
        authenticated.set(1);
        logger.debug("Probe round authenticated as {}", session.getIdentity());

        try (session) {
            ProbeContext context = new ProbeContext(deadline, registry, session);
            List<CompletableFuture<ProbeRun>> futures = enabled.stream()
                    .map(probe -> submit(probe, context))
                    .collect(Collectors.toList());
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            return futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        }
    }

    private CompletableFuture<ProbeRun> submit(Probe probe, ProbeContext context) {
        String label = probe.kind().getLabel();
        try {
            return CompletableFuture.supplyAsync(() -> probe.run(context), executor)
                    .exceptionally(ex -> {
                        logger.error("{} probe crashed", label, ex);
                        return failedRun(probe.kind(), ProbeOutcome.UNEXPECTED_ERROR, ex.toString(), context.getRegistry());
                    });
        } catch (RejectedExecutionException e) {
            logger.error("No capacity to run the {} probe: {}", label, e.getMessage());
            return CompletableFuture.completedFuture(
                    failedRun(probe.kind(), ProbeOutcome.UNEXPECTED_ERROR, e.toString(), context.getRegistry()));
        }
    }

    private ProbeRun failedRun(ProbeKind kind, ProbeOutcome outcome, String failure, MeterRegistry registry) {
        ProbeRun run = ProbeRun.failed(kind, clock.instant(), outcome, failure);
        ProbeMetrics.publishOutcome(registry, run);
        return run;
    }
}
