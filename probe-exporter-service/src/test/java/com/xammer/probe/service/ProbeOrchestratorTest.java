package com.xammer.probe.service;

import com.xammer.probe.config.ProbeProperties;
import com.xammer.probe.domain.ProbeKind;
import com.xammer.probe.domain.ProbeOutcome;
import com.xammer.probe.domain.ProbeRun;
import com.xammer.probe.dto.ScrapeResult;
import com.xammer.probe.service.probe.ComputeProbe;
import com.xammer.probe.service.probe.Probe;
import com.xammer.probe.service.probe.ProbeContext;
import com.xammer.probe.service.probe.ProbeMetrics;
import com.xammer.probe.service.probe.ReadinessPoller;
import com.xammer.probe.service.probe.StorageProbe;
import com.xammer.probe.service.provider.CloudSessionFactory;
import com.xammer.probe.support.FakeCloud;
import com.xammer.probe.support.FakeRemoteShell;
import com.xammer.probe.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeOrchestratorTest {

    private final Clock clock = Clock.systemUTC();
    private final FakeCloud cloud = new FakeCloud();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final ResourceNamingService naming = new ResourceNamingService(clock);
    private final ReadinessPoller poller = new ReadinessPoller(Duration.ofMillis(1), Duration.ofMillis(10), 2.0);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ProbeOrchestrator orchestrator(ProbeProperties properties, List<Probe> probes) {
        return new ProbeOrchestrator(probes, cloud, properties, executor, clock);
    }

    private List<Probe> realProbes(ProbeProperties properties) {
        return List.of(
                new ComputeProbe(naming, poller, clock, properties, new FakeRemoteShell()),
                new StorageProbe(naming, poller, clock, properties));
    }

    private static ProbeRun runOf(ScrapeResult result, ProbeKind kind) {
        return result.getRuns().stream().filter(run -> run.getKind() == kind).findFirst().orElseThrow();
    }

    @Test
    void runsEveryEnabledProbeAndClosesTheSession() {
        ProbeProperties properties = TestProperties.defaults();

        ScrapeResult result = orchestrator(properties, realProbes(properties)).handleScrape(Duration.ofSeconds(30), registry);

        assertThat(result.getRuns()).extracting(ProbeRun::getOutcome)
                .containsOnly(ProbeOutcome.SUCCESS).hasSize(2);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(cloud.getSessionsOpened()).isEqualTo(1);
        assertThat(cloud.getSessionsClosed()).isEqualTo(1);
        assertThat(registry.get(ProbeOrchestrator.AUTHENTICATION_METRIC).gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(ProbeOrchestrator.SCRAPE_DURATION_METRIC).gauge()).isNotNull();
    }

    @Test
    void probesRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Probe first = new RendezvousProbe(ProbeKind.COMPUTE, bothStarted);
        Probe second = new RendezvousProbe(ProbeKind.STORAGE, bothStarted);

        ScrapeResult result = orchestrator(TestProperties.defaults(), List.of(first, second))
                .handleScrape(Duration.ofSeconds(30), registry);

        assertThat(result.getRuns()).extracting(ProbeRun::getOutcome).containsOnly(ProbeOutcome.SUCCESS);
    }

    @Test
    void oneFailingProbeDoesNotAffectTheOther() {
        cloud.failOn("create_container");
        ProbeProperties properties = TestProperties.defaults();

        ScrapeResult result = orchestrator(properties, realProbes(properties)).handleScrape(Duration.ofSeconds(30), registry);

        assertThat(runOf(result, ProbeKind.STORAGE).getOutcome()).isEqualTo(ProbeOutcome.PROVIDER_ERROR);
        assertThat(runOf(result, ProbeKind.COMPUTE).getOutcome()).isEqualTo(ProbeOutcome.SUCCESS);
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void probeThatThrowsIsReportedAsUnexpectedError() {
        Probe broken = new Probe() {
            @Override
            public ProbeKind kind() {
                return ProbeKind.COMPUTE;
            }

            @Override
            public ProbeRun run(ProbeContext context) {
                throw new IllegalStateException("boom");
            }
        };
        ProbeProperties properties = TestProperties.defaults();
        StorageProbe storage = new StorageProbe(naming, poller, clock, properties);

        ScrapeResult result = orchestrator(properties, List.of(broken, storage)).handleScrape(Duration.ofSeconds(30), registry);

        assertThat(runOf(result, ProbeKind.COMPUTE).getOutcome()).isEqualTo(ProbeOutcome.UNEXPECTED_ERROR);
        assertThat(runOf(result, ProbeKind.STORAGE).getOutcome()).isEqualTo(ProbeOutcome.SUCCESS);
        assertThat(registry.get(ProbeMetrics.OUTCOME_METRIC)
                .tags("probe", "compute", "outcome", "unexpected_error").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void hangingProbeIsBoundedByTheSharedDeadline() {
        cloud.hangOn("put_object");
        ProbeProperties properties = TestProperties.defaults();
        long started = System.nanoTime();

        ScrapeResult result = orchestrator(properties, realProbes(properties)).handleScrape(Duration.ofMillis(500), registry);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        assertThat(runOf(result, ProbeKind.STORAGE).getOutcome()).isEqualTo(ProbeOutcome.TIMEOUT);
        assertThat(runOf(result, ProbeKind.COMPUTE).getOutcome()).isEqualTo(ProbeOutcome.SUCCESS);
    }

    @Test
    void rejectedCredentialsFailEveryProbeWithoutThrowing() {
        cloud.rejectCredentials();
        ProbeProperties properties = TestProperties.defaults();

        ScrapeResult result = orchestrator(properties, realProbes(properties)).handleScrape(Duration.ofSeconds(30), registry);

        assertThat(result.getRuns()).extracting(ProbeRun::getOutcome)
                .containsExactly(ProbeOutcome.CONFIGURATION_ERROR, ProbeOutcome.CONFIGURATION_ERROR);
        assertThat(registry.get(ProbeOrchestrator.AUTHENTICATION_METRIC).gauge().value()).isZero();
        assertThat(registry.get(ProbeMetrics.SUCCESS_METRIC).tag("probe", "storage").gauge().value()).isZero();
    }

    @Test
    void unexpectedSessionFailureStillAnswersWithFailedRuns() {
        ProbeProperties properties = TestProperties.defaults();
        CloudSessionFactory broken = deadline -> {
            throw new IllegalArgumentException("apiCallTimeout must be positive");
        };
        ProbeOrchestrator orchestrator = new ProbeOrchestrator(realProbes(properties), broken, properties, executor, clock);

        ScrapeResult result = orchestrator.handleScrape(Duration.ofSeconds(30), registry);

        assertThat(result.getRuns()).extracting(ProbeRun::getOutcome)
                .containsExactly(ProbeOutcome.UNEXPECTED_ERROR, ProbeOutcome.UNEXPECTED_ERROR);
        assertThat(registry.get(ProbeOrchestrator.AUTHENTICATION_METRIC).gauge().value()).isZero();
    }

    @Test
    void credentialsAreCheckedAgainOnEveryScrape() {
        ProbeProperties properties = TestProperties.defaults();
        ProbeOrchestrator orchestrator = orchestrator(properties, realProbes(properties));

        orchestrator.handleScrape(Duration.ofSeconds(30), new SimpleMeterRegistry());
        orchestrator.handleScrape(Duration.ofSeconds(30), new SimpleMeterRegistry());

        assertThat(cloud.getSessionsOpened()).isEqualTo(2);
    }

    @Test
    void disabledProbesAreSkipped() {
        ProbeProperties properties = TestProperties.with(false, true);

        ScrapeResult result = orchestrator(properties, realProbes(properties)).handleScrape(Duration.ofSeconds(30), registry);

        assertThat(result.getRuns()).extracting(ProbeRun::getKind).containsExactly(ProbeKind.STORAGE);
        assertThat(registry.find(ProbeMetrics.SUCCESS_METRIC).tag("probe", "compute").gauge()).isNull();
    }

    @Test
    void noEnabledProbesMeansNoSession() {
        ProbeProperties properties = TestProperties.with(false, false);

        ScrapeResult result = orchestrator(properties, realProbes(properties)).handleScrape(Duration.ofSeconds(30), registry);

        assertThat(result.getRuns()).isEmpty();
        assertThat(cloud.getSessionsOpened()).isZero();
    }

    /** Succeeds only if its sibling starts while it is still running. */
    private static class RendezvousProbe implements Probe {

        private final ProbeKind kind;
        private final CountDownLatch bothStarted;

        RendezvousProbe(ProbeKind kind, CountDownLatch bothStarted) {
            this.kind = kind;
            this.bothStarted = bothStarted;
        }

        @Override
        public ProbeKind kind() {
            return kind;
        }

        @Override
        public ProbeRun run(ProbeContext context) {
            ProbeRun run = new ProbeRun(kind, Clock.systemUTC().instant());
            bothStarted.countDown();
            boolean together;
            try {
                together = bothStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                together = false;
            }
            run.finish(together ? ProbeOutcome.SUCCESS : ProbeOutcome.TIMEOUT, null, Clock.systemUTC().instant());
            return run;
        }
    }
}
