package com.xammer.probe.service.gc;

import com.xammer.probe.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GarbageCollectorTaskTest {

    private final ResourceGarbageCollector collector = mock(ResourceGarbageCollector.class);
    private ThreadPoolTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ResourceGC-test-");
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void sweepsRepeatedlyUntilStopped() throws InterruptedException {
        CountDownLatch sweeps = new CountDownLatch(3);
        doAnswer(invocation -> {
            sweeps.countDown();
            return new SweepReport(Instant.now());
        }).when(collector).sweep();
        GarbageCollectorTask task = new GarbageCollectorTask(collector, scheduler,
                TestProperties.withGcInterval(Duration.ofMillis(20), true), Clock.systemUTC());

        task.start();

        assertThat(task.isRunning()).isTrue();
        assertThat(sweeps.await(5, TimeUnit.SECONDS)).isTrue();
        task.stop();
        assertThat(task.isRunning()).isFalse();
        verify(collector).cancelRunningSweep();
    }

    @Test
    void failingSweepDoesNotCancelLaterSweeps() throws InterruptedException {
        CountDownLatch sweeps = new CountDownLatch(2);
        doAnswer(invocation -> {
            sweeps.countDown();
            throw new IllegalStateException("boom");
        }).when(collector).sweep();
        GarbageCollectorTask task = new GarbageCollectorTask(collector, scheduler,
                TestProperties.withGcInterval(Duration.ofMillis(20), true), Clock.systemUTC());

        task.start();

        assertThat(sweeps.await(5, TimeUnit.SECONDS)).isTrue();
        task.stop();
    }

    @Test
    void firstSweepWaitsOneInterval() {
        GarbageCollectorTask task = new GarbageCollectorTask(collector, scheduler,
                TestProperties.withGcInterval(Duration.ofHours(1), true), Clock.systemUTC());

        task.start();
        task.stop();

        verify(collector, never()).sweep();
    }

    @Test
    void disabledCollectorNeverSchedules() {
        GarbageCollectorTask task = new GarbageCollectorTask(collector, scheduler,
                TestProperties.withGcInterval(Duration.ofMillis(20), false), Clock.systemUTC());

        task.start();

        assertThat(task.isRunning()).isFalse();
        verify(collector, never()).sweep();
    }
}
