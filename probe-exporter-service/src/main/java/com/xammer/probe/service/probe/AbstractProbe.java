package com.xammer.probe.service.probe;

import com.xammer.probe.domain.ProbeOutcome;
import com.xammer.probe.domain.ProbeRun;
import com.xammer.probe.exception.ProbeException;
import com.xammer.probe.service.ResourceNamingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Lifecycle shared by every probe: create, wait for ready, exercise, delete.
 * <p>
 * When a phase fails the remaining phases, cleanup included, are skipped.
 * Whatever was created is left to the garbage collector, which can delete it
 * without racing a deadline that has already run out.
 */
public abstract class AbstractProbe implements Probe {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    protected final ResourceNamingService naming;
    protected final ReadinessPoller poller;
    protected final Clock clock;

    protected AbstractProbe(ResourceNamingService naming, ReadinessPoller poller, Clock clock) {
        this.naming = naming;
        this.poller = poller;
        this.clock = clock;
    }

    @Override
    public final ProbeRun run(ProbeContext context) {
        ProbeRun run = new ProbeRun(kind(), clock.instant());
        StepTimer timer = new StepTimer(run, context.getRegistry(), context.getDeadline(), clock);
        ProbeOutcome outcome;
        String failure = null;
        try {
            execute(context, timer);
            outcome = ProbeOutcome.SUCCESS;
        } catch (ProbeException e) {
            outcome = e.outcome();
            failure = e.getMessage();
            logger.warn("{} probe failed after step {}: {}",
                    kind().getLabel(), run.lastStep().orElse("<none>"), e.getMessage());
        } catch (RuntimeException e) {
            outcome = ProbeOutcome.UNEXPECTED_ERROR;
            failure = e.toString();
            logger.error("{} probe failed unexpectedly after step {}",
                    kind().getLabel(), run.lastStep().orElse("<none>"), e);
        }
        run.finish(outcome, failure, clock.instant());
        ProbeMetrics.publishOutcome(context.getRegistry(), run);
        logger.info("{} probe finished in {} with outcome {}", kind().getLabel(), run.getDuration(), outcome.getLabel());
        return run;
    }

    /**
     * Runs the probe phases, calling {@link StepTimer#step(String)} at every
     * phase boundary. Deletes everything it created before returning normally.
     */
    protected abstract void execute(ProbeContext context, StepTimer timer);
}
