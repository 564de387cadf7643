package com.xammer.probe.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A single execution of one probe. Owned by the task running the probe; the
 * orchestrator only reads it after that task has completed.
 */
public class ProbeRun {

    private final ProbeKind kind;
    private final Instant startedAt;
    private final List<StepRecord> steps = new ArrayList<>();
    private ProbeOutcome outcome;
    private String failure;
    private Instant finishedAt;

    public ProbeRun(ProbeKind kind, Instant startedAt) {
        this.kind = kind;
        this.startedAt = startedAt;
    }

    public static ProbeRun failed(ProbeKind kind, Instant at, ProbeOutcome outcome, String failure) {
        ProbeRun run = new ProbeRun(kind, at);
        run.finish(outcome, failure, at);
        return run;
    }

    public void recordStep(String step, Instant completedAt) {
        steps.add(new StepRecord(step, completedAt));
    }

    public void finish(ProbeOutcome outcome, String failure, Instant finishedAt) {
        if (this.outcome != null) {
            throw new IllegalStateException(kind + " probe run already finished with " + this.outcome);
        }
        this.outcome = outcome;
        this.failure = failure;
        this.finishedAt = finishedAt;
    }

    public ProbeKind getKind() {
        return kind;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public List<StepRecord> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Optional<String> lastStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1).getStep());
    }

    public ProbeOutcome getOutcome() {
        return outcome;
    }

    public String getFailure() {
        return failure;
    }

    public boolean isFinished() {
        return outcome != null;
    }

    public Duration getDuration() {
        return finishedAt == null ? Duration.ZERO : Duration.between(startedAt, finishedAt);
    }
}
