package com.xammer.probe.dto;

import com.xammer.probe.domain.ProbeOutcome;
import com.xammer.probe.domain.ProbeRun;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Everything that happened during one scrape, once every probe has returned. */
@Getter
@AllArgsConstructor
public class ScrapeResult {
    private final Instant startedAt;
    private final Duration duration;
    private final List<ProbeRun> runs;

    public boolean isSuccessful() {
        return runs.stream().allMatch(run -> run.getOutcome() == ProbeOutcome.SUCCESS);
    }
}
