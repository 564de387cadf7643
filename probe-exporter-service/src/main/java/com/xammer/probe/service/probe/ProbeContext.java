package com.xammer.probe.service.probe;

import com.xammer.probe.service.provider.CloudSession;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** What the probes of one scrape share: the deadline, the registry and the provider session. */
@Getter
@AllArgsConstructor
public class ProbeContext {
    private final ScrapeDeadline deadline;
    private final MeterRegistry registry;
    private final CloudSession session;
}
