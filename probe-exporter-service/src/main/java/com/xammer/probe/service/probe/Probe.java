package com.xammer.probe.service.probe;

import com.xammer.probe.domain.ProbeKind;
import com.xammer.probe.domain.ProbeRun;

/**
 * One independent, timed, self-cleaning unit of synthetic work against the
 * cloud provider.
 */
public interface Probe {

    ProbeKind kind();

    /**
     * Runs every phase in order, publishing step timestamps to the context's
     * registry as they complete. Never throws: failures end up in the returned
     * run's outcome.
     */
    ProbeRun run(ProbeContext context);
}
