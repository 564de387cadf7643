package com.xammer.probe.exception;

import com.xammer.probe.domain.ProbeOutcome;

/**
 * Base class of every failure a probe run can end with. Each subclass maps to
 * exactly one {@link ProbeOutcome}.
 */
public abstract class ProbeException extends RuntimeException {

    protected ProbeException(String message) {
        super(message);
    }

    protected ProbeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ProbeOutcome outcome();
}
