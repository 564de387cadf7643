package com.xammer.probe.exception;

import com.xammer.probe.domain.ProbeOutcome;

/** The shared scrape deadline expired before the probe could finish. */
public class ProbeTimeoutException extends ProbeException {

    public ProbeTimeoutException(String message) {
        super(message);
    }

    public ProbeTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProbeOutcome outcome() {
        return ProbeOutcome.TIMEOUT;
    }
}
