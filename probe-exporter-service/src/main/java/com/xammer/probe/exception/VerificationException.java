package com.xammer.probe.exception;

import com.xammer.probe.domain.ProbeOutcome;

/** Downloaded payload differs from the uploaded one. */
public class VerificationException extends ProbeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProbeOutcome outcome() {
        return ProbeOutcome.VERIFICATION_ERROR;
    }
}
