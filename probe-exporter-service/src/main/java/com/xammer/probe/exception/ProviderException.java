package com.xammer.probe.exception;

import com.xammer.probe.domain.ProbeOutcome;

/** A create, list, poll or delete call was rejected by the cloud backend. */
public class ProviderException extends ProbeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProbeOutcome outcome() {
        return ProbeOutcome.PROVIDER_ERROR;
    }
}
