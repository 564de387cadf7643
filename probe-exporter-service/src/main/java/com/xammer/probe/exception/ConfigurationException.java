package com.xammer.probe.exception;

import com.xammer.probe.domain.ProbeOutcome;

/** Provider credentials or endpoint are missing or were rejected. */
public class ConfigurationException extends ProbeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProbeOutcome outcome() {
        return ProbeOutcome.CONFIGURATION_ERROR;
    }
}
