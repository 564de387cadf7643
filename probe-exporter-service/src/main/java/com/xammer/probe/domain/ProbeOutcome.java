package com.xammer.probe.domain;

import java.util.Locale;

public enum ProbeOutcome {
    SUCCESS,
    TIMEOUT,
    PROVIDER_ERROR,
    VERIFICATION_ERROR,
    REMOTE_SHELL_ERROR,
    CONFIGURATION_ERROR,
    UNEXPECTED_ERROR;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
