package com.xammer.probe.exception;

import com.xammer.probe.domain.ProbeOutcome;

public class RemoteShellException extends ProbeException {

    public RemoteShellException(String message) {
        super(message);
    }

    public RemoteShellException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProbeOutcome outcome() {
        return ProbeOutcome.REMOTE_SHELL_ERROR;
    }
}
