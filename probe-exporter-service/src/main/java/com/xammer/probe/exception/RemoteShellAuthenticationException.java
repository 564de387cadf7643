package com.xammer.probe.exception;

/** The SSH server is up but rejected the user or key. */
public class RemoteShellAuthenticationException extends RemoteShellException {

    public RemoteShellAuthenticationException(String message) {
        super(message);
    }

    public RemoteShellAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
