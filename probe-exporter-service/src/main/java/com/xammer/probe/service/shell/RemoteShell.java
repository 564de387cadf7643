package com.xammer.probe.service.shell;

import java.time.Duration;

public interface RemoteShell {

    /**
     * Opens an authenticated session.
     *
     * @throws com.xammer.probe.exception.RemoteShellException if the host cannot be
     *         reached or rejects the key
     */
    RemoteShellSession connect(String host, int port, String user, String privateKeyPem, Duration timeout);
}
