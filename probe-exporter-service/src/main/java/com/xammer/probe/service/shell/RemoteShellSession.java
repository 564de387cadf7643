package com.xammer.probe.service.shell;

import java.time.Duration;

public interface RemoteShellSession extends AutoCloseable {

    CommandResult execute(String command, Duration timeout);

    @Override
    void close();
}
