package com.xammer.probe.service.shell;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.xammer.probe.exception.RemoteShellAuthenticationException;
import com.xammer.probe.exception.RemoteShellException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * SSH access to probe instances. Host keys are not checked: every instance is
 * brand new and reached through a freshly allocated address.
 */
@Slf4j
public class JschRemoteShell implements RemoteShell {

    @Override
    public RemoteShellSession connect(String host, int port, String user, String privateKeyPem, Duration timeout) {
        JSch jsch = new JSch();
        try {
            jsch.addIdentity("probe-" + host, privateKeyPem.getBytes(StandardCharsets.US_ASCII), null, null);
            Session session = jsch.getSession(user, host, port);
            session.setConfig("StrictHostKeyChecking", "no");
            session.connect(toTimeoutMillis(timeout));
            log.debug("SSH session established to {}@{}:{}", user, host, port);
            return new JschSession(session);
        } catch (JSchException e) {
            String message = "ssh connection to " + user + "@" + host + ":" + port + " failed: " + e.getMessage();
            if (isAuthenticationFailure(e)) {
                throw new RemoteShellAuthenticationException(message, e);
            }
            throw new RemoteShellException(message, e);
        }
    }

    static boolean isAuthenticationFailure(JSchException e) {
        // JSch reports a rejected user or key as "Auth fail" or "Auth fail for methods '...'".
        return e.getMessage() != null && e.getMessage().startsWith("Auth fail");
    }

    static int toTimeoutMillis(Duration timeout) {
        long millis = Math.max(1L, timeout.toMillis());
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    private static final class JschSession implements RemoteShellSession {

        private final Session session;

        private JschSession(Session session) {
            this.session = session;
        }

        @Override
        public CommandResult execute(String command, Duration timeout) {
            long deadline = System.nanoTime() + timeout.toNanos();
            ChannelExec channel = null;
            try {
                channel = (ChannelExec) session.openChannel("exec");
                channel.setCommand(command);
                channel.setInputStream(null);
                InputStream out = channel.getInputStream();
                channel.connect(toTimeoutMillis(timeout));

                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                byte[] chunk = new byte[1024];
                while (true) {
                    while (out.available() > 0) {
                        int read = out.read(chunk, 0, chunk.length);
                        if (read < 0) {
                            break;
                        }
                        buffer.write(chunk, 0, read);
                    }
                    if (channel.isClosed() && out.available() == 0) {
                        break;
                    }
                    if (System.nanoTime() > deadline) {
                        throw new RemoteShellException("command '" + command + "' did not finish within " + timeout);
                    }
                    Thread.sleep(50);
                }
                return new CommandResult(channel.getExitStatus(), buffer.toString(StandardCharsets.UTF_8));
            } catch (JSchException | IOException e) {
                throw new RemoteShellException("command '" + command + "' failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteShellException("interrupted while running '" + command + "'", e);
            } finally {
                if (channel != null) {
                    channel.disconnect();
                }
            }
        }

        @Override
        public void close() {
            session.disconnect();
        }
    }
}
