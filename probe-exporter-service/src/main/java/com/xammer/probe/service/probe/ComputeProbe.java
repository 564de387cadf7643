package com.xammer.probe.service.probe;

import com.xammer.probe.config.ProbeProperties;
import com.xammer.probe.domain.ProbeKind;
import com.xammer.probe.domain.ResourceName;
import com.xammer.probe.exception.ProbeTimeoutException;
import com.xammer.probe.exception.ProviderException;
import com.xammer.probe.exception.RemoteShellAuthenticationException;
import com.xammer.probe.exception.RemoteShellException;
import com.xammer.probe.service.ResourceNamingService;
import com.xammer.probe.service.provider.AddressHandle;
import com.xammer.probe.service.provider.ComputeProvider;
import com.xammer.probe.service.provider.InstanceSpec;
import com.xammer.probe.service.provider.InstanceStatus;
import com.xammer.probe.service.provider.KeyPairHandle;
import com.xammer.probe.service.shell.CommandResult;
import com.xammer.probe.service.shell.RemoteShell;
import com.xammer.probe.service.shell.RemoteShellSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Boots an instance, reaches it over SSH through a public address and runs a
 * trivial command on it.
 */
@Slf4j
@Component
public class ComputeProbe extends AbstractProbe {

    private static final Duration SSH_ATTEMPT_TIMEOUT = Duration.ofSeconds(10);
    static final int AUTH_FAILURE_LIMIT = 3;

    private final ProbeProperties.Compute config;
    private final RemoteShell remoteShell;

    public ComputeProbe(ResourceNamingService naming, ReadinessPoller poller, Clock clock,
                        ProbeProperties properties, RemoteShell remoteShell) {
        super(naming, poller, clock);
        this.config = properties.getCompute();
        this.remoteShell = remoteShell;
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.COMPUTE;
    }

    @Override
    protected void execute(ProbeContext context, StepTimer timer) {
        ComputeProvider compute = context.getSession().compute();
        ScrapeDeadline deadline = context.getDeadline();

        KeyPairHandle keyPair = compute.createKeyPair(naming.createName());
        timer.step("create_keypair");

        ResourceName instanceName = naming.createName();
        String instanceId = compute.launchInstance(instanceName, InstanceSpec.builder()
                .flavor(config.getFlavor())
                .image(config.getImage())
                .internalNetwork(config.getInternalNetwork())
                .keyName(keyPair.getKeyName())
                .build());
        timer.step("create_instance");

        InstanceStatus running = poller.await("instance " + instanceId + " running", deadline, () -> {
            InstanceStatus status = compute.describeInstance(instanceId);
            if (status.getState().isGone()) {
                throw new ProviderException("instance " + instanceId + " went to " + status.getState() + " while starting");
            }
            return status.getState() == InstanceStatus.State.RUNNING ? Optional.of(status) : Optional.empty();
        });
        timer.step("instance_running");
        log.debug("Instance {} ({}) running at {}", instanceId, instanceName, running.getPrivateIp());

        AddressHandle address = compute.allocateAddress(naming.createName(), config.getExternalNetwork());
        timer.step("allocate_address");
        compute.associateAddress(address, instanceId);
        timer.step("associate_address");

        try (RemoteShellSession shell = connect(address.getPublicIp(), keyPair, deadline)) {
            timer.step("ssh_connected");
            String expected = instanceName.value();
            CommandResult result = shell.execute("echo " + expected, capped(deadline.remaining()));
            if (!result.isSuccess() || !expected.equals(result.getOutput().trim())) {
                throw new RemoteShellException("unexpected command result on " + instanceId
                        + ": exit status " + result.getExitStatus() + ", output '" + result.getOutput().trim() + "'");
            }
        }
        timer.step("ssh_command");

        compute.releaseAddress(address);
        timer.step("release_address");
        compute.terminateInstance(instanceId);
        timer.step("delete_instance");
        compute.deleteKeyPair(keyPair.getKeyName());
        timer.step("delete_keypair");
    }

    /**
     * sshd comes up some time after the instance reports running, so refused
     * connections are retried until the deadline. Authentication rejections are
     * retried only a few times, while cloud-init installs the key. The last
     * connection error is reported rather than a bare timeout.
     */
    private RemoteShellSession connect(String host, KeyPairHandle keyPair, ScrapeDeadline deadline) {
        AtomicReference<RemoteShellException> lastFailure = new AtomicReference<>();
        AtomicInteger authFailures = new AtomicInteger();
        try {
            return poller.await("ssh to " + host, deadline, () -> {
                try {
                    return Optional.of(remoteShell.connect(host, config.getSshPort(), config.getUser(),
                            keyPair.getPrivateKeyPem(), capped(deadline.remaining())));
                } catch (RemoteShellAuthenticationException e) {
                    if (authFailures.incrementAndGet() >= AUTH_FAILURE_LIMIT) {
                        throw e;
                    }
                    log.debug("SSH to {} rejected our key, retrying: {}", host, e.getMessage());
                    lastFailure.set(e);
                    return Optional.empty();
                } catch (RemoteShellException e) {
                    log.debug("SSH to {} not ready yet: {}", host, e.getMessage());
                    lastFailure.set(e);
                    return Optional.empty();
                }
            });
        } catch (ProbeTimeoutException e) {
            RemoteShellException failure = lastFailure.get();
            if (failure != null) {
                throw failure;
            }
            throw e;
        }
    }

    private static Duration capped(Duration remaining) {
        return remaining.compareTo(SSH_ATTEMPT_TIMEOUT) < 0 ? remaining : SSH_ATTEMPT_TIMEOUT;
    }
}
