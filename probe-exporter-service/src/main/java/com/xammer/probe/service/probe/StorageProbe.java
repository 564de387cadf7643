package com.xammer.probe.service.probe;

import com.xammer.probe.config.ProbeProperties;
import com.xammer.probe.domain.ProbeKind;
import com.xammer.probe.exception.VerificationException;
import com.xammer.probe.service.ResourceNamingService;
import com.xammer.probe.service.provider.ObjectStoreProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

/** Upload/download round trip through a fresh bucket. */
@Component
public class StorageProbe extends AbstractProbe {

    private final int payloadSize;

    public StorageProbe(ResourceNamingService naming, ReadinessPoller poller, Clock clock, ProbeProperties properties) {
        super(naming, poller, clock);
        this.payloadSize = (int) properties.getStorage().getPayloadSize().toBytes();
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.STORAGE;
    }

    @Override
    protected void execute(ProbeContext context, StepTimer timer) {
        ObjectStoreProvider store = context.getSession().objectStore();

        String container = store.createContainer(naming.createName());
        timer.step("create_container");

        byte[] payload = new byte[payloadSize];
        ThreadLocalRandom.current().nextBytes(payload);
        String key = naming.createName().value();
        store.putObject(container, key, payload);
        timer.step("upload_object");

        byte[] downloaded = store.getObject(container, key);
        timer.step("download_object");
        if (!Arrays.equals(payload, downloaded)) {
            throw new VerificationException("object " + container + "/" + key + " came back altered: uploaded "
                    + payload.length + " bytes, downloaded " + (downloaded == null ? 0 : downloaded.length));
        }
        timer.step("verify_object");

        store.deleteObject(container, key);
        timer.step("delete_object");
        store.deleteContainer(container);
        timer.step("delete_container");
    }
}
