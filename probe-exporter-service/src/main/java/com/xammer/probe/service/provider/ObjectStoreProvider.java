package com.xammer.probe.service.provider;

import com.xammer.probe.domain.ResourceName;

public interface ObjectStoreProvider {

    /** @return the container (bucket) name */
    String createContainer(ResourceName name);

    void putObject(String container, String key, byte[] payload);

    byte[] getObject(String container, String key);

    void deleteObject(String container, String key);

    void deleteContainer(String container);
}
