package com.xammer.probe.service.provider;

/**
 * An authenticated connection to the cloud provider. Every call made through
 * it is bounded by the deadline the session was opened with.
 */
public interface CloudSession extends AutoCloseable {

    /** Identity the provider authenticated us as, for logging. */
    String getIdentity();

    ComputeProvider compute();

    ObjectStoreProvider objectStore();

    ResourceInventory inventory();

    @Override
    void close();
}
