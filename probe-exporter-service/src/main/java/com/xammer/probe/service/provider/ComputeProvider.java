package com.xammer.probe.service.provider;

import com.xammer.probe.domain.ResourceName;

/**
 * Compute operations used by the compute probe. Implementations throw
 * {@link com.xammer.probe.exception.ProviderException} when the backend rejects
 * a call and {@link com.xammer.probe.exception.ProbeTimeoutException} when the
 * session deadline cuts it short.
 */
public interface ComputeProvider {

    KeyPairHandle createKeyPair(ResourceName name);

    /** @return the provider id of the new instance */
    String launchInstance(ResourceName name, InstanceSpec spec);

    InstanceStatus describeInstance(String instanceId);

    AddressHandle allocateAddress(ResourceName name, String externalNetwork);

    void associateAddress(AddressHandle address, String instanceId);

    /** Disassociates the address if needed, then releases it. */
    void releaseAddress(AddressHandle address);

    void terminateInstance(String instanceId);

    void deleteKeyPair(String keyName);
}
