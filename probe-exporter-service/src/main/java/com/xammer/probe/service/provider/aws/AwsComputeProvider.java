package com.xammer.probe.service.provider.aws;

import com.xammer.probe.domain.ResourceName;
import com.xammer.probe.exception.ProviderException;
import com.xammer.probe.service.provider.AddressHandle;
import com.xammer.probe.service.provider.ComputeProvider;
import com.xammer.probe.service.provider.InstanceSpec;
import com.xammer.probe.service.provider.InstanceStatus;
import com.xammer.probe.service.provider.KeyPairHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.Address;
import software.amazon.awssdk.services.ec2.model.AllocateAddressRequest;
import software.amazon.awssdk.services.ec2.model.AllocateAddressResponse;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DomainType;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Image;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.KeyType;
import software.amazon.awssdk.services.ec2.model.ResourceType;
import software.amazon.awssdk.services.ec2.model.RunInstancesRequest;

import java.util.Comparator;
import java.util.Optional;

class AwsComputeProvider implements ComputeProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsComputeProvider.class);

    private static final String DEFAULT_ADDRESS_POOL = "amazon";

    private final Ec2Client ec2;
    private final AwsRequestGuard guard;

    AwsComputeProvider(Ec2Client ec2, AwsRequestGuard guard) {
        this.ec2 = ec2;
        this.guard = guard;
    }

    @Override
    public KeyPairHandle createKeyPair(ResourceName name) {
        String material = guard.call("create key pair " + name, o -> ec2.createKeyPair(b -> b
                .keyName(name.value())
                .keyType(KeyType.RSA)
                .tagSpecifications(AwsTags.tagSpecification(ResourceType.KEY_PAIR, name))
                .overrideConfiguration(o))).keyMaterial();
        return new KeyPairHandle(name.value(), material);
    }

    @Override
    public String launchInstance(ResourceName name, InstanceSpec spec) {
        String imageId = resolveImageId(spec.getImage());
        RunInstancesRequest.Builder request = RunInstancesRequest.builder()
                .imageId(imageId)
                .instanceType(spec.getFlavor())
                .minCount(1)
                .maxCount(1)
                .keyName(spec.getKeyName())
                .tagSpecifications(AwsTags.tagSpecification(ResourceType.INSTANCE, name));
        if (hasText(spec.getInternalNetwork())) {
            request.subnetId(spec.getInternalNetwork());
        }
        Instance instance = guard.call("launch instance " + name,
                o -> ec2.runInstances(request.overrideConfiguration(o).build()))
                .instances().get(0);
        logger.debug("Launched instance {} ({}) from image {}", instance.instanceId(), name, imageId);
        return instance.instanceId();
    }

    @Override
    public InstanceStatus describeInstance(String instanceId) {
        DescribeInstancesResponse response;
        try {
            response = guard.call("describe instance " + instanceId,
                    o -> ec2.describeInstances(b -> b.instanceIds(instanceId).overrideConfiguration(o)));
        } catch (ProviderException e) {
            // EC2 is eventually consistent: a just-launched instance may not be visible yet.
            if (AwsRequestGuard.hasErrorCode(e, "InvalidInstanceID.NotFound")) {
                return new InstanceStatus(InstanceStatus.State.PENDING, null);
            }
            throw e;
        }
        return response.reservations().stream()
                .flatMap(reservation -> reservation.instances().stream())
                .findFirst()
                .map(instance -> new InstanceStatus(toState(instance), instance.privateIpAddress()))
                .orElse(new InstanceStatus(InstanceStatus.State.PENDING, null));
    }

    @Override
    public AddressHandle allocateAddress(ResourceName name, String externalNetwork) {
        AllocateAddressRequest.Builder request = AllocateAddressRequest.builder()
                .domain(DomainType.VPC)
                .tagSpecifications(AwsTags.tagSpecification(ResourceType.ELASTIC_IP, name));
        if (hasText(externalNetwork) && !DEFAULT_ADDRESS_POOL.equals(externalNetwork)) {
            request.publicIpv4Pool(externalNetwork);
        }
        AllocateAddressResponse response = guard.call("allocate address " + name,
                o -> ec2.allocateAddress(request.overrideConfiguration(o).build()));
        return new AddressHandle(response.allocationId(), response.publicIp());
    }

    @Override
    public void associateAddress(AddressHandle address, String instanceId) {
        guard.run("associate address " + address.getAllocationId(), o -> ec2.associateAddress(b -> b
                .allocationId(address.getAllocationId())
                .instanceId(instanceId)
                .overrideConfiguration(o)));
    }

    @Override
    public void releaseAddress(AddressHandle address) {
        String allocationId = address.getAllocationId();
        Optional<Address> current = guard.call("describe address " + allocationId,
                o -> ec2.describeAddresses(b -> b.allocationIds(allocationId).overrideConfiguration(o)))
                .addresses().stream().findFirst();
        current.map(Address::associationId).filter(AwsComputeProvider::hasText).ifPresent(associationId ->
                guard.run("disassociate address " + allocationId,
                        o -> ec2.disassociateAddress(b -> b.associationId(associationId).overrideConfiguration(o))));
        guard.run("release address " + allocationId,
                o -> ec2.releaseAddress(b -> b.allocationId(allocationId).overrideConfiguration(o)));
    }

    @Override
    public void terminateInstance(String instanceId) {
        guard.run("terminate instance " + instanceId,
                o -> ec2.terminateInstances(b -> b.instanceIds(instanceId).overrideConfiguration(o)));
    }

    @Override
    public void deleteKeyPair(String keyName) {
        guard.run("delete key pair " + keyName,
                o -> ec2.deleteKeyPair(b -> b.keyName(keyName).overrideConfiguration(o)));
    }

    private String resolveImageId(String image) {
        if (image.startsWith("ami-")) {
            return image;
        }
        return guard.call("describe images " + image, o -> ec2.describeImages(b -> b
                        .filters(Filter.builder().name("name").values(image).build(),
                                Filter.builder().name("state").values("available").build())
                        .overrideConfiguration(o)))
                .images().stream()
                .max(Comparator.comparing(Image::creationDate, Comparator.nullsFirst(Comparator.<String>naturalOrder())))
                .map(Image::imageId)
                .orElseThrow(() -> new ProviderException("image not found: " + image));
    }

    private static InstanceStatus.State toState(Instance instance) {
        if (instance.state() == null || instance.state().name() == null) {
            return InstanceStatus.State.UNKNOWN;
        }
        switch (instance.state().name()) {
            case PENDING:
                return InstanceStatus.State.PENDING;
            case RUNNING:
                return InstanceStatus.State.RUNNING;
            case STOPPING:
                return InstanceStatus.State.STOPPING;
            case STOPPED:
                return InstanceStatus.State.STOPPED;
            case SHUTTING_DOWN:
                return InstanceStatus.State.SHUTTING_DOWN;
            case TERMINATED:
                return InstanceStatus.State.TERMINATED;
            default:
                return InstanceStatus.State.UNKNOWN;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
