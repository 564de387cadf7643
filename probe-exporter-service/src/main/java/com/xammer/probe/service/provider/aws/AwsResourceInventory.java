package com.xammer.probe.service.provider.aws;

import com.xammer.probe.domain.ResourceKind;
import com.xammer.probe.domain.ResourceName;
import com.xammer.probe.domain.TrackedResource;
import com.xammer.probe.exception.ProviderException;
import com.xammer.probe.service.provider.AddressHandle;
import com.xammer.probe.service.provider.ResourceInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

class AwsResourceInventory implements ResourceInventory {

    private static final Logger logger = LoggerFactory.getLogger(AwsResourceInventory.class);

    private final Ec2Client ec2;
    private final S3Client s3;
    private final Region region;
    private final AwsComputeProvider compute;
    private final AwsObjectStoreProvider objectStore;
    private final AwsRequestGuard guard;

    AwsResourceInventory(Ec2Client ec2, S3Client s3, Region region, AwsComputeProvider compute,
                         AwsObjectStoreProvider objectStore, AwsRequestGuard guard) {
        this.ec2 = ec2;
        this.s3 = s3;
        this.region = region;
        this.compute = compute;
        this.objectStore = objectStore;
        this.guard = guard;
    }

    @Override
    public List<TrackedResource> list(ResourceKind kind) {
        switch (kind) {
            case INSTANCE:
                return listInstances();
            case KEY_PAIR:
                return listKeyPairs();
            case ADDRESS:
                return listAddresses();
            case BUCKET:
                return listBuckets();
            default:
                throw new IllegalArgumentException("Unsupported resource kind: " + kind);
        }
    }

    @Override
    public void delete(TrackedResource resource) {
        switch (resource.getKind()) {
            case INSTANCE:
                compute.terminateInstance(resource.getId());
                break;
            case KEY_PAIR:
                compute.deleteKeyPair(resource.getId());
                break;
            case ADDRESS:
                compute.releaseAddress(new AddressHandle(resource.getId(), null));
                break;
            case BUCKET:
                objectStore.purgeContainer(resource.getId());
                break;
            default:
                throw new IllegalArgumentException("Unsupported resource kind: " + resource.getKind());
        }
    }

    private List<TrackedResource> listInstances() {
        // Terminated instances linger in listings for a while but are already gone.
        Filter liveStates = Filter.builder().name("instance-state-name").values(
                InstanceStateName.PENDING.toString(), InstanceStateName.RUNNING.toString(),
                InstanceStateName.STOPPING.toString(), InstanceStateName.STOPPED.toString()).build();
        return guard.call("list instances", o -> ec2.describeInstancesPaginator(b -> b
                        .filters(AwsTags.nameTagFilter(), liveStates)
                        .overrideConfiguration(o))
                .reservations().stream()
                .flatMap(reservation -> reservation.instances().stream())
                .map(instance -> track(ResourceKind.INSTANCE, instance.instanceId(), AwsTags.nameOf(instance.tags())))
                .flatMap(Optional::stream)
                .collect(Collectors.toList()));
    }

    private List<TrackedResource> listKeyPairs() {
        return guard.call("list key pairs", o -> ec2.describeKeyPairs(b -> b
                        .filters(Filter.builder().name("key-name").values(ResourceName.TAG + "-*").build())
                        .overrideConfiguration(o)))
                .keyPairs().stream()
                .map(keyPair -> track(ResourceKind.KEY_PAIR, keyPair.keyName(), keyPair.keyName()))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    private List<TrackedResource> listAddresses() {
        return guard.call("list addresses", o -> ec2.describeAddresses(b -> b
                        .filters(AwsTags.nameTagFilter())
                        .overrideConfiguration(o)))
                .addresses().stream()
                .map(address -> track(ResourceKind.ADDRESS, address.allocationId(), AwsTags.nameOf(address.tags())))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    /**
     * ListBuckets spans every region, but the S3 client deletes through one.
     * Buckets of ours located elsewhere are left to an exporter running there.
     */
    private List<TrackedResource> listBuckets() {
        return guard.call("list buckets", o -> s3.listBuckets(b -> b.overrideConfiguration(o)))
                .buckets().stream()
                .map(Bucket::name)
                .map(bucket -> track(ResourceKind.BUCKET, bucket, bucket))
                .flatMap(Optional::stream)
                .filter(this::isInRegion)
                .collect(Collectors.toList());
    }

    private boolean isInRegion(TrackedResource bucket) {
        String location;
        try {
            location = guard.call("locate bucket " + bucket.getId(), o -> s3.getBucketLocation(b -> b
                    .bucket(bucket.getId())
                    .overrideConfiguration(o))).locationConstraintAsString();
        } catch (ProviderException e) {
            // Typically a bucket deleted between the two calls; the next sweep lists again.
            logger.warn("Skipping bucket {}: {}", bucket.getId(), e.getMessage());
            return false;
        }
        return region.id().equals(toRegionId(location));
    }

    static String toRegionId(String locationConstraint) {
        if (locationConstraint == null || locationConstraint.isEmpty()) {
            return Region.US_EAST_1.id();
        }
        // Legacy constraint still returned for old eu-west-1 buckets.
        if ("EU".equals(locationConstraint)) {
            return Region.EU_WEST_1.id();
        }
        return locationConstraint;
    }

    private static Optional<TrackedResource> track(ResourceKind kind, String id, String name) {
        return ResourceName.parse(name).map(parsed -> new TrackedResource(kind, id, parsed));
    }
}
