package com.xammer.probe.service.provider.aws;

import com.xammer.probe.domain.ResourceName;
import com.xammer.probe.service.provider.ObjectStoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;

import java.util.List;
import java.util.stream.Collectors;

class AwsObjectStoreProvider implements ObjectStoreProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsObjectStoreProvider.class);

    private final S3Client s3;
    private final Region region;
    private final AwsRequestGuard guard;

    AwsObjectStoreProvider(S3Client s3, Region region, AwsRequestGuard guard) {
        this.s3 = s3;
        this.region = region;
        this.guard = guard;
    }

    @Override
    public String createContainer(ResourceName name) {
        String bucket = name.value();
        CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucket);
        if (!Region.US_EAST_1.equals(region)) {
            request.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region.id())
                    .build());
        }
        guard.run("create bucket " + bucket, o -> s3.createBucket(request.overrideConfiguration(o).build()));
        guard.run("tag bucket " + bucket, o -> s3.putBucketTagging(b -> b
                .bucket(bucket)
                .tagging(Tagging.builder().tagSet(
                        Tag.builder().key(AwsTags.NAME_KEY).value(bucket).build(),
                        Tag.builder().key(AwsTags.CREATED_BY_KEY).value(ResourceName.TAG).build()).build())
                .overrideConfiguration(o)));
        return bucket;
    }

    @Override
    public void putObject(String container, String key, byte[] payload) {
        guard.run("upload " + container + "/" + key, o -> s3.putObject(PutObjectRequest.builder()
                        .bucket(container)
                        .key(key)
                        .contentLength((long) payload.length)
                        .overrideConfiguration(o)
                        .build(),
                RequestBody.fromBytes(payload)));
    }

    @Override
    public byte[] getObject(String container, String key) {
        return guard.call("download " + container + "/" + key, o -> s3.getObjectAsBytes(GetObjectRequest.builder()
                .bucket(container)
                .key(key)
                .overrideConfiguration(o)
                .build())).asByteArray();
    }

    @Override
    public void deleteObject(String container, String key) {
        guard.run("delete object " + container + "/" + key,
                o -> s3.deleteObject(b -> b.bucket(container).key(key).overrideConfiguration(o)));
    }

    @Override
    public void deleteContainer(String container) {
        guard.run("delete bucket " + container,
                o -> s3.deleteBucket(b -> b.bucket(container).overrideConfiguration(o)));
    }

    /** Deletes every object left in the bucket, then the bucket itself. */
    void purgeContainer(String container) {
        List<String> keys = guard.call("list objects " + container, o -> s3.listObjectsV2Paginator(b -> b
                        .bucket(container)
                        .overrideConfiguration(o))
                .contents().stream()
                .map(S3Object::key)
                .collect(Collectors.toList()));
        for (String key : keys) {
            deleteObject(container, key);
        }
        if (!keys.isEmpty()) {
            logger.debug("Removed {} leftover objects from bucket {}", keys.size(), container);
        }
        deleteContainer(container);
    }
}
