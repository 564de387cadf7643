package com.xammer.probe.service.provider.aws;

import com.xammer.probe.service.provider.CloudSession;
import com.xammer.probe.service.provider.ComputeProvider;
import com.xammer.probe.service.provider.ObjectStoreProvider;
import com.xammer.probe.service.provider.ResourceInventory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.s3.S3Client;

class AwsCloudSession implements CloudSession {

    private final String identity;
    private final Ec2Client ec2;
    private final S3Client s3;
    private final DefaultCredentialsProvider credentials;
    private final AwsComputeProvider compute;
    private final AwsObjectStoreProvider objectStore;
    private final AwsResourceInventory inventory;

    AwsCloudSession(String identity, Region region, Ec2Client ec2, S3Client s3,
                    DefaultCredentialsProvider credentials, AwsRequestGuard guard) {
        this.identity = identity;
        this.ec2 = ec2;
        this.s3 = s3;
        this.credentials = credentials;
        this.compute = new AwsComputeProvider(ec2, guard);
        this.objectStore = new AwsObjectStoreProvider(s3, region, guard);
        this.inventory = new AwsResourceInventory(ec2, s3, region, compute, objectStore, guard);
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public ComputeProvider compute() {
        return compute;
    }

    @Override
    public ObjectStoreProvider objectStore() {
        return objectStore;
    }

    @Override
    public ResourceInventory inventory() {
        return inventory;
    }

    @Override
    public void close() {
        ec2.close();
        s3.close();
        credentials.close();
    }
}
