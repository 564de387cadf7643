package com.xammer.probe.service.provider.aws;

import com.xammer.probe.exception.ConfigurationException;
import com.xammer.probe.exception.ProviderException;
import com.xammer.probe.service.probe.ScrapeDeadline;
import com.xammer.probe.service.provider.CloudSession;
import com.xammer.probe.service.provider.CloudSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * Opens AWS sessions from the default credentials chain (environment
 * variables first). Credentials are resolved again for every session.
 */
public class AwsCloudSessionFactory implements CloudSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(AwsCloudSessionFactory.class);

    private final Region region;

    public AwsCloudSessionFactory(Region region) {
        this.region = region;
        logger.info("AwsCloudSessionFactory initialized for region {}", region);
    }

    @Override
    public CloudSession openSession(ScrapeDeadline deadline) {
        AwsRequestGuard guard = new AwsRequestGuard(deadline);
        DefaultCredentialsProvider credentials = DefaultCredentialsProvider.builder().build();
        String identity;
        try (StsClient sts = StsClient.builder()
                .region(region)
                .credentialsProvider(credentials)
                .build()) {
            identity = guard.call("authenticate", o -> sts.getCallerIdentity(b -> b.overrideConfiguration(o))).arn();
        } catch (ProviderException e) {
            credentials.close();
            throw new ConfigurationException("authentication failure: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            credentials.close();
            throw e;
        }
        logger.debug("Authenticated as {}", identity);

        Ec2Client ec2 = Ec2Client.builder()
                .region(region)
                .credentialsProvider(credentials)
                .build();
        S3Client s3 = S3Client.builder()
                .region(region)
                .credentialsProvider(credentials)
                .build();
        return new AwsCloudSession(identity, region, ec2, s3, credentials, guard);
    }
}
