package com.xammer.probe.config;

import com.xammer.probe.service.provider.CloudSessionFactory;
import com.xammer.probe.service.provider.aws.AwsCloudSessionFactory;
import com.xammer.probe.service.shell.JschRemoteShell;
import com.xammer.probe.service.shell.RemoteShell;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;

@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String region;

    @Bean
    public CloudSessionFactory cloudSessionFactory() {
        return new AwsCloudSessionFactory(Region.of(region));
    }

    @Bean
    public RemoteShell remoteShell() {
        return new JschRemoteShell();
    }
}
