package com.xammer.probe.config;

import com.xammer.probe.service.probe.ReadinessPoller;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ProbeConfig {

    @Bean
    public ReadinessPoller readinessPoller() {
        // 1s, 2s, 4s, 8s, then every 10s
        return new ReadinessPoller(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
    }
}
