package com.xammer.probe.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    @Bean(name = "probeTaskExecutor")
    public ThreadPoolTaskExecutor probeTaskExecutor(ProbeProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // One thread per probe kind per concurrent scrape; overlapping scrapes queue up.
        executor.setCorePoolSize(properties.getExecutor().getPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("Probe-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "gcTaskScheduler")
    public ThreadPoolTaskScheduler gcTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ResourceGC-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
