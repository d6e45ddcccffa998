package com.clusterscope.cloud.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Value("${clusterscope.executor.resolution.core-pool-size:2}")
    private int corePoolSize;

    @Value("${clusterscope.executor.resolution.max-pool-size:4}")
    private int maxPoolSize;

    /**
     * Runs whole resolution pipelines. Must stay separate from the fetch pool: a run blocks on its fetches.
     */
    @Bean(name = "resolutionTaskExecutor")
    public Executor resolutionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("Resolution-");
        executor.initialize();
        return executor;
    }
}
