package com.clusterscope.cloud.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AwsConfig {

    @Value("${clusterscope.executor.aws.core-pool-size:8}")
    private int corePoolSize;

    @Value("${clusterscope.executor.aws.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${clusterscope.executor.aws.queue-capacity:200}")
    private int queueCapacity;

    @Bean("awsTaskExecutor")
    public Executor awsTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("AWS-Async-");
        executor.initialize();
        return executor;
    }
}
