package com.tradeguard.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for LIVE placement calls. The dispatcher waits on these with a timeout, so a hung venue
 * call occupies a pool thread, never the dispatcher.
 */
@Configuration
public class AsyncConfig {

    @Value("${tradeguard.async.placement.core-pool-size:2}")
    private int corePoolSize;

    @Value("${tradeguard.async.placement.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${tradeguard.async.placement.queue-capacity:16}")
    private int queueCapacity;

    @Bean("placementExecutor")
    public ThreadPoolTaskExecutor placementExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("placement-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
