package com.poolradar.config;

import com.poolradar.source.config.IndexedServiceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: pool-batch-executor fans out batch lookups, at most burstLimit at a time.
 */
@Configuration
public class AsyncConfig {

    public static final String POOL_BATCH_EXECUTOR = "pool-batch-executor";

    @Bean(name = POOL_BATCH_EXECUTOR)
    public Executor poolBatchExecutor(IndexedServiceProperties indexedProperties) {
        int burst = Math.max(1, indexedProperties.getBurstLimit());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(burst);
        e.setMaxPoolSize(burst);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("pool-batch-");
        e.initialize();
        return e;
    }
}
