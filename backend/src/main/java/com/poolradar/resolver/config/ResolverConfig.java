package com.poolradar.resolver.config;

import com.poolradar.cache.PoolCache;
import com.poolradar.common.RateLimiter;
import com.poolradar.common.RetryExecutor;
import com.poolradar.common.RetryPolicy;
import com.poolradar.config.AsyncConfig;
import com.poolradar.resolver.PoolResolver;
import com.poolradar.source.chain.ChainPoolSource;
import com.poolradar.source.config.IndexedServiceProperties;
import com.poolradar.source.config.ResolverRetryProperties;
import com.poolradar.source.indexed.IndexedPoolService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Resolver module configuration: indexed-service rate limiter, retry executor and the PoolResolver.
 */
@Configuration
@EnableConfigurationProperties(ResolverProperties.class)
public class ResolverConfig {

    @Bean
    public RateLimiter indexedServiceRateLimiter(IndexedServiceProperties properties) {
        return new RateLimiter(properties.getRateLimitPerSecond(), properties.getRateLimitWindowMs());
    }

    @Bean
    public RetryExecutor indexedServiceRetryExecutor(ResolverRetryProperties retryProperties) {
        return new RetryExecutor(new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxRetries()));
    }

    @Bean
    public PoolResolver poolResolver(PoolCache poolCache, IndexedPoolService indexedPoolService,
                                     ObjectProvider<ChainPoolSource> chainPoolSource,
                                     RateLimiter indexedServiceRateLimiter, RetryExecutor indexedServiceRetryExecutor,
                                     ResolverProperties properties,
                                     @Qualifier(AsyncConfig.POOL_BATCH_EXECUTOR) Executor batchExecutor,
                                     Clock clock) {
        return new PoolResolver(poolCache, indexedPoolService, chainPoolSource.getIfAvailable(),
                indexedServiceRateLimiter, indexedServiceRetryExecutor, properties, batchExecutor, clock);
    }
}
