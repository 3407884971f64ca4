package com.poolradar.source.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.source.chain.ChainPoolSource;
import com.poolradar.source.chain.EthCallExecutor;
import com.poolradar.source.chain.EvmChainPoolSource;
import com.poolradar.source.chain.EvmRpcClient;
import com.poolradar.source.chain.RpcEndpointRotator;
import com.poolradar.source.chain.TokenMetadataResolver;
import com.poolradar.source.chain.WebClientEvmRpcClient;
import com.poolradar.source.indexed.GraphQlIndexedPoolService;
import com.poolradar.source.indexed.IndexedPoolService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configures the pool sources: the GraphQL indexed service and, unless poolradar.chain.enabled is false,
 * the eth_call chain fallback with per-chain rotators and a local Resilience4j budget.
 */
@Configuration
@EnableConfigurationProperties({ IndexedServiceProperties.class, ResolverRetryProperties.class, ChainFallbackProperties.class })
@Slf4j
public class PoolSourceConfig {

    @Bean
    public IndexedPoolService indexedPoolService(WebClient.Builder webClientBuilder, IndexedServiceProperties properties,
                                                 ObjectMapper objectMapper) {
        log.info("Indexed service configured for chains {}", properties.getEndpoints().keySet());
        return new GraphQlIndexedPoolService(webClientBuilder, properties, objectMapper);
    }

    /** Chains with at least one url only. */
    @Bean
    @ConditionalOnProperty(prefix = "poolradar.chain", name = "enabled", havingValue = "true", matchIfMissing = true)
    public Map<Integer, RpcEndpointRotator> chainRotatorsByChain(ChainFallbackProperties properties) {
        return properties.getNetworks().entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().getUrls() != null && !e.getValue().getUrls().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey, e -> new RpcEndpointRotator(e.getValue().getUrls())));
    }

    @Bean
    @ConditionalOnProperty(prefix = "poolradar.chain", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "chainRpcRateLimiter")
    @ConditionalOnProperty(prefix = "poolradar.chain", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RateLimiter chainRpcRateLimiter(ChainFallbackProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "poolradar.chain", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EthCallExecutor ethCallExecutor(EvmRpcClient evmRpcClient, Map<Integer, RpcEndpointRotator> chainRotatorsByChain,
                                           RateLimiter chainRpcRateLimiter, ObjectMapper objectMapper,
                                           ChainFallbackProperties properties) {
        return new EthCallExecutor(evmRpcClient, chainRotatorsByChain, chainRpcRateLimiter, objectMapper,
                Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "poolradar.chain", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TokenMetadataResolver tokenMetadataResolver(EthCallExecutor ethCallExecutor, CacheManager cacheManager) {
        return new TokenMetadataResolver(ethCallExecutor, cacheManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "poolradar.chain", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ChainPoolSource chainPoolSource(EthCallExecutor ethCallExecutor, TokenMetadataResolver tokenMetadataResolver,
                                           ChainFallbackProperties properties) {
        Map<Integer, String> factories = properties.getNetworks().entrySet().stream()
                .filter(e -> e.getValue() != null)
                .collect(Collectors.toMap(Map.Entry::getKey, e -> factoryOrDefault(e.getValue().getFactoryAddress())));
        log.info("Chain fallback configured for chains {}", factories.keySet());
        return new EvmChainPoolSource(ethCallExecutor, tokenMetadataResolver, factories);
    }

    private static String factoryOrDefault(String factory) {
        return factory != null && !factory.isBlank() ? factory.strip().toLowerCase() : ChainFallbackProperties.DEFAULT_FACTORY_ADDRESS;
    }
}
