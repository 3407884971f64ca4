package com.poolradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.poolradar.source.chain.TokenMetadataResolver;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Pool records live in PoolCache, not here.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String TOKEN_META_CACHE = TokenMetadataResolver.CACHE_NAME;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TOKEN_META_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
