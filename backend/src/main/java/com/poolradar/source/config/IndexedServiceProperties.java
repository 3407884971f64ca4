package com.poolradar.source.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Indexed ledger service (subgraph) endpoints and request limits. Documented in application.yml under poolradar.indexed.
 */
@ConfigurationProperties(prefix = "poolradar.indexed")
@NoArgsConstructor
@Getter
@Setter
public class IndexedServiceProperties {

    /**
     * Map: chain id -> GraphQL endpoint URL. Chains without an entry skip the indexed service.
     */
    private Map<Integer, String> endpoints = new HashMap<>();

    /** Per-request timeout; a timeout counts as a failed attempt and is retried. Default 10s. */
    private long requestTimeoutMs = 10_000;

    /** Outbound queries admitted per rate-limit window. Default 10. */
    private int rateLimitPerSecond = 10;

    /** Rate-limit window. Default 1s. */
    private long rateLimitWindowMs = 1000;

    /** Upper bound on concurrently resolving batch elements. Default 50. */
    private int burstLimit = 50;

    public void setEndpoints(Map<Integer, String> endpoints) {
        this.endpoints = endpoints != null ? endpoints : new HashMap<>();
    }
}
