package com.poolradar.source.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct-chain fallback: per-chain JSON-RPC endpoints and pool factory, plus a local RPC budget.
 * Documented in application.yml under poolradar.chain.
 */
@ConfigurationProperties(prefix = "poolradar.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainFallbackProperties {

    /** Canonical factory deployment shared by most EVM chains. */
    public static final String DEFAULT_FACTORY_ADDRESS = "0x1f98431c8ad98523631ae4a59f267346ea31f984";

    /** Disable to skip the chain fallback entirely. */
    private boolean enabled = true;

    /** Local budget of eth_call requests per second for this instance. */
    private int maxRequestsPerSecond = 25;

    /** How long a call may wait for a local limiter permit before failing. */
    private long localLimiterTimeoutMs = 2_000;

    /** Per-call timeout. */
    private long requestTimeoutMs = 8_000;

    /**
     * Per-chain entries. Key: chain id. Chains without urls are not served by the fallback.
     */
    private Map<Integer, ChainNetworkEntry> networks = new HashMap<>();

    public void setNetworks(Map<Integer, ChainNetworkEntry> networks) {
        this.networks = networks != null ? networks : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainNetworkEntry {

        private List<String> urls = new ArrayList<>();

        /** Pool factory for this chain; the canonical deployment when unset. */
        private String factoryAddress = DEFAULT_FACTORY_ADDRESS;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
