package com.poolradar.resolver.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Resolver behaviour: synthetic fallback and search sizing.
 */
@ConfigurationProperties(prefix = "poolradar.resolver")
@NoArgsConstructor
@Getter
@Setter
public class ResolverProperties {

    /** Return a synthetic placeholder when every real source failed. Default true. */
    private boolean syntheticFallbackEnabled = true;

    /** Pools (by TVL) scanned for a symbol search. Default 100. */
    private int searchTopN = 100;

    /** Results returned by a search when no limit is given. Default 20. */
    private int defaultSearchLimit = 20;

    /** Minimum TVL in USD for the top-pools listing. Default 1000. */
    private BigDecimal topPoolsMinTvlUsd = new BigDecimal("1000");
}
