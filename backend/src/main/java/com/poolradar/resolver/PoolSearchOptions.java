package com.poolradar.resolver;

import com.poolradar.domain.FeeTier;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Post-hoc filters and result limit for {@link PoolResolver#searchPools}.
 *
 * @param limit maximum results; the configured default when null or not positive
 */
@Builder
public record PoolSearchOptions(List<FeeTier> feeTiers, BigDecimal minTvlUsd, BigDecimal minVolumeUsd, Integer limit) {

    public PoolSearchOptions {
        feeTiers = feeTiers != null ? List.copyOf(feeTiers) : List.of();
    }

    public static PoolSearchOptions none() {
        return PoolSearchOptions.builder().build();
    }
}
