package com.poolradar.source.indexed;

import com.poolradar.domain.FeeTier;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Filter, ordering and pagination for a pools query.
 *
 * @param token0   exact token0 (canonical lower token) match
 * @param token1   exact token1 match
 * @param tokens   pools containing any of these tokens on either side
 * @param feeTier  single fee tier
 * @param feeTiers any of these fee tiers
 */
@Builder(toBuilder = true)
public record PoolQuery(
        String token0,
        String token1,
        List<String> tokens,
        FeeTier feeTier,
        List<FeeTier> feeTiers,
        BigDecimal minTvlUsd,
        BigDecimal minVolumeUsd,
        PoolOrderBy orderBy,
        OrderDirection orderDirection,
        Integer first,
        Integer skip
) {

    public static final int DEFAULT_FIRST = 100;
    public static final int MAX_FIRST = 1000;

    public PoolQuery {
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
        feeTiers = feeTiers != null ? List.copyOf(feeTiers) : List.of();
        orderBy = orderBy != null ? orderBy : PoolOrderBy.TOTAL_VALUE_LOCKED_USD;
        orderDirection = orderDirection != null ? orderDirection : OrderDirection.DESC;
        first = first != null && first > 0 ? Math.min(first, MAX_FIRST) : DEFAULT_FIRST;
        skip = skip != null && skip > 0 ? skip : 0;
    }

    public static PoolQuery defaults() {
        return PoolQuery.builder().build();
    }
}
