package com.poolradar.resolver;

import com.poolradar.cache.MutableClock;
import com.poolradar.cache.PoolCache;
import com.poolradar.cache.PoolCacheKey;
import com.poolradar.cache.PoolCacheSnapshotStore;
import com.poolradar.cache.config.PoolCacheProperties;
import com.poolradar.common.RateLimiter;
import com.poolradar.common.RetryExecutor;
import com.poolradar.common.RetryPolicy;
import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolFixtures;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.PoolSource;
import com.poolradar.resolver.config.ResolverProperties;
import com.poolradar.source.UpstreamException;
import com.poolradar.source.UpstreamTimeoutException;
import com.poolradar.source.chain.ChainPoolSource;
import com.poolradar.source.indexed.IndexedPoolService;
import com.poolradar.source.indexed.OrderDirection;
import com.poolradar.source.indexed.PoolOrderBy;
import com.poolradar.source.indexed.PoolQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.poolradar.domain.PoolFixtures.DAI_WETH_POOL;
import static com.poolradar.domain.PoolFixtures.USDC;
import static com.poolradar.domain.PoolFixtures.USDC_WETH_POOL;
import static com.poolradar.domain.PoolFixtures.WETH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PoolResolverTest {

    private IndexedPoolService indexed;
    private ChainPoolSource chain;
    private PoolCache cache;
    private RateLimiter rateLimiter;
    private ResolverProperties properties;
    private MutableClock clock;
    private PoolResolver resolver;

    @BeforeEach
    void setUp() {
        indexed = mock(IndexedPoolService.class);
        chain = mock(ChainPoolSource.class);
        when(indexed.supports(anyInt())).thenReturn(true);
        when(chain.supports(anyInt())).thenReturn(true);
        clock = new MutableClock(1_700_000_000_000L);
        cache = new PoolCache(new PoolCacheProperties(), PoolCacheSnapshotStore.NONE, clock);
        rateLimiter = new RateLimiter(100, 60_000);
        properties = new ResolverProperties();
        resolver = newResolver(Runnable::run);
    }

    private PoolResolver newResolver(java.util.concurrent.Executor executor) {
        return new PoolResolver(cache, indexed, chain, rateLimiter, new RetryExecutor(new RetryPolicy(0, 0, 2)),
                properties, executor, clock);
    }

    @Test
    @DisplayName("indexed service failing every attempt falls back to chain, then the next lookup is a cache hit")
    void fallbackChainThenCache() {
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenThrow(new UpstreamException("subgraph down"));
        when(chain.getPoolOnChainByAddress(USDC_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));

        PoolResult<PoolRecord> first = resolver.getPool(USDC_WETH_POOL, 1);

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getSource()).isEqualTo(PoolSource.CHAIN);
        assertThat(first.getData()).contains(PoolFixtures.usdcWeth());
        verify(indexed, times(3)).getPool(USDC_WETH_POOL, 1);
        assertThat(rateLimiter.inWindow()).isEqualTo(3);

        PoolResult<PoolRecord> second = resolver.getPool(USDC_WETH_POOL, 1);

        assertThat(second.getSource()).isEqualTo(PoolSource.CACHE);
        assertThat(second.getData()).contains(PoolFixtures.usdcWeth());
        verify(indexed, times(3)).getPool(anyString(), anyInt());
        verify(chain, times(1)).getPoolOnChainByAddress(anyString(), anyInt());
    }

    @Test
    @DisplayName("all real sources failing yields a synthetic placeholder that is not cached")
    void syntheticNotCached() {
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenThrow(new UpstreamException("subgraph down"));
        when(chain.getPoolOnChainByAddress(USDC_WETH_POOL, 1)).thenThrow(new UpstreamException("rpc down"));

        PoolResult<PoolRecord> result = resolver.getPool(USDC_WETH_POOL, 1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isSynthetic()).isTrue();
        assertThat(result.getSource()).isEqualTo(PoolSource.SYNTHETIC);
        assertThat(result.getError()).contains("subgraph down").contains("rpc down");
        assertThat(result.getData()).map(PoolRecord::address).contains(USDC_WETH_POOL);
        assertThat(cache.has(PoolCacheKey.forAddress(1, USDC_WETH_POOL))).isFalse();

        resolver.getPool(USDC_WETH_POOL, 1);
        verify(indexed, times(6)).getPool(USDC_WETH_POOL, 1);
    }

    @Test
    void syntheticPairLookupIsNotCached() {
        when(indexed.getPoolByTokens(USDC, WETH, FeeTier.MEDIUM, 137)).thenThrow(new UpstreamException("subgraph down"));
        when(chain.getPoolOnChain(USDC, WETH, FeeTier.MEDIUM, 137)).thenThrow(new UpstreamException("rpc down"));

        PoolResult<PoolRecord> result = resolver.getPoolByTokens(WETH, USDC, FeeTier.MEDIUM, 137);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSource()).isEqualTo(PoolSource.SYNTHETIC);
        assertThat(result.getData()).hasValueSatisfying(pool -> {
            assertThat(pool.chainId()).isEqualTo(137);
            assertThat(pool.feeTier()).isEqualTo(FeeTier.MEDIUM);
            assertThat(pool.tokenA().address()).isEqualTo(USDC);
            assertThat(pool.tokenB().address()).isEqualTo(WETH);
        });
        assertThat(cache.has(PoolCacheKey.forPair(137, USDC, WETH, FeeTier.MEDIUM))).isFalse();
        assertThat(cache.size()).isZero();
    }

    @Test
    void syntheticDisabledReportsUpstreamError() {
        properties.setSyntheticFallbackEnabled(false);
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenThrow(new UpstreamException("subgraph down"));
        when(chain.getPoolOnChainByAddress(USDC_WETH_POOL, 1)).thenThrow(new UpstreamException("rpc down"));

        PoolResult<PoolRecord> result = resolver.getPool(USDC_WETH_POOL, 1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.UPSTREAM_ERROR);
        assertThat(result.getSource()).isEqualTo(PoolSource.CHAIN);
        assertThat(result.getData()).isEmpty();
    }

    @Test
    void timeoutWithoutChainFallbackReportsUpstreamTimeout() {
        properties.setSyntheticFallbackEnabled(false);
        when(chain.supports(anyInt())).thenReturn(false);
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenThrow(new UpstreamTimeoutException("slow", null));

        PoolResult<PoolRecord> result = resolver.getPool(USDC_WETH_POOL, 1);

        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.UPSTREAM_TIMEOUT);
        verify(chain, never()).getPoolOnChainByAddress(anyString(), anyInt());
    }

    @Test
    void noSourceForChainIsUnavailable() {
        properties.setSyntheticFallbackEnabled(false);
        when(indexed.supports(anyInt())).thenReturn(false);
        when(chain.supports(anyInt())).thenReturn(false);

        PoolResult<PoolRecord> result = resolver.getPool(USDC_WETH_POOL, 56);

        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.UNAVAILABLE);
        assertThat(result.getError()).contains("No pool source available for chain 56");
    }

    @Test
    @DisplayName("definitive not-found from the sources is NOT_FOUND, never a placeholder")
    void notFoundIsNotSynthetic() {
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenReturn(Optional.empty());
        when(chain.getPoolOnChainByAddress(USDC_WETH_POOL, 1)).thenReturn(Optional.empty());

        PoolResult<PoolRecord> result = resolver.getPool(USDC_WETH_POOL, 1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isSynthetic()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.NOT_FOUND);
        verify(indexed, times(1)).getPool(USDC_WETH_POOL, 1);
    }

    @Test
    void indexedNotFoundStillConsultsChain() {
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenReturn(Optional.empty());
        when(chain.getPoolOnChainByAddress(USDC_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));

        assertThat(resolver.getPool(USDC_WETH_POOL, 1).getSource()).isEqualTo(PoolSource.CHAIN);
    }

    @Test
    @DisplayName("indexed answer is cached under both keys: a pair lookup after an address lookup hits the cache")
    void indexedSuccessCachedUnderBothKeys() {
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));

        PoolResult<PoolRecord> byAddress = resolver.getPool(USDC_WETH_POOL.toUpperCase().replace("0X", "0x"), 1);
        PoolResult<PoolRecord> byPair = resolver.getPoolByTokens(WETH, USDC, FeeTier.LOW, 1);

        assertThat(byAddress.getSource()).isEqualTo(PoolSource.INDEXED_SERVICE);
        assertThat(byPair.getSource()).isEqualTo(PoolSource.CACHE);
        assertThat(byAddress.getTimestampMs()).isEqualTo(clock.millis());
        verify(indexed, never()).getPoolByTokens(anyString(), anyString(), any(), anyInt());
        verifyNoInteractions(chain);
    }

    @Test
    void tokenOrderIsCanonicalizedBeforeLookup() {
        when(indexed.getPoolByTokens(USDC, WETH, FeeTier.LOW, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));

        PoolResult<PoolRecord> result = resolver.getPoolByTokens(WETH.toUpperCase().replace("0X", "0x"), USDC, FeeTier.LOW, 1);

        assertThat(result.isSuccess()).isTrue();
        verify(indexed).getPoolByTokens(USDC, WETH, FeeTier.LOW, 1);
        assertThat(resolver.getPoolByTokens(USDC, WETH, FeeTier.LOW, 1).getSource()).isEqualTo(PoolSource.CACHE);
    }

    @Test
    void invalidInputIsRejectedWithoutUpstreamCalls() {
        assertThat(resolver.getPool("0x123", 1).getErrorCode()).isEqualTo(PoolErrorCode.INVALID_REQUEST);
        assertThat(resolver.getPool(USDC_WETH_POOL, 999).getErrorCode()).isEqualTo(PoolErrorCode.INVALID_REQUEST);
        assertThat(resolver.getPoolByTokens(USDC, USDC.toUpperCase().replace("0X", "0x"), FeeTier.LOW, 1).getErrorCode())
                .isEqualTo(PoolErrorCode.INVALID_REQUEST);
        assertThat(resolver.getPoolByTokens(USDC, WETH, null, 1).getErrorCode()).isEqualTo(PoolErrorCode.INVALID_REQUEST);
        verify(indexed, never()).getPool(anyString(), anyInt());
        verify(indexed, never()).getPoolByTokens(anyString(), anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("batch with a failing element still succeeds with the resolved pools and reports the failure")
    void batchPartialFailure() {
        cache.put(PoolFixtures.daiWeth(), PoolSource.INDEXED_SERVICE);
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));

        PoolResult<List<PoolRecord>> result = resolver.batchGetPools(List.of(
                PoolLookupRequest.byAddress(DAI_WETH_POOL, 1),
                PoolLookupRequest.byAddress(USDC_WETH_POOL, 1),
                PoolLookupRequest.byAddress("0xnot-an-address", 1)));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).hasValueSatisfying(pools ->
                assertThat(pools).extracting(PoolRecord::address).containsExactly(DAI_WETH_POOL, USDC_WETH_POOL));
        assertThat(result.getError()).contains("0xnot-an-address@1").contains("Invalid pool address");
        assertThat(result.getSource()).isEqualTo(PoolSource.INDEXED_SERVICE);
    }

    @Test
    void batchExcludesSyntheticPlaceholders() {
        when(indexed.getPool(anyString(), anyInt())).thenThrow(new UpstreamException("down"));
        when(chain.getPoolOnChainByAddress(anyString(), anyInt())).thenThrow(new UpstreamException("down"));

        PoolResult<List<PoolRecord>> result = resolver.batchGetPools(List.of(PoolLookupRequest.byAddress(USDC_WETH_POOL, 1)));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("synthetic placeholder");
        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.UNAVAILABLE);
    }

    @Test
    void emptyBatchSucceeds() {
        PoolResult<List<PoolRecord>> result = resolver.batchGetPools(List.of());
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).contains(List.of());
    }

    @Test
    void batchResolvesOnExecutor() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            PoolResolver concurrent = newResolver(pool);
            when(indexed.getPool(USDC_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));
            when(indexed.getPool(DAI_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.daiWeth()));
            when(indexed.getPoolByTokens(USDC, WETH, FeeTier.LOW, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));

            PoolResult<List<PoolRecord>> result = concurrent.batchGetPools(List.of(
                    PoolLookupRequest.byAddress(USDC_WETH_POOL, 1),
                    PoolLookupRequest.byAddress(DAI_WETH_POOL, 1),
                    PoolLookupRequest.byTokens(WETH, USDC, FeeTier.LOW, 1)));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getError()).isNull();
            assertThat(result.getData()).hasValueSatisfying(pools -> assertThat(pools).hasSize(3));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("concurrent misses for the same pool share one upstream call")
    void concurrentMissesShareOneResolution() throws Exception {
        CountDownLatch inCall = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenAnswer(inv -> {
            inCall.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(PoolFixtures.usdcWeth());
        });
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<PoolResult<PoolRecord>> first = pool.submit(() -> resolver.getPool(USDC_WETH_POOL, 1));
            assertThat(inCall.await(5, TimeUnit.SECONDS)).isTrue();
            Future<PoolResult<PoolRecord>> second = pool.submit(() -> resolver.getPool(USDC_WETH_POOL, 1));
            Thread.sleep(200);
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).getSource()).isEqualTo(PoolSource.INDEXED_SERVICE);
            assertThat(second.get(5, TimeUnit.SECONDS).getSource()).isEqualTo(PoolSource.INDEXED_SERVICE);
            verify(indexed, times(1)).getPool(USDC_WETH_POOL, 1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void getPoolsCachesEveryResult() {
        when(indexed.getPools(eq(1), any())).thenReturn(List.of(PoolFixtures.usdcWeth(), PoolFixtures.daiWeth()));

        PoolResult<List<PoolRecord>> result = resolver.getPools(1, PoolQuery.builder().tokens(List.of(WETH)).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSource()).isEqualTo(PoolSource.INDEXED_SERVICE);
        assertThat(cache.has(PoolCacheKey.forAddress(1, USDC_WETH_POOL))).isTrue();
        assertThat(cache.has(PoolCacheKey.forPair(PoolFixtures.daiWeth()))).isTrue();
    }

    @Test
    void getPoolsRejectsMalformedTokenFilter() {
        PoolResult<List<PoolRecord>> result = resolver.getPools(1, PoolQuery.builder().token0("weth").build());
        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.INVALID_REQUEST);
        verify(indexed, never()).getPools(anyInt(), any());
    }

    @Test
    void getPoolsFailureIsReported() {
        when(indexed.getPools(eq(1), any())).thenThrow(new UpstreamTimeoutException("slow", null));
        PoolResult<List<PoolRecord>> result = resolver.getPools(1, null);
        assertThat(result.getErrorCode()).isEqualTo(PoolErrorCode.UPSTREAM_TIMEOUT);
        verify(indexed, times(3)).getPools(eq(1), any());
    }

    @Test
    void topPoolsQueryTvlDescendingAboveFloor() {
        when(indexed.getPools(eq(1), any())).thenReturn(List.of(PoolFixtures.usdcWeth()));

        resolver.getTopPools(1, 5);

        ArgumentCaptor<PoolQuery> captor = ArgumentCaptor.forClass(PoolQuery.class);
        verify(indexed).getPools(eq(1), captor.capture());
        PoolQuery query = captor.getValue();
        assertThat(query.first()).isEqualTo(5);
        assertThat(query.minTvlUsd()).isEqualByComparingTo("1000");
        assertThat(query.orderBy()).isEqualTo(PoolOrderBy.TOTAL_VALUE_LOCKED_USD);
        assertThat(query.orderDirection()).isEqualTo(OrderDirection.DESC);
    }

    @Test
    @DisplayName("symbol search matches either token over the top pools, then applies filters and limit")
    void searchBySymbol() {
        when(indexed.getPools(eq(1), any())).thenReturn(List.of(PoolFixtures.usdcWeth(), PoolFixtures.daiWeth()));

        PoolResult<List<PoolRecord>> dai = resolver.searchPools("dai", 1, null);
        PoolResult<List<PoolRecord>> weth = resolver.searchPools("WETH", 1,
                PoolSearchOptions.builder().minTvlUsd(new BigDecimal("1000")).build());
        PoolResult<List<PoolRecord>> limited = resolver.searchPools("weth", 1, PoolSearchOptions.builder().limit(1).build());

        assertThat(dai.getData()).hasValueSatisfying(p -> assertThat(p).extracting(PoolRecord::address).containsExactly(DAI_WETH_POOL));
        assertThat(weth.getData()).hasValueSatisfying(p -> assertThat(p).extracting(PoolRecord::address).containsExactly(USDC_WETH_POOL));
        assertThat(limited.getData()).hasValueSatisfying(p -> assertThat(p).hasSize(1));

        ArgumentCaptor<PoolQuery> captor = ArgumentCaptor.forClass(PoolQuery.class);
        verify(indexed, times(3)).getPools(eq(1), captor.capture());
        assertThat(captor.getValue().first()).isEqualTo(100);
        assertThat(captor.getValue().tokens()).isEmpty();
    }

    @Test
    void searchByAddressFiltersOnToken() {
        when(indexed.getPools(eq(1), any())).thenReturn(List.of(PoolFixtures.usdcWeth()));

        PoolResult<List<PoolRecord>> result = resolver.searchPools(USDC.toUpperCase().replace("0X", "0x"), 1,
                PoolSearchOptions.builder().feeTiers(List.of(FeeTier.LOW)).build());

        assertThat(result.getData()).hasValueSatisfying(p -> assertThat(p).hasSize(1));
        ArgumentCaptor<PoolQuery> captor = ArgumentCaptor.forClass(PoolQuery.class);
        verify(indexed).getPools(eq(1), captor.capture());
        assertThat(captor.getValue().tokens()).containsExactly(USDC);
    }

    @Test
    void blankSearchIsInvalid() {
        assertThat(resolver.searchPools("  ", 1, null).getErrorCode()).isEqualTo(PoolErrorCode.INVALID_REQUEST);
    }

    @Test
    void clearCacheResetsStats() {
        when(indexed.getPool(USDC_WETH_POOL, 1)).thenReturn(Optional.of(PoolFixtures.usdcWeth()));
        resolver.getPool(USDC_WETH_POOL, 1);
        assertThat(resolver.cacheStats().size()).isEqualTo(1);

        resolver.clearCache();

        assertThat(resolver.cacheStats().size()).isZero();
        assertThat(resolver.cacheStats().misses()).isZero();
    }
}
