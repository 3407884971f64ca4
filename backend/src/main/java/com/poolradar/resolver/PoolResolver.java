package com.poolradar.resolver;

import com.poolradar.cache.CacheEntry;
import com.poolradar.cache.CacheStats;
import com.poolradar.cache.PoolCache;
import com.poolradar.cache.PoolCacheKey;
import com.poolradar.common.RateLimiter;
import com.poolradar.common.RetryExecutor;
import com.poolradar.common.SingleFlight;
import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.PoolSource;
import com.poolradar.domain.SupportedChain;
import com.poolradar.resolver.config.ResolverProperties;
import com.poolradar.source.UpstreamTimeoutException;
import com.poolradar.source.chain.ChainPoolSource;
import com.poolradar.source.indexed.IndexedPoolService;
import com.poolradar.source.indexed.OrderDirection;
import com.poolradar.source.indexed.PoolOrderBy;
import com.poolradar.source.indexed.PoolQuery;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves pool state: cache, then the indexed service (rate limited, retried), then the direct-chain
 * fallback, then an optional synthetic placeholder. Real answers are written back to the cache; synthetic
 * ones never are. Concurrent misses for the same cache key share one resolution.
 * <p>
 * Public methods never throw. Every outcome is a {@link PoolResult} with provenance and latency.
 */
@Slf4j
public class PoolResolver {

    static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    static final int DEFAULT_TOP_POOLS = 10;

    private final PoolCache cache;
    private final IndexedPoolService indexedService;
    private final ChainPoolSource chainSource;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ResolverProperties properties;
    private final Executor batchExecutor;
    private final Clock clock;
    private final SingleFlight<String, PoolResult<PoolRecord>> singleFlight = new SingleFlight<>();

    /**
     * @param chainSource direct-chain fallback; null when disabled
     */
    public PoolResolver(PoolCache cache, IndexedPoolService indexedService, ChainPoolSource chainSource,
                        RateLimiter rateLimiter, RetryExecutor retryExecutor, ResolverProperties properties,
                        Executor batchExecutor, Clock clock) {
        this.cache = cache;
        this.indexedService = indexedService;
        this.chainSource = chainSource;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public PoolResult<PoolRecord> getPool(String address, int chainId) {
        long start = clock.millis();
        if (!isAddress(address)) {
            return invalid("Invalid pool address: " + address, start);
        }
        if (!SupportedChain.isSupported(chainId)) {
            return invalid("Unsupported chain: " + chainId, start);
        }
        String pool = address.strip().toLowerCase();
        return resolveGuarded(PoolCacheKey.forAddress(chainId, pool), chainId, start,
                () -> indexedService.getPool(pool, chainId),
                () -> chainSource.getPoolOnChainByAddress(pool, chainId),
                () -> SyntheticPoolFactory.forAddress(pool, chainId));
    }

    /**
     * Token order does not matter: the pair is canonicalized (lower address first) before lookup.
     */
    public PoolResult<PoolRecord> getPoolByTokens(String tokenA, String tokenB, FeeTier feeTier, int chainId) {
        long start = clock.millis();
        if (!isAddress(tokenA) || !isAddress(tokenB)) {
            return invalid("Invalid token address: " + (isAddress(tokenA) ? tokenB : tokenA), start);
        }
        if (feeTier == null) {
            return invalid("Fee tier is required", start);
        }
        if (!SupportedChain.isSupported(chainId)) {
            return invalid("Unsupported chain: " + chainId, start);
        }
        String a = tokenA.strip().toLowerCase();
        String b = tokenB.strip().toLowerCase();
        if (a.equals(b)) {
            return invalid("Pool tokens must differ", start);
        }
        String lower = a.compareTo(b) < 0 ? a : b;
        String higher = a.compareTo(b) < 0 ? b : a;
        return resolveGuarded(PoolCacheKey.forPair(chainId, lower, higher, feeTier), chainId, start,
                () -> indexedService.getPoolByTokens(lower, higher, feeTier, chainId),
                () -> chainSource.getPoolOnChain(lower, higher, feeTier, chainId),
                () -> SyntheticPoolFactory.forTokens(lower, higher, feeTier, chainId));
    }

    /**
     * Filtered, ordered page of pools from the indexed service. Every returned pool is cached.
     */
    public PoolResult<List<PoolRecord>> getPools(int chainId, PoolQuery query) {
        long start = clock.millis();
        if (!SupportedChain.isSupported(chainId)) {
            return invalid("Unsupported chain: " + chainId, start);
        }
        PoolQuery q = query != null ? query : PoolQuery.defaults();
        Optional<String> badToken = Stream.concat(Stream.of(q.token0(), q.token1()), q.tokens().stream())
                .filter(t -> t != null && !isAddress(t))
                .findFirst();
        if (badToken.isPresent()) {
            return invalid("Invalid token address: " + badToken.get(), start);
        }
        return fetchPools(chainId, q, start);
    }

    /**
     * Highest-TVL pools above the configured TVL floor.
     */
    public PoolResult<List<PoolRecord>> getTopPools(int chainId, int limit) {
        PoolQuery query = PoolQuery.builder()
                .first(limit > 0 ? limit : DEFAULT_TOP_POOLS)
                .minTvlUsd(properties.getTopPoolsMinTvlUsd())
                .orderBy(PoolOrderBy.TOTAL_VALUE_LOCKED_USD)
                .orderDirection(OrderDirection.DESC)
                .build();
        return getPools(chainId, query);
    }

    /**
     * An address query returns pools containing that token. Any other query is matched as a substring of
     * either token symbol over the top pools by TVL; this is not a full-text index, so pools outside that
     * window are never found.
     */
    public PoolResult<List<PoolRecord>> searchPools(String query, int chainId, PoolSearchOptions options) {
        long start = clock.millis();
        if (query == null || query.isBlank()) {
            return invalid("Search query is required", start);
        }
        if (!SupportedChain.isSupported(chainId)) {
            return invalid("Unsupported chain: " + chainId, start);
        }
        PoolSearchOptions opts = options != null ? options : PoolSearchOptions.none();
        int limit = opts.limit() != null && opts.limit() > 0 ? opts.limit() : properties.getDefaultSearchLimit();
        String q = query.strip();
        boolean byToken = isAddress(q);
        PoolQuery.PoolQueryBuilder scan = PoolQuery.builder()
                .first(properties.getSearchTopN())
                .orderBy(PoolOrderBy.TOTAL_VALUE_LOCKED_USD)
                .orderDirection(OrderDirection.DESC);
        if (byToken) {
            scan.tokens(List.of(q.toLowerCase()));
        }
        PoolResult<List<PoolRecord>> fetched = fetchPools(chainId, scan.build(), start);
        if (!fetched.isSuccess()) {
            return fetched;
        }
        List<PoolRecord> matched = fetched.getData().orElse(List.of()).stream()
                .filter(p -> byToken || PoolFilters.symbolMatches(p, q))
                .filter(PoolFilters.matching(opts))
                .limit(limit)
                .toList();
        return PoolResult.success(matched, fetched.getSource(), clock.millis(), clock.millis() - start);
    }

    /**
     * Resolves every request independently on the batch executor. Synthetic placeholders are left out of
     * the data and reported in the error string, as are failures; the batch succeeds when at least one
     * element resolved. The reported source is the furthest one down the fallback chain that any element
     * needed.
     */
    public PoolResult<List<PoolRecord>> batchGetPools(List<PoolLookupRequest> requests) {
        long start = clock.millis();
        if (requests == null || requests.isEmpty()) {
            return PoolResult.success(List.of(), PoolSource.CACHE, clock.millis(), 0);
        }
        List<CompletableFuture<PoolResult<PoolRecord>>> futures = requests.stream().map(this::submit).toList();
        List<PoolRecord> pools = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        PoolSource source = PoolSource.CACHE;
        PoolErrorCode firstCode = null;
        for (int i = 0; i < requests.size(); i++) {
            PoolLookupRequest request = requests.get(i);
            PoolResult<PoolRecord> r = futures.get(i).join();
            if (r.isSuccess() && !r.isSynthetic()) {
                pools.add(r.getData().orElseThrow());
                if (r.getSource().ordinal() > source.ordinal()) {
                    source = r.getSource();
                }
            } else if (r.isSynthetic()) {
                errors.add(request.describe() + ": only a synthetic placeholder was available (" + r.getError() + ")");
            } else {
                errors.add(request.describe() + ": " + r.getError());
                if (firstCode == null) {
                    firstCode = r.getErrorCode();
                }
            }
        }
        long now = clock.millis();
        if (errors.isEmpty()) {
            return PoolResult.success(pools, source, now, now - start);
        }
        String error = String.join("; ", errors);
        if (pools.isEmpty()) {
            log.warn("Batch of {} pool lookups failed entirely", requests.size());
            return PoolResult.failure(firstCode != null ? firstCode : PoolErrorCode.UNAVAILABLE, error,
                    PoolSource.INDEXED_SERVICE, now, now - start);
        }
        log.debug("Batch resolved {}/{} pools", pools.size(), requests.size());
        return PoolResult.partial(pools, error, source, now, now - start);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
        log.info("Pool cache cleared");
    }

    static boolean isAddress(String value) {
        return value != null && ADDRESS.matcher(value.strip()).matches();
    }

    private PoolResult<PoolRecord> lookup(PoolLookupRequest request) {
        if (request == null) {
            return invalid("Lookup request is required", clock.millis());
        }
        return request.isAddressLookup()
                ? getPool(request.address(), request.chainId())
                : getPoolByTokens(request.tokenA(), request.tokenB(), request.feeTier(), request.chainId());
    }

    private CompletableFuture<PoolResult<PoolRecord>> submit(PoolLookupRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> lookup(request), batchExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Batch executor rejected lookup {}: {}", request != null ? request.describe() : null, e.getMessage());
            long now = clock.millis();
            return CompletableFuture.completedFuture(
                    PoolResult.failure(PoolErrorCode.UNAVAILABLE, "Batch capacity exceeded", null, now, 0));
        }
    }

    private PoolResult<PoolRecord> resolveGuarded(PoolCacheKey key, int chainId, long start,
                                                  Callable<Optional<PoolRecord>> indexedCall,
                                                  Callable<Optional<PoolRecord>> chainCall,
                                                  Supplier<PoolRecord> synthetic) {
        try {
            Optional<CacheEntry> cached = cache.getEntry(key);
            if (cached.isPresent()) {
                log.debug("Cache hit {}", key);
                return PoolResult.success(cached.get().data(), PoolSource.CACHE, clock.millis(), clock.millis() - start);
            }
            log.debug("Cache miss {}", key);
            PoolResult<PoolRecord> shared = singleFlight.execute(key.value(),
                    () -> load(key, chainId, indexedCall, chainCall, synthetic));
            return shared.withTiming(clock.millis(), clock.millis() - start);
        } catch (RuntimeException e) {
            log.error("Unexpected failure resolving {}", key, e);
            return PoolResult.failure(PoolErrorCode.UPSTREAM_ERROR, e.getMessage(), null, clock.millis(), clock.millis() - start);
        }
    }

    private PoolResult<PoolRecord> load(PoolCacheKey key, int chainId,
                                        Callable<Optional<PoolRecord>> indexedCall,
                                        Callable<Optional<PoolRecord>> chainCall,
                                        Supplier<PoolRecord> synthetic) {
        // a resolution for this key may have completed between our miss and entering the flight
        Optional<PoolRecord> fresh = cache.peek(key);
        if (fresh.isPresent()) {
            return PoolResult.success(fresh.get(), PoolSource.CACHE, 0, 0);
        }
        boolean notFound = false;
        Exception indexedError = null;
        Exception chainError = null;
        PoolSource lastConsulted = null;

        if (indexedService.supports(chainId)) {
            lastConsulted = PoolSource.INDEXED_SERVICE;
            try {
                Optional<PoolRecord> found = queryIndexed(indexedCall);
                if (found.isPresent()) {
                    cache.put(found.get(), PoolSource.INDEXED_SERVICE);
                    return PoolResult.success(found.get(), PoolSource.INDEXED_SERVICE, 0, 0);
                }
                notFound = true;
                log.debug("Indexed service has no pool for {}", key);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PoolResult.failure(PoolErrorCode.UNAVAILABLE, "Interrupted while resolving " + key,
                        PoolSource.INDEXED_SERVICE, 0, 0);
            } catch (Exception e) {
                indexedError = e;
                log.warn("Indexed service failed for {} after retries: {}", key, e.getMessage());
            }
        }

        if (chainSource != null && chainSource.supports(chainId)) {
            lastConsulted = PoolSource.CHAIN;
            try {
                Optional<PoolRecord> found = chainCall.call();
                if (found.isPresent()) {
                    cache.put(found.get(), PoolSource.CHAIN);
                    log.info("Resolved {} from chain fallback", key);
                    return PoolResult.success(found.get(), PoolSource.CHAIN, 0, 0);
                }
                notFound = true;
                log.debug("Chain has no pool for {}", key);
            } catch (Exception e) {
                chainError = e;
                log.warn("Chain fallback failed for {}: {}", key, e.getMessage());
            }
        }

        if (notFound) {
            return PoolResult.failure(PoolErrorCode.NOT_FOUND, "Pool not found: " + key, lastConsulted, 0, 0);
        }
        String reason = failureReason(chainId, indexedError, chainError);
        if (properties.isSyntheticFallbackEnabled()) {
            log.warn("No real source answered for {}, returning synthetic placeholder: {}", key, reason);
            return PoolResult.synthetic(synthetic.get(), reason, 0, 0);
        }
        Exception last = chainError != null ? chainError : indexedError;
        PoolErrorCode code = last == null ? PoolErrorCode.UNAVAILABLE
                : last instanceof UpstreamTimeoutException ? PoolErrorCode.UPSTREAM_TIMEOUT
                : PoolErrorCode.UPSTREAM_ERROR;
        return PoolResult.failure(code, reason, lastConsulted, 0, 0);
    }

    private <T> T queryIndexed(Callable<T> call) throws Exception {
        return retryExecutor.run(() -> {
            rateLimiter.awaitSlot();
            return call.call();
        });
    }

    private PoolResult<List<PoolRecord>> fetchPools(int chainId, PoolQuery query, long start) {
        if (!indexedService.supports(chainId)) {
            return PoolResult.failure(PoolErrorCode.UNAVAILABLE, "No indexed service configured for chain " + chainId,
                    PoolSource.INDEXED_SERVICE, clock.millis(), clock.millis() - start);
        }
        try {
            List<PoolRecord> pools = queryIndexed(() -> indexedService.getPools(chainId, query));
            cache.warmUp(pools, PoolSource.INDEXED_SERVICE);
            return PoolResult.success(pools, PoolSource.INDEXED_SERVICE, clock.millis(), clock.millis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PoolResult.failure(PoolErrorCode.UNAVAILABLE, "Interrupted while fetching pools on chain " + chainId,
                    PoolSource.INDEXED_SERVICE, clock.millis(), clock.millis() - start);
        } catch (Exception e) {
            log.warn("Failed to fetch pools on chain {}: {}", chainId, e.getMessage());
            PoolErrorCode code = e instanceof UpstreamTimeoutException ? PoolErrorCode.UPSTREAM_TIMEOUT : PoolErrorCode.UPSTREAM_ERROR;
            return PoolResult.failure(code, "Failed to fetch pools on chain " + chainId + ": " + e.getMessage(),
                    PoolSource.INDEXED_SERVICE, clock.millis(), clock.millis() - start);
        }
    }

    private static String failureReason(int chainId, Exception indexedError, Exception chainError) {
        if (indexedError == null && chainError == null) {
            return "No pool source available for chain " + chainId;
        }
        List<String> parts = new ArrayList<>(2);
        if (indexedError != null) {
            parts.add("indexed service: " + indexedError.getMessage());
        }
        if (chainError != null) {
            parts.add("chain: " + chainError.getMessage());
        }
        return String.join("; ", parts);
    }

    private <T> PoolResult<T> invalid(String message, long start) {
        return PoolResult.failure(PoolErrorCode.INVALID_REQUEST, message, null, clock.millis(), clock.millis() - start);
    }
}
