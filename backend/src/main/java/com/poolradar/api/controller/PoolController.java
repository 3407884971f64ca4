package com.poolradar.api.controller;

import com.poolradar.api.dto.BatchPoolRequest;
import com.poolradar.api.dto.ErrorBody;
import com.poolradar.api.validation.AddressValidator;
import com.poolradar.cache.CacheStats;
import com.poolradar.domain.FeeTier;
import com.poolradar.resolver.PoolLookupRequest;
import com.poolradar.resolver.PoolResolver;
import com.poolradar.resolver.PoolResult;
import com.poolradar.resolver.PoolSearchOptions;
import com.poolradar.source.indexed.OrderDirection;
import com.poolradar.source.indexed.PoolOrderBy;
import com.poolradar.source.indexed.PoolQuery;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Read-only pools API over PoolResolver. Resolution blocks on upstream calls, so it runs on the bounded-elastic
 * scheduler. Successful results are returned as-is (with source and latency); failures become ErrorBody with
 * a status per error code.
 */
@RestController
@RequestMapping("/api/v1/pools")
@RequiredArgsConstructor
public class PoolController {

    private final PoolResolver poolResolver;
    private final AddressValidator addressValidator;

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return poolResolver.cacheStats();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        poolResolver.clearCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<?>> batch(@RequestBody @Valid BatchPoolRequest request) {
        List<PoolLookupRequest> lookups = new ArrayList<>(request.requests().size());
        for (BatchPoolRequest.Item item : request.requests()) {
            if (item == null) {
                return reject("INVALID_REQUEST", "Batch entries must not be null");
            }
            if (item.address() != null) {
                lookups.add(PoolLookupRequest.byAddress(item.address(), item.chainId()));
                continue;
            }
            if (item.tokenA() == null || item.tokenB() == null || item.fee() == null) {
                return reject("INVALID_REQUEST", "Each lookup needs an address, or tokenA, tokenB and fee");
            }
            Optional<FeeTier> fee = FeeTier.fromValue(item.fee());
            if (fee.isEmpty()) {
                return reject("INVALID_FEE_TIER", "Unsupported fee tier " + item.fee());
            }
            lookups.add(PoolLookupRequest.byTokens(item.tokenA(), item.tokenB(), fee.get(), item.chainId()));
        }
        return resolve(() -> poolResolver.batchGetPools(lookups));
    }

    @GetMapping("/{chainId}/by-tokens")
    public Mono<ResponseEntity<?>> getPoolByTokens(@PathVariable int chainId,
                                                   @RequestParam String tokenA,
                                                   @RequestParam String tokenB,
                                                   @RequestParam int fee) {
        if (!addressValidator.isValidAddress(tokenA) || !addressValidator.isValidAddress(tokenB)) {
            return reject("INVALID_ADDRESS", "Invalid token address format");
        }
        if (!addressValidator.isSupportedChain(chainId)) {
            return unsupportedChain(chainId);
        }
        Optional<FeeTier> feeTier = FeeTier.fromValue(fee);
        if (feeTier.isEmpty()) {
            return reject("INVALID_FEE_TIER", "Unsupported fee tier " + fee);
        }
        return resolve(() -> poolResolver.getPoolByTokens(tokenA, tokenB, feeTier.get(), chainId));
    }

    @GetMapping("/{chainId}/top")
    public Mono<ResponseEntity<?>> getTopPools(@PathVariable int chainId,
                                               @RequestParam(required = false, defaultValue = "10") int limit) {
        if (!addressValidator.isSupportedChain(chainId)) {
            return unsupportedChain(chainId);
        }
        return resolve(() -> poolResolver.getTopPools(chainId, limit));
    }

    @GetMapping("/{chainId}/search")
    public Mono<ResponseEntity<?>> search(@PathVariable int chainId,
                                          @RequestParam String q,
                                          @RequestParam(required = false) Integer limit,
                                          @RequestParam(required = false) List<Integer> feeTiers,
                                          @RequestParam(required = false) BigDecimal minTvl,
                                          @RequestParam(required = false) BigDecimal minVolume) {
        if (!addressValidator.isSupportedChain(chainId)) {
            return unsupportedChain(chainId);
        }
        Optional<List<FeeTier>> tiers = parseFeeTiers(feeTiers);
        if (tiers.isEmpty()) {
            return reject("INVALID_FEE_TIER", "Unsupported fee tier in " + feeTiers);
        }
        PoolSearchOptions options = PoolSearchOptions.builder()
                .feeTiers(tiers.get())
                .minTvlUsd(minTvl)
                .minVolumeUsd(minVolume)
                .limit(limit)
                .build();
        return resolve(() -> poolResolver.searchPools(q, chainId, options));
    }

    @GetMapping("/{chainId}/{address}")
    public Mono<ResponseEntity<?>> getPool(@PathVariable int chainId, @PathVariable String address) {
        if (!addressValidator.isValidAddress(address)) {
            return reject("INVALID_ADDRESS", "Invalid pool address format");
        }
        if (!addressValidator.isSupportedChain(chainId)) {
            return unsupportedChain(chainId);
        }
        return resolve(() -> poolResolver.getPool(address, chainId));
    }

    @GetMapping("/{chainId}")
    public Mono<ResponseEntity<?>> getPools(@PathVariable int chainId,
                                            @RequestParam(required = false) String token0,
                                            @RequestParam(required = false) String token1,
                                            @RequestParam(required = false) List<String> tokens,
                                            @RequestParam(required = false) List<Integer> feeTiers,
                                            @RequestParam(required = false) BigDecimal minTvl,
                                            @RequestParam(required = false) BigDecimal minVolume,
                                            @RequestParam(required = false) String orderBy,
                                            @RequestParam(required = false) String orderDirection,
                                            @RequestParam(required = false) Integer first,
                                            @RequestParam(required = false) Integer skip) {
        if (!addressValidator.isSupportedChain(chainId)) {
            return unsupportedChain(chainId);
        }
        Optional<List<FeeTier>> tiers = parseFeeTiers(feeTiers);
        if (tiers.isEmpty()) {
            return reject("INVALID_FEE_TIER", "Unsupported fee tier in " + feeTiers);
        }
        Optional<PoolOrderBy> order = orderBy == null ? Optional.of(PoolOrderBy.TOTAL_VALUE_LOCKED_USD) : PoolOrderBy.fromField(orderBy);
        if (order.isEmpty()) {
            return reject("INVALID_REQUEST", "Unsupported orderBy " + orderBy);
        }
        Optional<OrderDirection> direction = orderDirection == null ? Optional.of(OrderDirection.DESC) : OrderDirection.fromWireName(orderDirection);
        if (direction.isEmpty()) {
            return reject("INVALID_REQUEST", "orderDirection must be asc or desc");
        }
        PoolQuery query = PoolQuery.builder()
                .token0(token0)
                .token1(token1)
                .tokens(tokens)
                .feeTiers(tiers.get())
                .minTvlUsd(minTvl)
                .minVolumeUsd(minVolume)
                .orderBy(order.get())
                .orderDirection(direction.get())
                .first(first)
                .skip(skip)
                .build();
        return resolve(() -> poolResolver.getPools(chainId, query));
    }

    static HttpStatus statusFor(PoolResult<?> result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        return switch (result.getErrorCode()) {
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UPSTREAM_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_ERROR -> HttpStatus.BAD_GATEWAY;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static Mono<ResponseEntity<?>> resolve(Callable<PoolResult<?>> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .map(PoolController::toResponse);
    }

    private static ResponseEntity<?> toResponse(PoolResult<?> result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(statusFor(result))
                .body(ErrorBody.of(result.getErrorCode().name(), result.getError()));
    }

    /** Empty when any value is not a known fee tier. */
    private static Optional<List<FeeTier>> parseFeeTiers(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            return Optional.of(List.of());
        }
        List<FeeTier> tiers = new ArrayList<>(values.size());
        for (Integer v : values) {
            Optional<FeeTier> tier = v != null ? FeeTier.fromValue(v) : Optional.empty();
            if (tier.isEmpty()) {
                return Optional.empty();
            }
            tiers.add(tier.get());
        }
        return Optional.of(tiers);
    }

    private static Mono<ResponseEntity<?>> unsupportedChain(int chainId) {
        return reject("INVALID_CHAIN", "Chain " + chainId + " is not supported");
    }

    private static Mono<ResponseEntity<?>> reject(String error, String message) {
        return Mono.<ResponseEntity<?>>just(ResponseEntity.badRequest().body(ErrorBody.of(error, message)));
    }
}
