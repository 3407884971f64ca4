package com.poolradar.source.indexed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;
import com.poolradar.source.UpstreamException;
import com.poolradar.source.UpstreamTimeoutException;
import com.poolradar.source.config.IndexedServiceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Indexed ledger service client: GraphQL over HTTP POST with WebClient, one endpoint per chain.
 * Every request carries the configured timeout. Responses are parsed into {@link SubgraphPool} and validated
 * by {@link SubgraphPoolMapper}; GraphQL {@code errors} and shape mismatches raise {@link UpstreamException}.
 */
@Slf4j
public class GraphQlIndexedPoolService implements IndexedPoolService {

    private static final String POOL_FIELDS = """
            id
            token0 { id symbol name decimals }
            token1 { id symbol name decimals }
            feeTier
            sqrtPrice
            liquidity
            tick
            tickSpacing
            createdAtTimestamp
            createdAtBlockNumber
            volumeUSD
            totalValueLockedUSD
            totalValueLockedToken0
            totalValueLockedToken1
            feesUSD
            feeGrowthGlobal0X128
            feeGrowthGlobal1X128
            """;

    static final String POOL_QUERY = "query GetPool($poolId: String!) { pool(id: $poolId) { " + POOL_FIELDS + " } }";

    static final String POOLS_QUERY = """
            query GetPools($first: Int, $skip: Int, $orderBy: Pool_orderBy, $orderDirection: OrderDirection, $where: Pool_filter) {
              pools(first: $first, skip: $skip, orderBy: $orderBy, orderDirection: $orderDirection, where: $where) {
            """ + POOL_FIELDS + " } }";

    private final WebClient webClient;
    private final IndexedServiceProperties properties;
    private final ObjectMapper objectMapper;

    public GraphQlIndexedPoolService(WebClient.Builder webClientBuilder, IndexedServiceProperties properties, ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(int chainId) {
        String endpoint = properties.getEndpoints().get(chainId);
        return endpoint != null && !endpoint.isBlank();
    }

    @Override
    public Optional<PoolRecord> getPool(String poolAddress, int chainId) {
        JsonNode data = execute(chainId, POOL_QUERY, Map.of("poolId", poolAddress.strip().toLowerCase()));
        JsonNode pool = data.path("pool");
        if (pool.isMissingNode() || pool.isNull()) {
            return Optional.empty();
        }
        return Optional.of(SubgraphPoolMapper.toRecord(convert(pool), chainId));
    }

    @Override
    public List<PoolRecord> getPools(int chainId, PoolQuery query) {
        PoolQuery q = query != null ? query : PoolQuery.defaults();
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("first", q.first());
        variables.put("skip", q.skip());
        variables.put("orderBy", q.orderBy().field());
        variables.put("orderDirection", q.orderDirection().wireName());
        Map<String, Object> where = buildWhere(q);
        if (!where.isEmpty()) {
            variables.put("where", where);
        }
        JsonNode pools = execute(chainId, POOLS_QUERY, variables).path("pools");
        if (!pools.isArray()) {
            throw new UpstreamException("Malformed pools response on chain " + chainId + ": pools is not a list");
        }
        List<PoolRecord> records = new ArrayList<>(pools.size());
        for (JsonNode pool : pools) {
            records.add(SubgraphPoolMapper.toRecord(convert(pool), chainId));
        }
        return records;
    }

    @Override
    public Optional<PoolRecord> getPoolByTokens(String tokenA, String tokenB, FeeTier feeTier, int chainId) {
        String a = tokenA.strip().toLowerCase();
        String b = tokenB.strip().toLowerCase();
        PoolQuery query = PoolQuery.builder()
                .token0(a.compareTo(b) <= 0 ? a : b)
                .token1(a.compareTo(b) <= 0 ? b : a)
                .feeTier(feeTier)
                .first(1)
                .build();
        return getPools(chainId, query).stream().findFirst();
    }

    /**
     * Builds the Pool_filter. A token-inclusion filter becomes an {@code or} of token0/token1 matches, with the
     * remaining conditions repeated in each branch.
     */
    static Map<String, Object> buildWhere(PoolQuery q) {
        Map<String, Object> base = new LinkedHashMap<>();
        if (q.token0() != null) {
            base.put("token0", q.token0().toLowerCase());
        }
        if (q.token1() != null) {
            base.put("token1", q.token1().toLowerCase());
        }
        if (q.feeTier() != null) {
            base.put("feeTier", q.feeTier().value());
        }
        if (!q.feeTiers().isEmpty()) {
            base.put("feeTier_in", q.feeTiers().stream().map(FeeTier::value).toList());
        }
        if (q.minTvlUsd() != null) {
            base.put("totalValueLockedUSD_gte", q.minTvlUsd().toPlainString());
        }
        if (q.minVolumeUsd() != null) {
            base.put("volumeUSD_gte", q.minVolumeUsd().toPlainString());
        }
        if (q.tokens().isEmpty()) {
            return base;
        }
        List<String> tokens = q.tokens().stream().map(String::toLowerCase).toList();
        Map<String, Object> side0 = new LinkedHashMap<>(base);
        side0.put("token0_in", tokens);
        Map<String, Object> side1 = new LinkedHashMap<>(base);
        side1.put("token1_in", tokens);
        return Map.of("or", List.of(side0, side1));
    }

    private JsonNode execute(int chainId, String query, Map<String, Object> variables) {
        String endpoint = properties.getEndpoints().get(chainId);
        if (endpoint == null || endpoint.isBlank()) {
            throw new UpstreamException("No indexed service endpoint for chain " + chainId);
        }
        Map<String, Object> body = Map.of("query", query, "variables", variables);
        long timeoutMs = properties.getRequestTimeoutMs();
        String response = webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(timeoutMs))
                .onErrorMap(TimeoutException.class,
                        e -> new UpstreamTimeoutException("Indexed service timed out after " + timeoutMs + "ms on chain " + chainId, e))
                .onErrorMap(WebClientResponseException.class,
                        e -> new UpstreamException("Indexed service HTTP " + e.getStatusCode().value() + " on chain " + chainId, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new UpstreamException("Indexed service unreachable on chain " + chainId + ": " + e.getMessage(), e))
                .block();
        return parseData(response, chainId);
    }

    JsonNode parseData(String response, int chainId) {
        if (response == null || response.isBlank()) {
            throw new UpstreamException("Empty indexed service response on chain " + chainId);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Unparsable indexed service response on chain " + chainId, e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            String message = errors.get(0).path("message").asText("unknown error");
            log.debug("Indexed service errors on chain {}: {}", chainId, errors);
            throw new UpstreamException("Indexed service error on chain " + chainId + ": " + message);
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new UpstreamException("Malformed indexed service response on chain " + chainId + ": missing data");
        }
        return data;
    }

    private SubgraphPool convert(JsonNode node) {
        if (!node.isObject()) {
            throw new UpstreamException("Malformed pool: expected object but got " + node.getNodeType());
        }
        try {
            return objectMapper.treeToValue(node, SubgraphPool.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new UpstreamException("Malformed pool: " + e.getMessage(), e);
        }
    }
}
