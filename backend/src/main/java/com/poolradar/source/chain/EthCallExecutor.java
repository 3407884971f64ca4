package com.poolradar.source.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.source.UpstreamException;
import com.poolradar.source.UpstreamTimeoutException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Executes {@code eth_call} against a chain's endpoints. Each call takes a permit from the local limiter and
 * fails over once through every endpoint of the chain before giving up.
 */
@Slf4j
public class EthCallExecutor {

    private final EvmRpcClient rpcClient;
    private final Map<Integer, RpcEndpointRotator> rotatorsByChain;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public EthCallExecutor(EvmRpcClient rpcClient, Map<Integer, RpcEndpointRotator> rotatorsByChain,
                           RateLimiter rateLimiter, ObjectMapper objectMapper, Duration requestTimeout) {
        this.rpcClient = rpcClient;
        this.rotatorsByChain = Map.copyOf(rotatorsByChain);
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    public boolean supports(int chainId) {
        return rotatorsByChain.containsKey(chainId);
    }

    /**
     * @return the hex result; "0x" when the target has no code
     * @throws UpstreamException when every endpoint failed or returned a JSON-RPC error
     */
    public String ethCall(int chainId, String to, String data) {
        RpcEndpointRotator rotator = rotatorsByChain.get(chainId);
        if (rotator == null) {
            throw new UpstreamException("No RPC endpoint for chain " + chainId);
        }
        UpstreamException last = null;
        for (int i = 0; i < rotator.size(); i++) {
            String endpoint = rotator.getNextEndpoint();
            try {
                return parseResult(call(endpoint, to, data), endpoint);
            } catch (UpstreamException e) {
                last = e;
                log.debug("eth_call to {} on chain {} failed at {}: {}", to, chainId, endpoint, e.getMessage());
            }
        }
        throw last;
    }

    private String call(String endpoint, String to, String data) {
        if (!rateLimiter.acquirePermission()) {
            throw new UpstreamException("Local limiter timeout before eth_call on " + endpoint);
        }
        return rpcClient.ethCall(endpoint, to, data)
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class,
                        e -> new UpstreamTimeoutException("eth_call timed out on " + endpoint, e))
                .block();
    }

    private String parseResult(String json, String endpoint) {
        if (json == null || json.isBlank()) {
            throw new UpstreamException("Empty RPC response from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new UpstreamException("Unparsable RPC response from " + endpoint, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new UpstreamException("RPC error from " + endpoint + ": " + error.path("message").asText(error.toString()));
        }
        JsonNode result = root.path("result");
        if (!result.isTextual()) {
            throw new UpstreamException("RPC response from " + endpoint + " has no result");
        }
        return result.asText();
    }
}
