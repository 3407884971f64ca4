package com.poolradar.source.chain;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * EVM JSON-RPC transport. Endpoint choice and failover belong to the caller (EthCallExecutor).
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      method params
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);

    /**
     * Read-only contract call against the latest block.
     *
     * @param to   contract address
     * @param data selector plus ABI-encoded arguments
     */
    default Mono<String> ethCall(String endpointUrl, String to, String data) {
        return call(endpointUrl, "eth_call", List.of(Map.of("to", to, "data", data), "latest"));
    }
}
