package com.poolradar.source.chain;

import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers eth_call by (contract, selector). Unknown calls return "0x", as calls to addresses without code do.
 */
class FakeEvmRpcClient implements EvmRpcClient {

    private final Map<String, String> results = new HashMap<>();
    private final Map<String, String> failingEndpoints = new HashMap<>();
    final List<String> calledEndpoints = new ArrayList<>();

    FakeEvmRpcClient answer(String contract, String selector, String result) {
        results.put(contract.toLowerCase() + ":" + selector, result);
        return this;
    }

    FakeEvmRpcClient failAt(String endpoint, String errorJson) {
        failingEndpoints.put(endpoint, errorJson);
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<String> call(String endpointUrl, String method, Object params) {
        calledEndpoints.add(endpointUrl);
        if (failingEndpoints.containsKey(endpointUrl)) {
            return Mono.just(failingEndpoints.get(endpointUrl));
        }
        Map<String, String> call = (Map<String, String>) ((List<Object>) params).get(0);
        String key = call.get("to").toLowerCase() + ":" + call.get("data").substring(0, 10);
        String result = results.getOrDefault(key, "0x");
        return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"" + result + "\"}");
    }

    static String word(long value) {
        String hex = Long.toHexString(value);
        return "0".repeat(64 - hex.length()) + hex;
    }

    static String word(String hex) {
        String h = hex.startsWith("0x") ? hex.substring(2) : hex;
        return "0".repeat(64 - h.length()) + h;
    }
}
