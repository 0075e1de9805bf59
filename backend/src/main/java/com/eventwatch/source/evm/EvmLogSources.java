package com.eventwatch.source.evm;

import com.eventwatch.config.EvmRpcProperties;
import com.eventwatch.source.RpcEndpointRotator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link EvmLogSource} per network, built from eventwatch.rpc.network. Networks without urls use the fallback endpoint.
 */
public class EvmLogSources {

    /** Fallback URL when a network has no entry or empty urls. */
    static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://eth.llamarpc.com");

    private final Map<String, EvmLogSource> sourcesByNetwork = new ConcurrentHashMap<>();

    private final EvmRpcClient rpcClient;
    private final RateLimiter rateLimiter;
    private final EvmRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;

    public EvmLogSources(EvmRpcClient rpcClient, RateLimiter rateLimiter, EvmRpcProperties rpcProperties, ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rateLimiter = rateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Source for the network. The same instance is returned on every call, so its id stays stable for fingerprinting.
     */
    public EvmLogSource forNetwork(String networkId) {
        if (networkId == null || networkId.isBlank()) {
            throw new IllegalArgumentException("networkId required");
        }
        return sourcesByNetwork.computeIfAbsent(networkId, id ->
                new EvmLogSource(id, rpcClient, new RpcEndpointRotator(urlsFor(id)), rateLimiter, rpcProperties, objectMapper));
    }

    private List<String> urlsFor(String networkId) {
        EvmRpcProperties.NetworkEntry entry = rpcProperties.getNetwork().get(networkId);
        if (entry == null || entry.getUrls().isEmpty()) {
            return DEFAULT_FALLBACK_URLS;
        }
        return entry.getUrls();
    }
}
