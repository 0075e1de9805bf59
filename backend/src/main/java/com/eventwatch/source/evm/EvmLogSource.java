package com.eventwatch.source.evm;

import com.eventwatch.config.EvmRpcProperties;
import com.eventwatch.domain.FilterHandle;
import com.eventwatch.domain.WatchCriteria;
import com.eventwatch.source.RpcEndpointRotator;
import com.eventwatch.source.RpcErrorKind;
import com.eventwatch.source.RpcException;
import com.eventwatch.source.WatchSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Event log source for one EVM network: eth_newFilter / eth_getFilterChanges with eth_getLogs + eth_blockNumber
 * as the range-query path. Logs are returned as raw JSON objects.
 */
@Slf4j
public class EvmLogSource implements WatchSource<JsonNode> {

    static final String NEW_FILTER = "eth_newFilter";
    static final String GET_FILTER_CHANGES = "eth_getFilterChanges";
    static final String GET_LOGS = "eth_getLogs";
    static final String BLOCK_NUMBER = "eth_blockNumber";
    static final String UNINSTALL_FILTER = "eth_uninstallFilter";

    private final String networkId;
    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final EvmRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;

    public EvmLogSource(
            String networkId,
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            RateLimiter rateLimiter,
            EvmRpcProperties rpcProperties,
            ObjectMapper objectMapper
    ) {
        this.networkId = networkId;
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return "evm:" + networkId;
    }

    @Override
    public FilterHandle createFilter(WatchCriteria criteria) {
        JsonNode result = callRpc(NEW_FILTER, Collections.singletonList(buildLogFilter(criteria, null, null)));
        String filterId = result.asText(null);
        if (filterId == null || filterId.isBlank()) {
            throw new RpcException(NEW_FILTER + " returned no filter id on " + networkId);
        }
        return new FilterHandle(filterId, criteria);
    }

    @Override
    public List<JsonNode> pollFilter(FilterHandle handle) {
        JsonNode result = callRpc(GET_FILTER_CHANGES, Collections.singletonList(handle.id()));
        return toLogs(result, handle.criteria());
    }

    @Override
    public List<JsonNode> fetchRange(WatchCriteria criteria, long fromPosition, long toPosition) {
        if (fromPosition > toPosition) {
            return List.of();
        }
        JsonNode result = callRpc(GET_LOGS, Collections.singletonList(buildLogFilter(criteria, fromPosition, toPosition)));
        return toLogs(result, criteria);
    }

    @Override
    public long currentPosition() {
        JsonNode result = callRpc(BLOCK_NUMBER, Collections.emptyList());
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException(BLOCK_NUMBER + " invalid result: " + hex);
        }
        try {
            return Long.parseLong(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Failed to parse " + BLOCK_NUMBER + " result " + hex, e);
        }
    }

    @Override
    public void releaseFilter(FilterHandle handle) {
        JsonNode result = callRpc(UNINSTALL_FILTER, Collections.singletonList(handle.id()));
        if (!result.asBoolean(false)) {
            log.debug("Filter {} on {} was already gone at uninstall", handle.id(), networkId);
        }
    }

    Map<String, Object> buildLogFilter(WatchCriteria criteria, Long fromBlock, Long toBlock) {
        Map<String, Object> filter = new HashMap<>();
        List<String> addresses = criteria.addresses();
        if (addresses.size() == 1) {
            filter.put("address", addresses.get(0));
        } else if (!addresses.isEmpty()) {
            filter.put("address", addresses);
        }
        if (criteria.hasTopics()) {
            filter.put("topics", topics(criteria));
        }
        if (fromBlock != null) {
            filter.put("fromBlock", "0x" + Long.toHexString(fromBlock));
        }
        if (toBlock != null) {
            filter.put("toBlock", "0x" + Long.toHexString(toBlock));
        }
        return filter;
    }

    /**
     * Topic positions: event topic first, then each indexed argument in declaration order. Null means any value.
     */
    static List<Object> topics(WatchCriteria criteria) {
        List<Object> topics = new ArrayList<>();
        topics.add(criteria.event());
        topics.addAll(criteria.args().values());
        return topics;
    }

    private List<JsonNode> toLogs(JsonNode result, WatchCriteria criteria) {
        if (!result.isArray()) {
            throw new RpcException("Expected log array but got " + result.getNodeType());
        }
        int requiredTopics = criteria != null && criteria.strict() && criteria.hasTopics() ? topics(criteria).size() : 0;
        List<JsonNode> logs = new ArrayList<>(result.size());
        for (JsonNode entry : result) {
            if (entry.path("topics").size() < requiredTopics) {
                log.debug("Dropping log {} on {}: fewer topics than strict criteria require",
                        entry.path("transactionHash").asText("?"), networkId);
                continue;
            }
            logs.add(entry);
        }
        return logs;
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(Math.max(1L, rpcProperties.getRequestTimeoutMs()));
    }

    private JsonNode callRpc(String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        String endpoint = rotator.getNextEndpoint();
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, rpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block(requestTimeout());
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed on " + endpoint + ": " + e.getMessage(), e);
        }
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            RpcErrorKind kind = JsonRpcErrors.classify(method, error);
            throw new RpcException(kind, method + " error: " + error);
        }
        return root.path("result");
    }
}
