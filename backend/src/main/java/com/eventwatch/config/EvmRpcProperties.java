package com.eventwatch.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * EVM RPC endpoints per network and local throttling settings.
 * Key = network name (e.g. ETHEREUM, ARBITRUM).
 */
@ConfigurationProperties(prefix = "eventwatch.rpc")
@NoArgsConstructor
@Getter
@Setter
public class EvmRpcProperties {

    /** Per-network entries. Missing network → single fallback URL. */
    private Map<String, NetworkEntry> network = new HashMap<>();

    /** Global EVM RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 50;

    /** How long local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** Upper bound for one RPC call; a call still pending after this fails the tick. */
    private long requestTimeoutMs = 10_000;

    public void setNetwork(Map<String, NetworkEntry> network) {
        this.network = network != null ? network : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEntry {

        private List<String> urls = new ArrayList<>();

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
