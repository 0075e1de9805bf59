package com.eventwatch.source.evm;

import com.eventwatch.config.EvmRpcProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmLogSourcesTest {

    private final List<String> endpointsCalled = new ArrayList<>();
    private EvmLogSources sources;

    @BeforeEach
    void setUp() {
        EvmRpcProperties properties = new EvmRpcProperties();
        EvmRpcProperties.NetworkEntry arbitrum = new EvmRpcProperties.NetworkEntry();
        arbitrum.setUrls(List.of("https://arb1.arbitrum.io/rpc"));
        properties.setNetwork(Map.of("ARBITRUM", arbitrum));
        EvmRpcClient client = (endpoint, method, params) -> {
            endpointsCalled.add(endpoint);
            return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}");
        };
        sources = new EvmLogSources(client, RateLimiter.ofDefaults("test"), properties, new ObjectMapper());
    }

    @Test
    void forNetwork_sameInstancePerNetwork() {
        assertThat(sources.forNetwork("ARBITRUM")).isSameAs(sources.forNetwork("ARBITRUM"));
        assertThat(sources.forNetwork("ARBITRUM").id()).isEqualTo("evm:ARBITRUM");
        assertThat(sources.forNetwork("BASE")).isNotSameAs(sources.forNetwork("ARBITRUM"));
    }

    @Test
    void forNetwork_usesConfiguredUrlsElseFallback() {
        sources.forNetwork("ARBITRUM").currentPosition();
        sources.forNetwork("POLYGON").currentPosition();

        assertThat(endpointsCalled).containsExactly("https://arb1.arbitrum.io/rpc", EvmLogSources.DEFAULT_FALLBACK_URLS.get(0));
    }

    @Test
    void forNetwork_blank_throws() {
        assertThatThrownBy(() -> sources.forNetwork(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
