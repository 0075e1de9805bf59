package com.eventwatch.config;

import com.eventwatch.source.evm.EvmLogSources;
import com.eventwatch.source.evm.EvmRpcClient;
import com.eventwatch.source.evm.WebClientEvmRpcClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the EVM JSON-RPC client, the shared local rate limiter and per-network log sources.
 */
@Configuration
@EnableConfigurationProperties(EvmRpcProperties.class)
public class RpcClientConfig {

    public static final String EVM_RPC_RATE_LIMITER = "evmRpcRateLimiter";

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = EVM_RPC_RATE_LIMITER)
    public RateLimiter evmRpcRateLimiter(EvmRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public EvmLogSources evmLogSources(
            EvmRpcClient evmRpcClient,
            @Qualifier(EVM_RPC_RATE_LIMITER) RateLimiter evmRpcRateLimiter,
            EvmRpcProperties rpcProperties,
            ObjectMapper objectMapper
    ) {
        return new EvmLogSources(evmRpcClient, evmRpcRateLimiter, rpcProperties, objectMapper);
    }
}
