package com.eventwatch.source.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC client abstraction for testing. Endpoint choice and rate limiting are done by the caller.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getFilterChanges"
     * @param params      method params (e.g. filter object)
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
