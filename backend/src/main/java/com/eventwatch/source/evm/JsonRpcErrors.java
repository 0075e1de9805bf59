package com.eventwatch.source.evm;

import com.eventwatch.source.RpcErrorKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Maps JSON-RPC error objects to {@link RpcErrorKind}.
 */
final class JsonRpcErrors {

    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_INPUT = -32000;

    private JsonRpcErrors() {
    }

    static RpcErrorKind classify(String method, JsonNode error) {
        int code = error.path("code").asInt(0);
        String message = error.path("message").asText("").toLowerCase(Locale.ROOT);
        if (code == METHOD_NOT_FOUND
                || message.contains("method not found")
                || message.contains("not supported")
                || message.contains("does not exist/is not available")) {
            return RpcErrorKind.UNSUPPORTED;
        }
        // Providers answer eth_getFilterChanges on an expired or evicted filter with an invalid-input error.
        if (EvmLogSource.GET_FILTER_CHANGES.equals(method)
                && (code == INVALID_INPUT || message.contains("filter not found"))) {
            return RpcErrorKind.INVALID_FILTER;
        }
        return RpcErrorKind.OTHER;
    }
}
