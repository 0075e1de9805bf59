package com.eventwatch.source;

/**
 * Closed classification of remote call failures. Drives filter lifecycle transitions.
 */
public enum RpcErrorKind {

    /** Provider does not support the method (e.g. no eth_newFilter). */
    UNSUPPORTED,

    /** Filter handle is unknown to the provider (expired, evicted or uninstalled). */
    INVALID_FILTER,

    /** Any other failure: HTTP, JSON-RPC error, malformed response, local limiter timeout. */
    OTHER
}
