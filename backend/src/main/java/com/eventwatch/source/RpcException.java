package com.eventwatch.source;

/**
 * Thrown when an RPC call fails (HTTP or JSON-RPC error). Carries the failure kind.
 */
public class RpcException extends RuntimeException {

    private final RpcErrorKind kind;

    public RpcException(String message) {
        this(RpcErrorKind.OTHER, message);
    }

    public RpcException(String message, Throwable cause) {
        this(RpcErrorKind.OTHER, message, cause);
    }

    public RpcException(RpcErrorKind kind, String message) {
        super(message);
        this.kind = kind != null ? kind : RpcErrorKind.OTHER;
    }

    public RpcException(RpcErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind != null ? kind : RpcErrorKind.OTHER;
    }

    public RpcErrorKind getKind() {
        return kind;
    }

    /**
     * Kind of any throwable raised by a source call; non-RPC failures count as {@link RpcErrorKind#OTHER}.
     */
    public static RpcErrorKind kindOf(Throwable t) {
        return t instanceof RpcException e ? e.getKind() : RpcErrorKind.OTHER;
    }
}
