package net.spookly.rpcgate.routing;

import net.spookly.rpcgate.rpc.JsonRpcError;

/**
 * Request-time failure categories and the HTTP status each one is reported with.
 */
public enum RoutingErrorKind {
    INVALID_REQUEST(400, JsonRpcError.INVALID_REQUEST),
    UNKNOWN_PROJECT(404, JsonRpcError.METHOD_NOT_FOUND),
    UNSUPPORTED_CHAIN(404, JsonRpcError.METHOD_NOT_FOUND),
    /** The upstream answered with a JSON-RPC error; its code is passed through. */
    UPSTREAM_RPC_ERROR(422, JsonRpcError.INTERNAL_ERROR),
    UPSTREAM_UNREACHABLE(502, JsonRpcError.INTERNAL_ERROR);

    private final int httpStatus;
    private final int rpcCode;

    RoutingErrorKind(int httpStatus, int rpcCode) {
        this.httpStatus = httpStatus;
        this.rpcCode = rpcCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int rpcCode() {
        return rpcCode;
    }
}
