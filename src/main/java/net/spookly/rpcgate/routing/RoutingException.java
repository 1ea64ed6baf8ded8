package net.spookly.rpcgate.routing;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.rpcgate.rpc.JsonRpcError;

/**
 * A single request could not be routed or answered. Never affects other requests.
 */
@Getter
@Accessors(fluent = true)
public class RoutingException extends RuntimeException {
    private final RoutingErrorKind kind;
    /**
     * Error returned by the upstream, set for {@link RoutingErrorKind#UPSTREAM_RPC_ERROR} only.
     */
    private final JsonRpcError upstreamError;
    private final boolean timeout;

    public RoutingException(RoutingErrorKind kind, String message) {
        this(kind, message, null, false, null);
    }

    public RoutingException(RoutingErrorKind kind, String message, JsonRpcError upstreamError, boolean timeout, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.upstreamError = upstreamError;
        this.timeout = timeout;
    }

    public static RoutingException upstreamRpcError(String message, JsonRpcError upstreamError) {
        return new RoutingException(RoutingErrorKind.UPSTREAM_RPC_ERROR, message, upstreamError, false, null);
    }

    public static RoutingException unreachable(String message, boolean timeout, Throwable cause) {
        return new RoutingException(RoutingErrorKind.UPSTREAM_UNREACHABLE, message, null, timeout, cause);
    }

    public int httpStatus() {
        if (kind == RoutingErrorKind.UPSTREAM_UNREACHABLE && timeout) {
            return 504;
        }
        return kind.httpStatus();
    }

    /**
     * Error object reported to the client: the upstream's own error when there is one.
     */
    public JsonRpcError toRpcError() {
        if (upstreamError != null) {
            return upstreamError;
        }
        return new JsonRpcError(kind.rpcCode(), getMessage(), null);
    }
}
