package net.spookly.rpcgate.upstream;

import java.net.URI;
import java.util.Locale;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.rpcgate.util.EndpointRedactor;

/**
 * Chain identity of an upstream could not be established.
 */
@Getter
@Accessors(fluent = true)
public class ResolutionFailure extends RuntimeException {
    public enum Reason {
        /** Declared {@code evmChainId} is not a positive integer. */
        INVALID_METADATA,
        UNREACHABLE,
        TIMEOUT,
        /** Non-2xx HTTP status. */
        HTTP_STATUS,
        /** Body is not JSON or not a JSON-RPC envelope. */
        MALFORMED_RESPONSE,
        RPC_ERROR,
        /** Result is present but is not an integer. */
        INVALID_RESULT
    }

    private final URI endpoint;
    private final String method;
    private final Reason reason;

    public ResolutionFailure(URI endpoint, String method, Reason reason, String detail, Throwable cause) {
        super(describe(endpoint, method, reason, detail), cause);
        this.endpoint = endpoint;
        this.method = method;
        this.reason = reason;
    }

    private static String describe(URI endpoint, String method, Reason reason, String detail) {
        StringBuilder builder = new StringBuilder();
        if (method == null) {
            builder.append("invalid declared chain id");
        } else {
            builder.append(method).append(" probe failed");
        }
        builder.append(" [").append(reason.name().toLowerCase(Locale.ROOT)).append(']');
        if (endpoint != null) {
            builder.append(" at ").append(EndpointRedactor.redact(endpoint.toString()));
        }
        if (detail != null && !detail.isBlank()) {
            builder.append(": ").append(detail);
        }
        return builder.toString();
    }
}
