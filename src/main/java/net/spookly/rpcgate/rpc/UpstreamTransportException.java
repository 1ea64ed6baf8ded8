package net.spookly.rpcgate.rpc;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Transport-level failure talking to an upstream: no reply, no reply in time, or a reply that is not JSON.
 */
@Getter
@Accessors(fluent = true)
public class UpstreamTransportException extends RuntimeException {
    public enum Failure {
        UNREACHABLE,
        TIMEOUT,
        MALFORMED_BODY
    }

    private final Failure failure;
    /**
     * HTTP status of the reply, or -1 when none was received.
     */
    private final int statusCode;

    public UpstreamTransportException(Failure failure, String message, Throwable cause) {
        this(failure, -1, message, cause);
    }

    public UpstreamTransportException(Failure failure, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.statusCode = statusCode;
    }
}
