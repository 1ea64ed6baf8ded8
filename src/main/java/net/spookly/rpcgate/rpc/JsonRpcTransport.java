package net.spookly.rpcgate.rpc;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Posts JSON-RPC envelopes to upstream endpoints.
 */
public interface JsonRpcTransport extends AutoCloseable {
    /**
     * Post {@code payload} and complete with the reply, or exceptionally with
     * {@link UpstreamTransportException}. Cancelling the returned future aborts the exchange.
     */
    CompletableFuture<UpstreamReply> post(URI endpoint, JsonNode payload, int timeoutMs);

    @Override
    default void close() {
    }
}
