package net.spookly.rpcgate.routing;

import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answers one inbound JSON-RPC call.
 */
@FunctionalInterface
public interface RoutingFunction {
    /**
     * Complete with the client-visible response body, or exceptionally with {@link RoutingException}.
     * Cancelling the returned future releases any outstanding upstream call.
     */
    CompletableFuture<JsonNode> route(RequestContext context);
}
