package net.spookly.rpcgate.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Inbound JSON-RPC call as sent by a gateway client.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class JsonRpcRequest {
    private final String method;
    /**
     * Forwarded verbatim; {@code null} when the client sent no params member.
     */
    private final JsonNode params;
    /**
     * Client correlation id; {@code null} when absent.
     */
    private final JsonNode id;

    /**
     * Read the members of a request object, leaving validation of {@code method} to the router.
     */
    public static JsonRpcRequest fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("JSON-RPC request must be a JSON object");
        }
        JsonNode method = body.get("method");
        return new JsonRpcRequest(
                method == null || !method.isTextual() ? null : method.asText(),
                body.get("params"),
                body.get("id")
        );
    }
}
