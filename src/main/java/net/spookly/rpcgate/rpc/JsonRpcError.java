package net.spookly.rpcgate.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Error object of a JSON-RPC response.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class JsonRpcError {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    private final int code;
    private final String message;
    private final JsonNode data;

    static JsonRpcError fromJson(JsonNode error) {
        if (!error.isObject()) {
            return new JsonRpcError(INTERNAL_ERROR, error.asText(), null);
        }
        JsonNode code = error.get("code");
        JsonNode message = error.get("message");
        JsonNode data = error.get("data");
        return new JsonRpcError(
                code != null && code.canConvertToInt() ? code.asInt() : INTERNAL_ERROR,
                message == null || message.isNull() ? null : message.asText(),
                data == null || data.isNull() ? null : data
        );
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonRpc.MAPPER.createObjectNode();
        node.put("code", code);
        node.put("message", message);
        if (data != null) {
            node.set("data", data);
        }
        return node;
    }

    @Override
    public String toString() {
        return "JSON-RPC error " + code + (message == null ? "" : ": " + message);
    }
}
