package net.spookly.rpcgate.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON-RPC 2.0 envelope helpers shared by the prober and the request router.
 */
public final class JsonRpc {
    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final String VERSION = "2.0";

    private JsonRpc() {
    }

    /**
     * Build a request envelope. A {@code null} or missing {@code params} member is left out.
     */
    public static ObjectNode request(long id, String method, JsonNode params) {
        ObjectNode envelope = MAPPER.createObjectNode();
        envelope.put("jsonrpc", VERSION);
        envelope.put("id", id);
        envelope.put("method", method);
        if (params != null && !params.isMissingNode()) {
            envelope.set("params", params);
        }
        return envelope;
    }

    /**
     * Error member of a response envelope, or {@code null} when the envelope carries none.
     */
    public static JsonRpcError errorOf(JsonNode envelope) {
        if (envelope == null || !envelope.isObject()) {
            return null;
        }
        JsonNode error = envelope.get("error");
        if (error == null || error.isNull()) {
            return null;
        }
        return JsonRpcError.fromJson(error);
    }

    /**
     * True when the envelope is an object with a {@code result} member, even a JSON null one.
     */
    public static boolean hasResult(JsonNode envelope) {
        return envelope != null && envelope.isObject() && envelope.has("result");
    }
}
