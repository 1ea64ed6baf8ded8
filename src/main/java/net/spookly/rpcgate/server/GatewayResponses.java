package net.spookly.rpcgate.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import net.spookly.rpcgate.rpc.JsonRpc;
import net.spookly.rpcgate.rpc.JsonRpcError;

/**
 * Builds the JSON bodies and HTTP responses written by the gateway.
 */
final class GatewayResponses {
    private GatewayResponses() {
    }

    static FullHttpResponse json(HttpResponseStatus status, JsonNode body) {
        byte[] bytes;
        try {
            bytes = JsonRpc.MAPPER.writeValueAsBytes(body == null ? NullNode.getInstance() : body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("response body is not serializable", e);
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        return response;
    }

    /**
     * JSON-RPC error envelope echoing the client's id. {@code kind} is added as {@code data.kind} unless the
     * error already carries data of its own.
     */
    static ObjectNode errorBody(JsonNode id, JsonRpcError error, String kind) {
        ObjectNode body = JsonRpc.MAPPER.createObjectNode();
        body.put("jsonrpc", JsonRpc.VERSION);
        body.set("id", id == null ? NullNode.getInstance() : id);
        ObjectNode errorNode = error.toJson();
        if (!errorNode.has("data") && kind != null) {
            errorNode.putObject("data").put("kind", kind);
        }
        body.set("error", errorNode);
        return body;
    }

    static ObjectNode errorBody(JsonNode id, int code, String message, String kind) {
        return errorBody(id, new JsonRpcError(code, message, null), kind);
    }

    static ObjectNode healthBody() {
        ObjectNode body = JsonRpc.MAPPER.createObjectNode();
        body.put("status", "OK");
        return body;
    }
}
