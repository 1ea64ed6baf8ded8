package net.spookly.rpcgate.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class JsonRpcTest {
    @Test
    void requestOmitsMissingParams() {
        ObjectNode request = JsonRpc.request(3, "eth_blockNumber", null);

        assertEquals("2.0", request.get("jsonrpc").asText());
        assertEquals(3L, request.get("id").asLong());
        assertFalse(request.has("params"));
    }

    @Test
    void readsErrorMember() throws Exception {
        JsonNode envelope = JsonRpc.MAPPER.readTree(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"header not found\",\"data\":\"0x\"}}");

        JsonRpcError error = JsonRpc.errorOf(envelope);

        assertEquals(-32000, error.code());
        assertEquals("header not found", error.message());
        assertEquals("0x", error.data().asText());
        assertFalse(JsonRpc.hasResult(envelope));
    }

    @Test
    void nullErrorMeansNoError() throws Exception {
        JsonNode envelope = JsonRpc.MAPPER.readTree("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null,\"error\":null}");

        assertNull(JsonRpc.errorOf(envelope));
        assertTrue(JsonRpc.hasResult(envelope));
    }

    @Test
    void requestFromJsonKeepsParamsAndId() throws Exception {
        JsonRpcRequest request = JsonRpcRequest.fromJson(JsonRpc.MAPPER.readTree(
                "{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"method\":\"eth_getBalance\",\"params\":[\"0x1\",\"latest\"]}"));

        assertEquals("eth_getBalance", request.method());
        assertEquals("abc", request.id().asText());
        assertEquals(2, request.params().size());
    }

    @Test
    void requestFromJsonRejectsArrays() {
        assertThrows(IllegalArgumentException.class,
                () -> JsonRpcRequest.fromJson(JsonRpc.MAPPER.createArrayNode()));
    }
}
