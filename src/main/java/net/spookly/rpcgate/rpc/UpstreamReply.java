package net.spookly.rpcgate.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * HTTP status and parsed JSON body returned by an upstream.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class UpstreamReply {
    private final int statusCode;
    private final JsonNode body;

    public boolean successful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
