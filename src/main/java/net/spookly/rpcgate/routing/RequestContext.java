package net.spookly.rpcgate.routing;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.rpcgate.rpc.JsonRpcRequest;

/**
 * Per-request routing state derived from the request path and the JSON-RPC body.
 */
@Getter
@Accessors(fluent = true)
public final class RequestContext {
    private final String projectId;
    /**
     * Raw chain id path segment; parsed by the router.
     */
    private final String chainId;
    private final JsonRpcRequest request;
    private volatile RequestPhase phase = RequestPhase.RECEIVED;
    private volatile String upstreamId;

    public RequestContext(String projectId, String chainId, JsonRpcRequest request) {
        this.projectId = projectId;
        this.chainId = chainId;
        this.request = Objects.requireNonNull(request, "request");
    }

    public String rpcMethod() {
        return request.method();
    }

    public JsonNode rpcParams() {
        return request.params();
    }

    public JsonNode rpcId() {
        return request.id();
    }

    void advance(RequestPhase next) {
        if (phase != RequestPhase.FAILED) {
            phase = next;
        }
    }

    void fail() {
        phase = RequestPhase.FAILED;
    }

    void selectUpstream(String upstreamId) {
        this.upstreamId = upstreamId;
        advance(RequestPhase.UPSTREAM_SELECTED);
    }

    @Override
    public String toString() {
        return rpcMethod() + " " + projectId + "/" + chainId;
    }
}
