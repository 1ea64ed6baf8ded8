package net.spookly.rpcgate.upstream;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.rpcgate.config.RpcGateConfig;
import net.spookly.rpcgate.util.EndpointRedactor;

/**
 * One configured backend node. The chain id is assigned exactly once during bootstrap.
 */
@Getter
@Accessors(fluent = true)
public final class UpstreamDescriptor {
    public static final String EVM_CHAIN_ID = "evmChainId";

    private final String id;
    private final String projectId;
    private final UpstreamKind kind;
    private final URI endpoint;
    private final Map<String, Object> metadata;
    @Getter(AccessLevel.NONE)
    private volatile Long resolvedChainId;

    public UpstreamDescriptor(String id, String projectId, UpstreamKind kind, URI endpoint, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.metadata = metadata == null ? Map.of() : copyMetadata(metadata);
    }

    /**
     * Build a fresh, unresolved descriptor from its configuration entry.
     */
    public static UpstreamDescriptor fromConfig(String projectId, RpcGateConfig.UpstreamConfig config) {
        return new UpstreamDescriptor(
                config.id,
                projectId,
                UpstreamKind.fromConfig(config.type),
                URI.create(config.endpoint.trim()),
                config.metadata
        );
    }

    /**
     * Raw declared chain id, or {@code null} when the metadata carries none.
     */
    public Object declaredChainId() {
        return metadata.get(EVM_CHAIN_ID);
    }

    /**
     * Chain id assigned at bootstrap.
     *
     * @throws IllegalStateException when the descriptor has not been resolved yet
     */
    public long resolvedChainId() {
        Long value = resolvedChainId;
        if (value == null) {
            throw new IllegalStateException("upstream " + projectId + "/" + id + " has no resolved chain id");
        }
        return value;
    }

    /**
     * Record the resolved chain id; a descriptor accepts exactly one assignment.
     */
    public synchronized void assignChainId(long chainId) {
        if (resolvedChainId != null) {
            throw new IllegalStateException("upstream " + projectId + "/" + id + " already resolved to chain " + resolvedChainId);
        }
        resolvedChainId = chainId;
    }

    public String redactedEndpoint() {
        return EndpointRedactor.redact(endpoint.toString());
    }

    @Override
    public String toString() {
        return projectId + "/" + id + " (" + redactedEndpoint() + ")";
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
        // Map.copyOf rejects null values, which YAML produces for empty keys.
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
