package net.spookly.rpcgate.registry;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import net.spookly.rpcgate.upstream.UpstreamDescriptor;

/**
 * Read accessor over the routing index published by bootstrap. Safe for concurrent readers.
 */
public final class UpstreamRegistry {
    private final RoutingIndex index;

    public UpstreamRegistry(RoutingIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Upstreams for the pair in preference order; empty when the project or chain is unknown.
     */
    public List<UpstreamDescriptor> lookup(String projectId, long chainId) {
        return index.upstreams(projectId, chainId);
    }

    public boolean exists(String projectId) {
        return index.containsProject(projectId);
    }

    public Set<Long> chainIds(String projectId) {
        return index.chainIds(projectId);
    }

    public RoutingIndex index() {
        return index;
    }
}
