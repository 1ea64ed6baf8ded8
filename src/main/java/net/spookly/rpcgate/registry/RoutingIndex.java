package net.spookly.rpcgate.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import net.spookly.rpcgate.upstream.UpstreamDescriptor;

/**
 * Immutable (project, chain id) to ordered upstream list mapping produced by a successful bootstrap.
 *
 * <p>Every bucket is non-empty; a missing bucket means no upstream serves that pair.
 */
public final class RoutingIndex {
    private final Set<String> projects;
    private final Map<String, Map<Long, List<UpstreamDescriptor>>> buckets;

    private RoutingIndex(Set<String> projects, Map<String, Map<Long, List<UpstreamDescriptor>>> buckets) {
        this.projects = projects;
        this.buckets = buckets;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean containsProject(String projectId) {
        return projectId != null && projects.contains(projectId);
    }

    public Set<String> projects() {
        return projects;
    }

    /**
     * Upstreams serving the pair in configuration order, or an empty list.
     */
    public List<UpstreamDescriptor> upstreams(String projectId, long chainId) {
        Map<Long, List<UpstreamDescriptor>> byChain = projectId == null ? null : buckets.get(projectId);
        if (byChain == null) {
            return List.of();
        }
        List<UpstreamDescriptor> bucket = byChain.get(chainId);
        return bucket == null ? List.of() : bucket;
    }

    /**
     * Chain ids with at least one upstream in the project, in first-seen order.
     */
    public Set<Long> chainIds(String projectId) {
        Map<Long, List<UpstreamDescriptor>> byChain = projectId == null ? null : buckets.get(projectId);
        return byChain == null ? Set.of() : byChain.keySet();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RoutingIndex)) {
            return false;
        }
        return toKeys().equals(((RoutingIndex) other).toKeys());
    }

    @Override
    public int hashCode() {
        return toKeys().hashCode();
    }

    @Override
    public String toString() {
        return "RoutingIndex" + toKeys();
    }

    /**
     * Content view keyed by ids, used to compare indexes built from separate descriptor instances.
     */
    private Map<String, Map<Long, List<String>>> toKeys() {
        Map<String, Map<Long, List<String>>> keys = new LinkedHashMap<>();
        for (String project : projects) {
            Map<Long, List<String>> chains = new LinkedHashMap<>();
            for (Map.Entry<Long, List<UpstreamDescriptor>> entry : buckets.getOrDefault(project, Map.of()).entrySet()) {
                List<String> ids = new ArrayList<>();
                for (UpstreamDescriptor upstream : entry.getValue()) {
                    ids.add(upstream.id());
                }
                chains.put(entry.getKey(), ids);
            }
            keys.put(project, chains);
        }
        return keys;
    }

    /**
     * Accumulates resolved upstreams in configuration order. Not thread-safe.
     */
    public static final class Builder {
        private final Set<String> projects = new LinkedHashSet<>();
        private final Map<String, Map<Long, List<UpstreamDescriptor>>> buckets = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder project(String projectId) {
            projects.add(Objects.requireNonNull(projectId, "projectId"));
            return this;
        }

        /**
         * Append a resolved upstream to the bucket of its project and chain id.
         */
        public Builder add(UpstreamDescriptor upstream) {
            Objects.requireNonNull(upstream, "upstream");
            long chainId = upstream.resolvedChainId();
            project(upstream.projectId());
            buckets.computeIfAbsent(upstream.projectId(), key -> new LinkedHashMap<>())
                    .computeIfAbsent(chainId, key -> new ArrayList<>())
                    .add(upstream);
            return this;
        }

        public RoutingIndex build() {
            Map<String, Map<Long, List<UpstreamDescriptor>>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, Map<Long, List<UpstreamDescriptor>>> project : buckets.entrySet()) {
                Map<Long, List<UpstreamDescriptor>> chains = new LinkedHashMap<>();
                for (Map.Entry<Long, List<UpstreamDescriptor>> chain : project.getValue().entrySet()) {
                    chains.put(chain.getKey(), List.copyOf(chain.getValue()));
                }
                frozen.put(project.getKey(), Collections.unmodifiableMap(chains));
            }
            return new RoutingIndex(
                    Collections.unmodifiableSet(new LinkedHashSet<>(projects)),
                    Collections.unmodifiableMap(frozen)
            );
        }
    }
}
