package net.spookly.rpcgate.bootstrap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.config.RpcGateConfig;
import net.spookly.rpcgate.registry.RoutingIndex;
import net.spookly.rpcgate.upstream.ChainIdentityResolver;
import net.spookly.rpcgate.upstream.UpstreamDescriptor;

/**
 * Resolves every configured upstream concurrently and publishes a complete routing index, or fails as a whole.
 */
@Slf4j
public final class BootstrapOrchestrator {
    /**
     * Slack on top of the probe timeout before an unfinished resolution is abandoned.
     */
    private static final long BARRIER_SLACK_MS = 2_000;

    private final ChainIdentityResolver resolver;
    private final int probeTimeoutMs;

    public BootstrapOrchestrator(ChainIdentityResolver resolver, int probeTimeoutMs) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        if (probeTimeoutMs <= 0) {
            throw new IllegalArgumentException("probeTimeoutMs must be greater than 0");
        }
        this.probeTimeoutMs = probeTimeoutMs;
    }

    /**
     * Resolve all upstreams and build the routing index.
     *
     * @throws BootstrapException naming the first failing upstream in configuration order
     */
    public RoutingIndex bootstrap(List<RpcGateConfig.ProjectConfig> projects) {
        List<RpcGateConfig.ProjectConfig> configured = projects == null ? List.of() : projects;
        List<UpstreamDescriptor> slots = new ArrayList<>();
        for (RpcGateConfig.ProjectConfig project : configured) {
            if (project.upstreams == null) {
                continue;
            }
            for (RpcGateConfig.UpstreamConfig upstream : project.upstreams) {
                slots.add(UpstreamDescriptor.fromConfig(project.id, upstream));
            }
        }

        AtomicReferenceArray<Long> resolved = new AtomicReferenceArray<>(slots.size());
        AtomicReferenceArray<Throwable> failures = new AtomicReferenceArray<>(slots.size());
        awaitAll(slots, resolved, failures);

        BootstrapException failure = null;
        for (int i = 0; i < slots.size(); i++) {
            UpstreamDescriptor upstream = slots.get(i);
            Throwable error = failures.get(i);
            if (error == null && resolved.get(i) == null) {
                error = new TimeoutException("chain identity resolution did not complete");
            }
            if (error == null) {
                continue;
            }
            log.warn("Upstream {} failed chain identity resolution: {}", upstream, error.getMessage());
            if (failure == null) {
                failure = new BootstrapException(upstream.projectId(), upstream.id(), error);
            } else {
                failure.addSuppressed(new BootstrapException(upstream.projectId(), upstream.id(), error));
            }
        }
        if (failure != null) {
            throw failure;
        }

        RoutingIndex.Builder builder = RoutingIndex.builder();
        for (RpcGateConfig.ProjectConfig project : configured) {
            builder.project(project.id);
        }
        for (int i = 0; i < slots.size(); i++) {
            UpstreamDescriptor upstream = slots.get(i);
            upstream.assignChainId(resolved.get(i));
            builder.add(upstream);
            log.info("Upstream {} serves chain {}{}", upstream, upstream.resolvedChainId(),
                    upstream.declaredChainId() == null ? " (probed)" : " (declared)");
        }
        RoutingIndex index = builder.build();
        log.info("Bootstrap complete: {} project(s), {} upstream(s)", index.projects().size(), slots.size());
        return index;
    }

    private void awaitAll(List<UpstreamDescriptor> slots,
                          AtomicReferenceArray<Long> resolved,
                          AtomicReferenceArray<Throwable> failures) {
        if (slots.isEmpty()) {
            return;
        }
        CompletableFuture<?>[] tasks = new CompletableFuture<?>[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            int slot = i;
            CompletableFuture<Long> resolution;
            try {
                resolution = resolver.resolve(slots.get(i), probeTimeoutMs);
            } catch (RuntimeException e) {
                resolution = CompletableFuture.failedFuture(e);
            }
            tasks[i] = resolution.handle((chainId, error) -> {
                if (error != null) {
                    failures.set(slot, unwrap(error));
                } else if (chainId == null) {
                    failures.set(slot, new IllegalStateException("resolver returned no chain id"));
                } else {
                    resolved.set(slot, chainId);
                }
                return null;
            });
        }
        try {
            CompletableFuture.allOf(tasks).get(probeTimeoutMs + BARRIER_SLACK_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Chain identity resolution exceeded {}ms; abandoning unfinished probes", probeTimeoutMs + BARRIER_SLACK_MS);
            for (CompletableFuture<?> task : tasks) {
                task.cancel(true);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BootstrapException("cannot bootstrap: interrupted while resolving upstreams", e);
        } catch (ExecutionException e) {
            throw new BootstrapException("cannot bootstrap: resolution failed unexpectedly", e.getCause());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
