package net.spookly.rpcgate.routing;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.config.ConfigDefaults;
import net.spookly.rpcgate.config.RpcGateConfig;
import net.spookly.rpcgate.registry.UpstreamRegistry;
import net.spookly.rpcgate.rpc.JsonRpc;
import net.spookly.rpcgate.rpc.JsonRpcError;
import net.spookly.rpcgate.rpc.JsonRpcTransport;
import net.spookly.rpcgate.rpc.UpstreamReply;
import net.spookly.rpcgate.rpc.UpstreamTransportException;
import net.spookly.rpcgate.upstream.UpstreamDescriptor;

/**
 * Resolves (project, chain) to an upstream, forwards the call and unwraps the upstream {@code result}.
 */
@Slf4j
public final class RequestRouter implements RoutingFunction {
    private final UpstreamRegistry registry;
    private final JsonRpcTransport transport;
    private final Map<String, SelectionPolicy> policies;
    private final int forwardTimeoutMs;
    private final AtomicLong wireIds = new AtomicLong();
    private final Map<String, AtomicInteger> roundRobinCounters = new ConcurrentHashMap<>();

    public RequestRouter(UpstreamRegistry registry,
                         JsonRpcTransport transport,
                         Map<String, SelectionPolicy> policies,
                         int forwardTimeoutMs) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.policies = policies == null ? Collections.emptyMap() : Map.copyOf(policies);
        if (forwardTimeoutMs <= 0) {
            throw new IllegalArgumentException("forwardTimeoutMs must be greater than 0");
        }
        this.forwardTimeoutMs = forwardTimeoutMs;
    }

    public static RequestRouter fromConfig(RpcGateConfig config, UpstreamRegistry registry, JsonRpcTransport transport) {
        Map<String, SelectionPolicy> policies = new HashMap<>();
        if (config.projects != null) {
            for (RpcGateConfig.ProjectConfig project : config.projects) {
                policies.put(project.id, SelectionPolicy.fromConfig(project.selectionPolicy));
            }
        }
        return new RequestRouter(registry, transport, policies, ConfigDefaults.forwardTimeoutMs(config));
    }

    @Override
    public CompletableFuture<JsonNode> route(RequestContext context) {
        Objects.requireNonNull(context, "context");
        UpstreamDescriptor upstream;
        try {
            upstream = select(context);
        } catch (RoutingException e) {
            context.fail();
            log.debug("Rejected {}: {}", context, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return forward(context, upstream);
    }

    /**
     * Pick the upstream for a request without contacting it.
     */
    UpstreamDescriptor select(RequestContext context) {
        String projectId = context.projectId();
        if (projectId == null || !registry.exists(projectId)) {
            throw new RoutingException(RoutingErrorKind.UNKNOWN_PROJECT, "unknown project: " + projectId);
        }
        context.advance(RequestPhase.PROJECT_RESOLVED);
        String method = context.rpcMethod();
        if (method == null || method.isBlank()) {
            throw new RoutingException(RoutingErrorKind.INVALID_REQUEST, "method is required");
        }
        long chainId = parseChainId(context);
        List<UpstreamDescriptor> candidates = registry.lookup(projectId, chainId);
        if (candidates.isEmpty()) {
            throw new RoutingException(
                    RoutingErrorKind.UNSUPPORTED_CHAIN,
                    "project " + projectId + " has no upstream for chain " + chainId
                            + " (available: " + registry.chainIds(projectId) + ")"
            );
        }
        UpstreamDescriptor upstream = pick(projectId, chainId, candidates);
        context.selectUpstream(upstream.id());
        return upstream;
    }

    private CompletableFuture<JsonNode> forward(RequestContext context, UpstreamDescriptor upstream) {
        ObjectNode payload = JsonRpc.request(wireIds.incrementAndGet(), context.rpcMethod(), context.rpcParams());
        log.debug("Forwarding {} to {}", context, upstream);
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        CompletableFuture<UpstreamReply> exchange;
        try {
            exchange = transport.post(upstream.endpoint(), payload, forwardTimeoutMs);
        } catch (RuntimeException e) {
            context.fail();
            result.completeExceptionally(RoutingException.unreachable(
                    "cannot reach upstream " + upstream.id() + ": " + e.getMessage(), false, e));
            return result;
        }
        context.advance(RequestPhase.FORWARDED);
        exchange.whenComplete((reply, error) -> {
            if (error != null) {
                Throwable failure = translate(upstream, error);
                if (!(failure instanceof CancellationException)) {
                    log.warn("Upstream {} failed for {}: {}", upstream, context.rpcMethod(), failure.getMessage());
                }
                result.completeExceptionally(failure);
                return;
            }
            try {
                JsonNode normalized = normalize(upstream, reply);
                context.advance(RequestPhase.RESPONSE_NORMALIZED);
                context.advance(RequestPhase.COMPLETED);
                result.complete(normalized);
            } catch (RoutingException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((value, error) -> {
            if (error != null) {
                context.fail();
            }
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private JsonNode normalize(UpstreamDescriptor upstream, UpstreamReply reply) {
        JsonNode body = reply.body();
        JsonRpcError error = JsonRpc.errorOf(body);
        if (error != null) {
            throw RoutingException.upstreamRpcError("upstream " + upstream.id() + " returned " + error, error);
        }
        if (!reply.successful()) {
            throw RoutingException.unreachable(
                    "upstream " + upstream.id() + " answered HTTP " + reply.statusCode(), false, null);
        }
        if (!JsonRpc.hasResult(body)) {
            throw RoutingException.unreachable(
                    "upstream " + upstream.id() + " reply carries neither result nor error", false, null);
        }
        return body.get("result");
    }

    private Throwable translate(UpstreamDescriptor upstream, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException || cause instanceof RoutingException) {
            return cause;
        }
        boolean timeout = cause instanceof UpstreamTransportException
                && ((UpstreamTransportException) cause).failure() == UpstreamTransportException.Failure.TIMEOUT;
        String message = timeout
                ? "upstream " + upstream.id() + " did not answer within " + forwardTimeoutMs + "ms"
                : "cannot reach upstream " + upstream.id() + ": " + cause.getMessage();
        return RoutingException.unreachable(message, timeout, cause);
    }

    private UpstreamDescriptor pick(String projectId, long chainId, List<UpstreamDescriptor> candidates) {
        SelectionPolicy policy = policies.getOrDefault(projectId, SelectionPolicy.FIRST);
        if (policy == SelectionPolicy.ROUND_ROBIN && candidates.size() > 1) {
            AtomicInteger counter = roundRobinCounters.computeIfAbsent(projectId + "/" + chainId, key -> new AtomicInteger());
            int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
            return candidates.get(index);
        }
        return candidates.get(0);
    }

    private static long parseChainId(RequestContext context) {
        String raw = context.chainId();
        try {
            long chainId = Long.parseLong(raw);
            if (chainId > 0) {
                return chainId;
            }
        } catch (NumberFormatException e) {
            throw new RoutingException(
                    RoutingErrorKind.UNSUPPORTED_CHAIN,
                    "chain id must be a positive decimal integer: " + raw,
                    null,
                    false,
                    e
            );
        }
        throw new RoutingException(RoutingErrorKind.UNSUPPORTED_CHAIN, "chain id must be a positive decimal integer: " + raw);
    }
}
