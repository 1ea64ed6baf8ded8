package net.spookly.rpcgate.upstream;

import java.util.concurrent.CompletableFuture;

/**
 * Establishes the chain id an upstream serves.
 */
public interface ChainIdentityResolver {
    /**
     * Complete with the upstream's chain id, or exceptionally with {@link ResolutionFailure}.
     * Implementations do not retry.
     */
    CompletableFuture<Long> resolve(UpstreamDescriptor upstream, int timeoutMs);
}
