package net.spookly.rpcgate.upstream;

import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.rpc.JsonRpc;
import net.spookly.rpcgate.rpc.JsonRpcError;
import net.spookly.rpcgate.rpc.JsonRpcTransport;
import net.spookly.rpcgate.rpc.UpstreamReply;
import net.spookly.rpcgate.rpc.UpstreamTransportException;

/**
 * Resolves chain ids from declared {@code evmChainId} metadata, or with a single {@code eth_chainId} probe.
 */
@Slf4j
public final class EvmChainIdentityResolver implements ChainIdentityResolver {
    public static final String METHOD = "eth_chainId";
    private static final long PROBE_ID = 1L;

    private final JsonRpcTransport transport;

    public EvmChainIdentityResolver(JsonRpcTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public CompletableFuture<Long> resolve(UpstreamDescriptor upstream, int timeoutMs) {
        Objects.requireNonNull(upstream, "upstream");
        switch (upstream.kind()) {
            case EVM:
                return resolveEvm(upstream, timeoutMs);
            default:
                return CompletableFuture.failedFuture(
                        new IllegalStateException("no chain identity resolution for upstream kind " + upstream.kind()));
        }
    }

    private CompletableFuture<Long> resolveEvm(UpstreamDescriptor upstream, int timeoutMs) {
        Object declared = upstream.declaredChainId();
        if (declared != null) {
            try {
                return CompletableFuture.completedFuture(parseDeclared(declared));
            } catch (IllegalArgumentException e) {
                return CompletableFuture.failedFuture(new ResolutionFailure(
                        upstream.endpoint(),
                        null,
                        ResolutionFailure.Reason.INVALID_METADATA,
                        UpstreamDescriptor.EVM_CHAIN_ID + " must be a positive integer, got '" + declared + "'",
                        e
                ));
            }
        }
        log.debug("Probing {} with {}", upstream, METHOD);
        ObjectNode payload = JsonRpc.request(PROBE_ID, METHOD, JsonRpc.MAPPER.createArrayNode());
        CompletableFuture<Long> result = new CompletableFuture<>();
        CompletableFuture<UpstreamReply> reply;
        try {
            reply = transport.post(upstream.endpoint(), payload, timeoutMs);
        } catch (RuntimeException e) {
            result.completeExceptionally(failure(upstream, ResolutionFailure.Reason.UNREACHABLE, e.getMessage(), e));
            return result;
        }
        reply.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(translate(upstream, error));
                return;
            }
            try {
                result.complete(decode(upstream, response));
            } catch (ResolutionFailure e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    static long parseDeclared(Object declared) {
        BigInteger value;
        if (declared instanceof Integer || declared instanceof Long || declared instanceof Short) {
            value = BigInteger.valueOf(((Number) declared).longValue());
        } else if (declared instanceof BigInteger) {
            value = (BigInteger) declared;
        } else if (declared instanceof String) {
            value = parseInteger(((String) declared).trim());
        } else {
            throw new IllegalArgumentException("unsupported value type " + declared.getClass().getSimpleName());
        }
        return requirePositiveLong(value);
    }

    private long decode(UpstreamDescriptor upstream, UpstreamReply reply) {
        if (!reply.successful()) {
            throw failure(upstream, ResolutionFailure.Reason.HTTP_STATUS, "HTTP " + reply.statusCode(), null);
        }
        JsonNode body = reply.body();
        JsonRpcError error = JsonRpc.errorOf(body);
        if (error != null) {
            throw failure(upstream, ResolutionFailure.Reason.RPC_ERROR, error.toString(), null);
        }
        if (!JsonRpc.hasResult(body)) {
            throw failure(upstream, ResolutionFailure.Reason.MALFORMED_RESPONSE, "reply has no result member", null);
        }
        JsonNode result = body.get("result");
        try {
            if (result.isTextual()) {
                return requirePositiveLong(parseInteger(result.asText().trim()));
            }
            if (result.isIntegralNumber()) {
                return requirePositiveLong(result.bigIntegerValue());
            }
        } catch (IllegalArgumentException e) {
            throw failure(upstream, ResolutionFailure.Reason.INVALID_RESULT, "cannot decode result " + result, e);
        }
        throw failure(upstream, ResolutionFailure.Reason.INVALID_RESULT, "cannot decode result " + result, null);
    }

    private ResolutionFailure translate(UpstreamDescriptor upstream, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof UpstreamTransportException) {
            UpstreamTransportException transportError = (UpstreamTransportException) cause;
            switch (transportError.failure()) {
                case TIMEOUT:
                    return failure(upstream, ResolutionFailure.Reason.TIMEOUT, cause.getMessage(), cause);
                case MALFORMED_BODY:
                    int status = transportError.statusCode();
                    if (status > 0 && (status < 200 || status >= 300)) {
                        return failure(upstream, ResolutionFailure.Reason.HTTP_STATUS, "HTTP " + status, cause);
                    }
                    return failure(upstream, ResolutionFailure.Reason.MALFORMED_RESPONSE, cause.getMessage(), cause);
                default:
                    return failure(upstream, ResolutionFailure.Reason.UNREACHABLE, cause.getMessage(), cause);
            }
        }
        return failure(upstream, ResolutionFailure.Reason.UNREACHABLE, String.valueOf(cause.getMessage()), cause);
    }

    private static ResolutionFailure failure(UpstreamDescriptor upstream,
                                             ResolutionFailure.Reason reason,
                                             String detail,
                                             Throwable cause) {
        return new ResolutionFailure(upstream.endpoint(), METHOD, reason, detail, cause);
    }

    private static BigInteger parseInteger(String raw) {
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("empty value");
        }
        if (raw.startsWith("0x") || raw.startsWith("0X")) {
            String digits = raw.substring(2);
            if (digits.isEmpty()) {
                throw new IllegalArgumentException("empty hex value");
            }
            return new BigInteger(digits, 16);
        }
        return new BigInteger(raw, 10);
    }

    private static long requirePositiveLong(BigInteger value) {
        if (value.signum() <= 0 || value.bitLength() > 63) {
            throw new IllegalArgumentException("chain id out of range: " + value);
        }
        return value.longValue();
    }
}
