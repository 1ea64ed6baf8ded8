package net.spookly.rpcgate.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.util.EndpointRedactor;

/**
 * JSON-RPC transport over the JDK HTTP client with a hard per-call deadline.
 */
@Slf4j
public final class HttpJsonRpcTransport implements JsonRpcTransport {
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final ExecutorService executor;
    private final ScheduledExecutorService timeouts;
    private final HttpClient client;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HttpJsonRpcTransport() {
        this.executor = Executors.newCachedThreadPool(threadFactory("rpcgate-upstream"));
        this.timeouts = Executors.newSingleThreadScheduledExecutor(threadFactory("rpcgate-upstream-timeout"));
        this.client = HttpClient.newBuilder()
                .executor(executor)
                .connectTimeout(CONNECT_TIMEOUT)
                // A followed 301/302 would turn the POST into a bodyless GET.
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public CompletableFuture<UpstreamReply> post(URI endpoint, JsonNode payload, int timeoutMs) {
        CompletableFuture<UpstreamReply> result = new CompletableFuture<>();
        byte[] body;
        try {
            body = JsonRpc.MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            result.completeExceptionally(new IllegalArgumentException("payload is not serializable", e));
            return result;
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (timeoutMs > 0) {
            request.timeout(Duration.ofMillis(timeoutMs));
        }
        CompletableFuture<HttpResponse<byte[]>> exchange =
                client.sendAsync(request.build(), HttpResponse.BodyHandlers.ofByteArray());
        final ScheduledFuture<?> timeoutFuture;
        if (timeoutMs > 0) {
            timeoutFuture = timeouts.schedule(() -> {
                if (result.completeExceptionally(new UpstreamTransportException(
                        UpstreamTransportException.Failure.TIMEOUT,
                        "no reply from " + EndpointRedactor.redact(endpoint.toString()) + " within " + timeoutMs + "ms",
                        null))) {
                    exchange.cancel(true);
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);
        } else {
            timeoutFuture = null;
        }
        exchange.whenComplete((response, error) -> {
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            if (error != null) {
                result.completeExceptionally(translate(endpoint, error, timeoutMs));
                return;
            }
            try {
                result.complete(toReply(endpoint, response));
            } catch (UpstreamTransportException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((reply, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        timeouts.shutdownNow();
        executor.shutdownNow();
    }

    private UpstreamReply toReply(URI endpoint, HttpResponse<byte[]> response) {
        byte[] bytes = response.body();
        int status = response.statusCode();
        if (bytes == null || bytes.length == 0) {
            throw new UpstreamTransportException(
                    UpstreamTransportException.Failure.MALFORMED_BODY,
                    status,
                    "empty body from " + EndpointRedactor.redact(endpoint.toString()) + " (HTTP " + status + ")",
                    null
            );
        }
        try {
            JsonNode tree = JsonRpc.MAPPER.readTree(bytes);
            if (tree == null || tree.isMissingNode()) {
                throw new UpstreamTransportException(
                        UpstreamTransportException.Failure.MALFORMED_BODY,
                        status,
                        "empty body from " + EndpointRedactor.redact(endpoint.toString()) + " (HTTP " + status + ")",
                        null
                );
            }
            return new UpstreamReply(status, tree);
        } catch (IOException e) {
            throw new UpstreamTransportException(
                    UpstreamTransportException.Failure.MALFORMED_BODY,
                    status,
                    "non-JSON body from " + EndpointRedactor.redact(endpoint.toString()) + " (HTTP " + status + ")",
                    e
            );
        }
    }

    private Throwable translate(URI endpoint, Throwable error, int timeoutMs) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            return cause;
        }
        String target = EndpointRedactor.redact(endpoint.toString());
        if (cause instanceof HttpTimeoutException) {
            return new UpstreamTransportException(
                    UpstreamTransportException.Failure.TIMEOUT,
                    "no reply from " + target + " within " + timeoutMs + "ms",
                    cause
            );
        }
        log.debug("Upstream {} unreachable: {}", target, cause.toString());
        return new UpstreamTransportException(
                UpstreamTransportException.Failure.UNREACHABLE,
                "cannot reach " + target + ": " + describe(cause),
                cause
        );
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + ": " + message;
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
