package net.spookly.rpcgate.server;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.routing.RequestContext;
import net.spookly.rpcgate.routing.RoutingException;
import net.spookly.rpcgate.rpc.JsonRpc;
import net.spookly.rpcgate.rpc.JsonRpcError;
import net.spookly.rpcgate.rpc.JsonRpcRequest;

/**
 * Serves {@code GET /healthcheck} and {@code POST /{projectId}/{chainId}}, one request at a time per connection.
 */
@Slf4j
final class GatewayRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    static final String HEALTH_PATH = "/healthcheck";

    private final GatewayServer server;
    private final Queue<FullHttpRequest> queued = new ArrayDeque<>();
    private CompletableFuture<JsonNode> pending;

    GatewayRequestHandler(GatewayServer server) {
        this.server = Objects.requireNonNull(server, "server");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (pending != null) {
            // Pipelined: answered in order once the current call completes.
            queued.add(request.retainedDuplicate());
            return;
        }
        handle(ctx, request);
    }

    private void handle(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (!request.decoderResult().isSuccess()) {
            write(ctx, HttpResponseStatus.BAD_REQUEST,
                    GatewayResponses.errorBody(null, JsonRpcError.INVALID_REQUEST, "malformed HTTP request", "INVALID_REQUEST"),
                    false);
            return;
        }
        if (!server.accepting()) {
            write(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE,
                    GatewayResponses.errorBody(null, JsonRpcError.INTERNAL_ERROR, "gateway is shutting down", "SHUTTING_DOWN"),
                    false);
            return;
        }
        String path = new QueryStringDecoder(request.uri()).path();
        if (HEALTH_PATH.equals(path)) {
            if (HttpMethod.GET.equals(request.method())) {
                write(ctx, HttpResponseStatus.OK, GatewayResponses.healthBody(), keepAlive);
            } else {
                methodNotAllowed(ctx, "GET", keepAlive);
            }
            return;
        }
        List<String> segments = segments(path);
        if (segments.size() != 2) {
            write(ctx, HttpResponseStatus.NOT_FOUND,
                    GatewayResponses.errorBody(null, JsonRpcError.METHOD_NOT_FOUND, "no route for " + path, "NOT_FOUND"),
                    keepAlive);
            return;
        }
        if (!HttpMethod.POST.equals(request.method())) {
            methodNotAllowed(ctx, "POST", keepAlive);
            return;
        }
        JsonNode body;
        try (ByteBufInputStream in = new ByteBufInputStream(request.content())) {
            body = JsonRpc.MAPPER.readTree(in);
        } catch (IOException e) {
            write(ctx, HttpResponseStatus.BAD_REQUEST,
                    GatewayResponses.errorBody(null, JsonRpcError.PARSE_ERROR, "request body is not valid JSON", "INVALID_REQUEST"),
                    keepAlive);
            return;
        }
        if (body == null || !body.isObject()) {
            String message = body != null && body.isArray()
                    ? "batch requests are not supported"
                    : "request body must be a JSON-RPC object";
            write(ctx, HttpResponseStatus.BAD_REQUEST,
                    GatewayResponses.errorBody(null, JsonRpcError.INVALID_REQUEST, message, "INVALID_REQUEST"),
                    keepAlive);
            return;
        }
        dispatch(ctx, new RequestContext(segments.get(0), segments.get(1), JsonRpcRequest.fromJson(body)), keepAlive);
    }

    private void dispatch(ChannelHandlerContext ctx, RequestContext context, boolean keepAlive) {
        long startedAt = System.nanoTime();
        CompletableFuture<JsonNode> future;
        server.requestStarted();
        try {
            future = server.router().route(context);
        } catch (RuntimeException e) {
            server.requestFinished();
            log.error("Router failed for {}", context, e);
            write(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    GatewayResponses.errorBody(context.rpcId(), JsonRpcError.INTERNAL_ERROR, "internal error", "INTERNAL"),
                    keepAlive);
            return;
        }
        pending = future;
        future.whenComplete((result, error) -> ctx.executor().execute(() -> {
            server.requestFinished();
            pending = null;
            long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;
            if (error == null) {
                log.debug("{} answered by {} in {}ms", context, context.upstreamId(), elapsedMs);
                write(ctx, HttpResponseStatus.OK, result, keepAlive);
            } else {
                writeFailure(ctx, context, error, keepAlive, elapsedMs);
            }
            drainQueue(ctx);
        }));
    }

    private void drainQueue(ChannelHandlerContext ctx) {
        while (pending == null) {
            FullHttpRequest next = queued.poll();
            if (next == null) {
                return;
            }
            try {
                if (ctx.channel().isActive()) {
                    handle(ctx, next);
                }
            } finally {
                next.release();
            }
        }
    }

    private void writeFailure(ChannelHandlerContext ctx,
                              RequestContext context,
                              Throwable error,
                              boolean keepAlive,
                              long elapsedMs) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException) {
            log.debug("{} cancelled after {}ms", context, elapsedMs);
            return;
        }
        if (cause instanceof RoutingException) {
            RoutingException routingError = (RoutingException) cause;
            log.debug("{} failed in {}ms: {}", context, elapsedMs, routingError.getMessage());
            write(ctx,
                    HttpResponseStatus.valueOf(routingError.httpStatus()),
                    GatewayResponses.errorBody(context.rpcId(), routingError.toRpcError(), routingError.kind().name()),
                    keepAlive);
            return;
        }
        log.error("Unexpected failure routing {}", context, cause);
        write(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                GatewayResponses.errorBody(context.rpcId(), JsonRpcError.INTERNAL_ERROR, "internal error", "INTERNAL"),
                keepAlive);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        CompletableFuture<JsonNode> inFlight = pending;
        if (inFlight != null) {
            inFlight.cancel(true);
        }
        FullHttpRequest queuedRequest;
        while ((queuedRequest = queued.poll()) != null) {
            queuedRequest.release();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Closing connection {}: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }

    private void methodNotAllowed(ChannelHandlerContext ctx, String allowed, boolean keepAlive) {
        FullHttpResponse response = GatewayResponses.json(HttpResponseStatus.METHOD_NOT_ALLOWED,
                GatewayResponses.errorBody(null, JsonRpcError.INVALID_REQUEST, "method not allowed", "INVALID_REQUEST"));
        response.headers().set(HttpHeaderNames.ALLOW, allowed);
        send(ctx, response, keepAlive);
    }

    private void write(ChannelHandlerContext ctx, HttpResponseStatus status, JsonNode body, boolean keepAlive) {
        send(ctx, GatewayResponses.json(status, body), keepAlive);
    }

    private void send(ChannelHandlerContext ctx, FullHttpResponse response, boolean keepAlive) {
        if (!ctx.channel().isActive()) {
            response.release();
            return;
        }
        boolean keep = keepAlive && server.accepting();
        if (keep) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    static List<String> segments(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return List.of();
        }
        String[] parts = trimmed.split("/", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                return List.of();
            }
        }
        return List.of(parts);
    }
}
