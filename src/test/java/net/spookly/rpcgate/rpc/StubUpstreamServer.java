package net.spookly.rpcgate.rpc;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Loopback JSON-RPC node for tests. Records every request body and answers with a scripted reply.
 */
public final class StubUpstreamServer implements AutoCloseable {
    private final HttpServer server;
    private final ExecutorService executor;
    private final Function<JsonNode, Reply> handler;
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();

    private StubUpstreamServer(Function<JsonNode, Reply> handler) throws IOException {
        this.handler = handler;
        this.executor = Executors.newCachedThreadPool();
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        this.server.createContext("/", this::handle);
        this.server.setExecutor(executor);
        this.server.start();
    }

    public static StubUpstreamServer start(Function<JsonNode, Reply> handler) throws IOException {
        return new StubUpstreamServer(handler);
    }

    /**
     * Answers {@code eth_chainId} with {@code chainIdHex} and every other call with {@code result}.
     */
    public static StubUpstreamServer evmNode(String chainIdHex, String result) throws IOException {
        return start(request -> {
            String method = request == null ? null : request.path("method").asText();
            JsonNode id = request == null ? null : request.get("id");
            if ("eth_chainId".equals(method)) {
                return Reply.ok("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":\"" + chainIdHex + "\"}");
            }
            return Reply.ok("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":" + result + "}");
        });
    }

    public URI endpoint() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/rpc/key");
    }

    public List<JsonNode> requests() {
        return requests;
    }

    public List<String> contentTypes() {
        return contentTypes;
    }

    public long count(String method) {
        return requests.stream().filter(request -> request != null && method.equals(request.path("method").asText())).count();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        JsonNode request;
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readAllBytes();
            request = bytes.length == 0 ? null : JsonRpc.MAPPER.readTree(bytes);
        }
        requests.add(request);
        contentTypes.add(String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
        Reply reply = handler.apply(request);
        if (reply.delayMs() > 0) {
            try {
                Thread.sleep(reply.delayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exchange.close();
                return;
            }
        }
        byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(reply.status(), body.length == 0 ? -1 : body.length);
        if (body.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        }
        exchange.close();
    }

    public record Reply(int status, String body, long delayMs) {
        public static Reply ok(String body) {
            return new Reply(200, body, 0);
        }

        public static Reply status(int status, String body) {
            return new Reply(status, body, 0);
        }

        public static Reply delayed(long delayMs, String body) {
            return new Reply(200, body, delayMs);
        }
    }
}
