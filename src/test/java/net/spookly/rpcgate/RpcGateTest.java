package net.spookly.rpcgate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import net.spookly.rpcgate.logging.LogLevels;
import net.spookly.rpcgate.rpc.JsonRpc;
import net.spookly.rpcgate.rpc.StubUpstreamServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RpcGateTest {
    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @Test
    void routesBlockQueryThroughProbedUpstream(@TempDir Path tempDir) throws Exception {
        try (StubUpstreamServer upstream = StubUpstreamServer.evmNode("0x1", "{\"number\":\"0x1273c18\",\"hash\":\"0xabc\"}")) {
            Path config = write(tempDir, String.join("\n",
                    "logLevel: INFO",
                    "server:",
                    "  httpHost: 127.0.0.1",
                    "  httpPort: 0",
                    "projects:",
                    "  - id: main",
                    "    upstreams:",
                    "      - id: node",
                    "        endpoint: " + upstream.endpoint(),
                    ""));

            try (RunningGateway gateway = RpcGate.start(FileSystems.getDefault(), new String[]{"--config", config.toString()})) {
                HttpResponse<String> response = post(gateway, "/main/1",
                        "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_getBlockByNumber\",\"params\":[\"0x1273c18\",false]}");

                assertEquals(200, response.statusCode());
                JsonNode body = JsonRpc.MAPPER.readTree(response.body());
                assertEquals("0x1273c18", body.get("number").asText());
                assertEquals("0xabc", body.get("hash").asText());
                assertEquals(1, upstream.count("eth_chainId"));
                JsonNode forwarded = upstream.requests().get(upstream.requests().size() - 1);
                assertEquals("eth_getBlockByNumber", forwarded.get("method").asText());
                assertEquals(JsonRpc.MAPPER.readTree("[\"0x1273c18\",false]"), forwarded.get("params"));
                assertEquals(1L, gateway.registry().lookup("main", 1).get(0).resolvedChainId());
            }
        }
    }

    @Test
    void unknownProjectAndChainAreRejected(@TempDir Path tempDir) throws Exception {
        Path config = write(tempDir, declaredConfig("127.0.0.1", 0, null));

        try (RunningGateway gateway = RpcGate.start(FileSystems.getDefault(), new String[]{config.toString()})) {
            HttpResponse<String> unknownProject = post(gateway, "/other/1", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_blockNumber\"}");
            HttpResponse<String> unsupportedChain = post(gateway, "/main/5", "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"eth_blockNumber\"}");

            assertEquals(404, unknownProject.statusCode());
            assertEquals("UNKNOWN_PROJECT",
                    JsonRpc.MAPPER.readTree(unknownProject.body()).get("error").get("data").get("kind").asText());
            assertEquals(404, unsupportedChain.statusCode());
            assertEquals("UNSUPPORTED_CHAIN",
                    JsonRpc.MAPPER.readTree(unsupportedChain.body()).get("error").get("data").get("kind").asText());
        }
    }

    @Test
    void unreachableUndeclaredUpstreamFailsBootstrapWithoutListener(@TempDir Path tempDir) throws Exception {
        int deadPort = freePort();
        int httpPort = freePort();
        Path config = write(tempDir, String.join("\n",
                "server:",
                "  httpHost: 127.0.0.1",
                "  httpPort: " + httpPort,
                "bootstrap:",
                "  probeTimeoutMs: 1000",
                "projects:",
                "  - id: main",
                "    upstreams:",
                "      - id: dead",
                "        endpoint: http://127.0.0.1:" + deadPort + "/rpc",
                ""));

        StartupException exception = assertThrows(StartupException.class,
                () -> RpcGate.start(FileSystems.getDefault(), new String[]{"-c", config.toString()}));

        assertEquals(StartupFailure.BOOTSTRAP, exception.failure());
        assertTrue(exception.getMessage().startsWith("cannot bootstrap"));
        assertTrue(exception.getMessage().contains("'dead'"));
        assertThrows(ConnectException.class, () -> new Socket("127.0.0.1", httpPort).close());
    }

    @Test
    void missingConfigIsAConfigFailure(@TempDir Path tempDir) {
        StartupException exception = assertThrows(StartupException.class, () -> RpcGate.start(
                FileSystems.getDefault(), new String[]{"--config", tempDir.resolve("absent.yaml").toString()}));

        assertEquals(StartupFailure.CONFIG, exception.failure());
        assertTrue(exception.getMessage().startsWith("failed to load configuration"));
        assertTrue(exception.getMessage().contains("does not exist"));
    }

    @Test
    void invalidYamlIsAConfigFailure(@TempDir Path tempDir) throws Exception {
        Path config = write(tempDir, "projects: [\n  - id: main\n");

        StartupException exception = assertThrows(StartupException.class,
                () -> RpcGate.start(FileSystems.getDefault(), new String[]{config.toString()}));

        assertEquals(StartupFailure.CONFIG, exception.failure());
        assertTrue(exception.getMessage().startsWith("failed to load configuration"));
    }

    @Test
    void unknownLogLevelFallsBackToDebug(@TempDir Path tempDir) throws Exception {
        Path config = write(tempDir, declaredConfig("127.0.0.1", 0, "invalid"));

        try (RunningGateway gateway = RpcGate.start(FileSystems.getDefault(), new String[]{config.toString()})) {
            assertEquals(Level.DEBUG, LogLevels.current());
        } finally {
            LogLevels.apply(null);
        }
    }

    @Test
    void invalidPortIsAnHttpServerFailure(@TempDir Path tempDir) throws Exception {
        Path config = write(tempDir, declaredConfig("127.0.0.1", 70000, null));

        StartupException exception = assertThrows(StartupException.class,
                () -> RpcGate.start(FileSystems.getDefault(), new String[]{config.toString()}));

        assertEquals(StartupFailure.HTTP_SERVER, exception.failure());
        assertEquals(13, ExitCode.forFailure(exception.failure()).code());
    }

    @Test
    void shutdownIsIdempotentAndClosesTheListener(@TempDir Path tempDir) throws Exception {
        Path config = write(tempDir, declaredConfig("127.0.0.1", 0, null));
        RunningGateway gateway = RpcGate.start(FileSystems.getDefault(), new String[]{config.toString()});
        int port = gateway.port();

        gateway.shutdown();
        gateway.shutdown();
        gateway.close();

        assertTrue(gateway.isShutdown());
        assertThrows(IOException.class, () -> new Socket("127.0.0.1", port).close());
    }

    @Test
    void unknownOptionIsAConfigFailure() {
        StartupException exception = assertThrows(StartupException.class,
                () -> RpcGate.start(FileSystems.getDefault(), new String[]{"--verbose"}));

        assertEquals(StartupFailure.CONFIG, exception.failure());
    }

    private HttpResponse<String> post(RunningGateway gateway, String path, String body) throws Exception {
        return client.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + gateway.port() + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static String declaredConfig(String host, int port, String logLevel) {
        return String.join("\n",
                logLevel == null ? "" : "logLevel: " + logLevel,
                "server:",
                "  httpHost: " + host,
                "  httpPort: " + port,
                "projects:",
                "  - id: main",
                "    upstreams:",
                "      - id: declared",
                "        endpoint: https://eth.example/v2/key",
                "        metadata:",
                "          evmChainId: 1",
                "");
    }

    private static Path write(Path dir, String yaml) throws IOException {
        Path path = dir.resolve("rpcgate.yaml");
        Files.writeString(path, yaml, StandardCharsets.UTF_8);
        return path;
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
