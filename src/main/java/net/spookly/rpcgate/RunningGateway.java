package net.spookly.rpcgate;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.config.RpcGateConfig;
import net.spookly.rpcgate.registry.UpstreamRegistry;
import net.spookly.rpcgate.rpc.JsonRpcTransport;
import net.spookly.rpcgate.server.GatewayServer;

/**
 * Handle on a started gateway.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class RunningGateway implements AutoCloseable {
    private final RpcGateConfig config;
    private final UpstreamRegistry registry;
    private final GatewayServer server;
    @Getter(AccessLevel.NONE)
    private final JsonRpcTransport transport;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    RunningGateway(RpcGateConfig config, UpstreamRegistry registry, GatewayServer server, JsonRpcTransport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.server = Objects.requireNonNull(server, "server");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public InetSocketAddress address() {
        return server.localAddress();
    }

    public int port() {
        return address().getPort();
    }

    /**
     * Stop the listener, drain in-flight requests and release upstream connections. Later calls do nothing.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down");
        server.stop();
        transport.close();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }
}
