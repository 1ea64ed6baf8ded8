package net.spookly.rpcgate.server;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.config.ConfigDefaults;
import net.spookly.rpcgate.config.RpcGateConfig;
import net.spookly.rpcgate.routing.RoutingFunction;

/**
 * HTTP listener that hands every JSON-RPC call to a {@link RoutingFunction}.
 */
@Slf4j
public final class GatewayServer {
    private static final long DRAIN_POLL_MS = 10L;

    private final String host;
    private final int port;
    private final int maxRequestBytes;
    private final int shutdownGraceMs;
    private final RoutingFunction router;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean accepting;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel channel;

    public GatewayServer(String host, int port, int maxRequestBytes, int shutdownGraceMs, RoutingFunction router) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.maxRequestBytes = maxRequestBytes;
        this.shutdownGraceMs = shutdownGraceMs;
        this.router = Objects.requireNonNull(router, "router");
    }

    public static GatewayServer fromConfig(RpcGateConfig config, RoutingFunction router) {
        return new GatewayServer(
                ConfigDefaults.httpHost(config),
                ConfigDefaults.httpPort(config),
                ConfigDefaults.maxRequestBytes(config),
                ConfigDefaults.shutdownGraceMs(config),
                router
        );
    }

    /**
     * Bind the listener. Returns once the socket accepts connections.
     */
    public synchronized void start() {
        if (channel != null) {
            return;
        }
        if (stopped.get()) {
            throw new ServerStartException("server was already stopped");
        }
        if (port < 0 || port > 65535) {
            throw new ServerStartException("invalid HTTP port " + port + " (must be 0-65535)");
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("rpcgate-http-boss", true));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("rpcgate-http-worker", true));
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new GatewayChannelInitializer(this, maxRequestBytes));
        try {
            channel = bootstrap.bind(new InetSocketAddress(host, port)).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseGroups();
            throw new ServerStartException("HTTP bind interrupted", e);
        } catch (Exception e) {
            releaseGroups();
            throw new ServerStartException("cannot listen on " + host + ":" + port + ": " + e.getMessage(), e);
        }
        accepting = true;
        InetSocketAddress bound = localAddress();
        log.info("Gateway listening on {}:{}", bound.getHostString(), bound.getPort());
    }

    /**
     * Stop accepting, wait up to the shutdown grace period for in-flight requests, then release the event loops.
     * Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        accepting = false;
        Channel listener;
        synchronized (this) {
            listener = channel;
            channel = null;
        }
        if (listener == null) {
            releaseGroups();
            return;
        }
        listener.close().awaitUninterruptibly();
        awaitDrain();
        releaseGroups();
        log.info("Gateway stopped");
    }

    /**
     * Bound address; resolves the actual port when configured with port 0.
     */
    public synchronized InetSocketAddress localAddress() {
        if (channel == null) {
            throw new IllegalStateException("server is not running");
        }
        return (InetSocketAddress) channel.localAddress();
    }

    public int inFlight() {
        return inFlight.get();
    }

    boolean accepting() {
        return accepting;
    }

    RoutingFunction router() {
        return router;
    }

    void requestStarted() {
        inFlight.incrementAndGet();
    }

    void requestFinished() {
        inFlight.decrementAndGet();
    }

    private void awaitDrain() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(shutdownGraceMs);
        while (inFlight.get() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(DRAIN_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int remaining = inFlight.get();
        if (remaining > 0) {
            log.warn("Shutdown grace period elapsed with {} request(s) in flight", remaining);
        }
    }

    private synchronized void releaseGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS).awaitUninterruptibly();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS).awaitUninterruptibly();
            bossGroup = null;
        }
    }
}
