package net.spookly.rpcgate.config;

/**
 * Fallback values for optional settings.
 */
public final class ConfigDefaults {
    public static final String HTTP_HOST = "0.0.0.0";
    public static final int HTTP_PORT = 4000;
    public static final int MAX_REQUEST_BYTES = 1024 * 1024;
    public static final int SHUTDOWN_GRACE_MS = 5_000;
    public static final int PROBE_TIMEOUT_MS = 5_000;
    public static final int FORWARD_TIMEOUT_MS = 30_000;

    private ConfigDefaults() {
    }

    public static String httpHost(RpcGateConfig config) {
        RpcGateConfig.ServerConfig server = config.server;
        if (server == null || server.httpHost == null || server.httpHost.isBlank()) {
            return HTTP_HOST;
        }
        return server.httpHost.trim();
    }

    public static int httpPort(RpcGateConfig config) {
        RpcGateConfig.ServerConfig server = config.server;
        return server == null || server.httpPort == null ? HTTP_PORT : server.httpPort;
    }

    public static int maxRequestBytes(RpcGateConfig config) {
        RpcGateConfig.ServerConfig server = config.server;
        return server == null || server.maxRequestBytes == null ? MAX_REQUEST_BYTES : server.maxRequestBytes;
    }

    public static int shutdownGraceMs(RpcGateConfig config) {
        RpcGateConfig.ServerConfig server = config.server;
        return server == null || server.shutdownGraceMs == null ? SHUTDOWN_GRACE_MS : server.shutdownGraceMs;
    }

    public static int probeTimeoutMs(RpcGateConfig config) {
        RpcGateConfig.BootstrapConfig bootstrap = config.bootstrap;
        return bootstrap == null || bootstrap.probeTimeoutMs == null ? PROBE_TIMEOUT_MS : bootstrap.probeTimeoutMs;
    }

    public static int forwardTimeoutMs(RpcGateConfig config) {
        RpcGateConfig.ForwardingConfig forwarding = config.forwarding;
        return forwarding == null || forwarding.timeoutMs == null ? FORWARD_TIMEOUT_MS : forwarding.timeoutMs;
    }
}
