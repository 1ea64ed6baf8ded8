package net.spookly.rpcgate;

import java.nio.file.FileSystem;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.bootstrap.BootstrapException;
import net.spookly.rpcgate.bootstrap.BootstrapOrchestrator;
import net.spookly.rpcgate.config.ConfigDefaults;
import net.spookly.rpcgate.config.ConfigException;
import net.spookly.rpcgate.config.ConfigLoader;
import net.spookly.rpcgate.config.ConfigWarnings;
import net.spookly.rpcgate.config.RpcGateConfig;
import net.spookly.rpcgate.logging.LogLevels;
import net.spookly.rpcgate.registry.RoutingIndex;
import net.spookly.rpcgate.registry.UpstreamRegistry;
import net.spookly.rpcgate.routing.RequestRouter;
import net.spookly.rpcgate.rpc.HttpJsonRpcTransport;
import net.spookly.rpcgate.rpc.JsonRpcTransport;
import net.spookly.rpcgate.server.GatewayServer;
import net.spookly.rpcgate.server.ServerStartException;
import net.spookly.rpcgate.upstream.EvmChainIdentityResolver;

/**
 * Wires configuration, bootstrap, routing and the HTTP server into a running gateway.
 */
@Slf4j
public final class RpcGate {
    private RpcGate() {
    }

    /**
     * Load the configuration named by {@code args}, bootstrap every upstream and bind the HTTP listener.
     *
     * @throws StartupException when any stage fails; nothing is left listening in that case
     */
    public static RunningGateway start(FileSystem fileSystem, String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            throw new StartupException(StartupFailure.CONFIG, "failed to load configuration: " + e.getMessage(), e);
        }
        return start(fileSystem, options);
    }

    public static RunningGateway start(FileSystem fileSystem, CliOptions options) {
        RpcGateConfig config = loadConfig(fileSystem, options);
        LogLevels.apply(config.logLevel);
        for (String warning : ConfigWarnings.collect(config)) {
            log.warn("Config warning: {}", warning);
        }

        JsonRpcTransport transport = new HttpJsonRpcTransport();
        RoutingIndex index;
        try {
            BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(
                    new EvmChainIdentityResolver(transport),
                    ConfigDefaults.probeTimeoutMs(config)
            );
            index = orchestrator.bootstrap(config.projects == null ? List.of() : config.projects);
        } catch (BootstrapException e) {
            transport.close();
            throw new StartupException(StartupFailure.BOOTSTRAP, e.getMessage(), e);
        }

        UpstreamRegistry registry = new UpstreamRegistry(index);
        RequestRouter router = RequestRouter.fromConfig(config, registry, transport);
        GatewayServer server = GatewayServer.fromConfig(config, router);
        try {
            server.start();
        } catch (ServerStartException e) {
            transport.close();
            throw new StartupException(StartupFailure.HTTP_SERVER, "cannot start HTTP server: " + e.getMessage(), e);
        }
        return new RunningGateway(config, registry, server, transport);
    }

    /**
     * Load and validate configuration without contacting any upstream.
     */
    public static RpcGateConfig loadConfig(FileSystem fileSystem, CliOptions options) {
        Objects.requireNonNull(fileSystem, "fileSystem");
        Objects.requireNonNull(options, "options");
        Path path;
        try {
            path = fileSystem.getPath(options.configPath());
        } catch (InvalidPathException e) {
            throw new StartupException(StartupFailure.CONFIG,
                    "failed to load configuration: invalid path " + options.configPath(), e);
        }
        try {
            return ConfigLoader.load(path);
        } catch (ConfigException e) {
            throw new StartupException(StartupFailure.CONFIG,
                    "failed to load configuration from " + path + ": " + e.getMessage(), e);
        }
    }
}
