package net.spookly.rpcgate;

import java.nio.file.FileSystems;
import java.util.concurrent.CountDownLatch;

import lombok.extern.slf4j.Slf4j;
import net.spookly.rpcgate.config.ConfigPrinter;
import net.spookly.rpcgate.config.RpcGateConfig;

/**
 * Standalone entry point for the gateway process.
 */
@Slf4j
public final class RpcGateMain {
    private RpcGateMain() {
    }

    public static void main(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            System.err.println("usage: rpcgate [--config|-c <path>] [<path>] [--dry-run] [--print-effective-config]");
            System.exit(ExitCode.CONFIG.code());
            return;
        }
        try {
            if (options.printEffectiveConfig() || options.dryRun()) {
                RpcGateConfig config = RpcGate.loadConfig(FileSystems.getDefault(), options);
                if (options.printEffectiveConfig()) {
                    System.out.println(ConfigPrinter.toYaml(config));
                } else {
                    System.out.println("Config OK (--dry-run).");
                }
                return;
            }
            RunningGateway gateway = RpcGate.start(FileSystems.getDefault(), options);
            awaitShutdown(gateway);
        } catch (StartupException e) {
            log.error("Startup failed ({}): {}", e.failure(), e.getMessage(), e.getCause());
            System.exit(ExitCode.forFailure(e.failure()).code());
        }
    }

    private static void awaitShutdown(RunningGateway gateway) {
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            gateway.shutdown();
            latch.countDown();
        }, "rpcgate-shutdown"));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            gateway.shutdown();
        }
    }
}
