package net.spookly.rpcgate.logging;

import java.util.Locale;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured log level to the gateway's loggers.
 *
 * <p>The level is process-scoped state: it is set once from {@code RpcGate.start} after the
 * configuration loads and is not changed while the gateway is serving.
 */
@Slf4j
public final class LogLevels {
    public static final Level DEFAULT_LEVEL = Level.DEBUG;
    private static final String ROOT_PACKAGE = "net.spookly.rpcgate";

    private LogLevels() {
    }

    /**
     * Resolve and apply a configured level name, falling back to DEBUG when missing or unknown.
     */
    public static Level apply(String configured) {
        Level level = parse(configured);
        if (configured != null && !configured.isBlank() && level == null) {
            log.warn("Unknown logLevel '{}', falling back to {}", configured, DEFAULT_LEVEL);
        }
        Level effective = level == null ? DEFAULT_LEVEL : level;
        gatewayLogger().setLevel(effective);
        return effective;
    }

    /**
     * Level currently applied to the gateway's loggers.
     */
    public static Level current() {
        Level level = gatewayLogger().getLevel();
        return level == null ? gatewayLogger().getEffectiveLevel() : level;
    }

    static Level parse(String configured) {
        if (configured == null || configured.isBlank()) {
            return null;
        }
        switch (configured.trim().toUpperCase(Locale.ROOT)) {
            case "TRACE":
                return Level.TRACE;
            case "DEBUG":
                return Level.DEBUG;
            case "INFO":
                return Level.INFO;
            case "WARN":
                return Level.WARN;
            case "ERROR":
                return Level.ERROR;
            case "OFF":
            case "DISABLED":
                return Level.OFF;
            default:
                return null;
        }
    }

    private static Logger gatewayLogger() {
        return (Logger) LoggerFactory.getLogger(ROOT_PACKAGE);
    }
}
