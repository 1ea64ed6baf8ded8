package net.spookly.rpcgate.server;

/**
 * The HTTP listener could not be bound.
 */
public class ServerStartException extends RuntimeException {
    public ServerStartException(String message) {
        super(message);
    }

    public ServerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
