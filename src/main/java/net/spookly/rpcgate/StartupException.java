package net.spookly.rpcgate;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fatal startup error. The gateway never serves requests after one of these.
 */
@Getter
@Accessors(fluent = true)
public class StartupException extends RuntimeException {
    private final StartupFailure failure;

    public StartupException(StartupFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
