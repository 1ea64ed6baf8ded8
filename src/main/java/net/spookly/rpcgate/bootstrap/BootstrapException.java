package net.spookly.rpcgate.bootstrap;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Bootstrap could not establish the identity of every configured upstream; no routing index was published.
 */
@Getter
@Accessors(fluent = true)
public class BootstrapException extends RuntimeException {
    /**
     * Project of the first failing upstream in configuration order, or {@code null} when bootstrap was aborted.
     */
    private final String projectId;
    private final String upstreamId;

    public BootstrapException(String projectId, String upstreamId, Throwable cause) {
        super("cannot bootstrap upstream '" + upstreamId + "' of project '" + projectId + "': " + cause.getMessage(), cause);
        this.projectId = projectId;
        this.upstreamId = upstreamId;
    }

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
        this.projectId = null;
        this.upstreamId = null;
    }
}
