package net.spookly.rpcgate;

/**
 * Stage of process startup that failed.
 */
public enum StartupFailure {
    CONFIG,
    BOOTSTRAP,
    HTTP_SERVER
}
