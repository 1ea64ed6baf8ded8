package net.spookly.rpcgate.routing;

/**
 * Progress of one request through the router.
 */
public enum RequestPhase {
    RECEIVED,
    PROJECT_RESOLVED,
    UPSTREAM_SELECTED,
    FORWARDED,
    RESPONSE_NORMALIZED,
    COMPLETED,
    FAILED
}
