package net.spookly.rpcgate.upstream;

/**
 * Closed set of upstream families; each kind decides how identity is resolved and calls are forwarded.
 */
public enum UpstreamKind {
    EVM("evm");

    private final String configValue;

    UpstreamKind(String configValue) {
        this.configValue = configValue;
    }

    public static UpstreamKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return EVM;
        }
        for (UpstreamKind kind : values()) {
            if (kind.configValue.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown upstream type: " + value);
    }
}
