package net.spookly.rpcgate.routing;

/**
 * Upstream selection policy within one (project, chain) bucket.
 */
public enum SelectionPolicy {
    /** Always the first upstream in configuration order. */
    FIRST("first"),
    ROUND_ROBIN("round_robin");

    private final String configValue;

    SelectionPolicy(String configValue) {
        this.configValue = configValue;
    }

    public static SelectionPolicy fromConfig(String value) {
        if (value == null) {
            return FIRST;
        }
        for (SelectionPolicy policy : values()) {
            if (policy.configValue.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        return FIRST;
    }
}
