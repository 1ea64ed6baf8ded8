package net.spookly.rpcgate.util;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Redacts credentials carried in upstream endpoint URLs (API keys in paths, query strings or user info).
 */
public final class EndpointRedactor {
    private static final String REDACTED = "REDACTED";

    private EndpointRedactor() {
    }

    /**
     * Return a safe representation of an endpoint for logs and printed config.
     *
     * @param endpoint the raw endpoint URL
     * @return {@code null} when the endpoint is {@code null}, scheme, host and port otherwise,
     *         with any path or query replaced by {@code /REDACTED}
     */
    public static String redact(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(endpoint.trim());
        } catch (URISyntaxException e) {
            return REDACTED;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return REDACTED;
        }
        StringBuilder builder = new StringBuilder()
                .append(uri.getScheme())
                .append("://")
                .append(uri.getHost());
        if (uri.getPort() >= 0) {
            builder.append(':').append(uri.getPort());
        }
        boolean hasPath = uri.getRawPath() != null && !uri.getRawPath().isEmpty() && !"/".equals(uri.getRawPath());
        if (hasPath || uri.getRawQuery() != null || uri.getRawUserInfo() != null) {
            builder.append('/').append(REDACTED);
        }
        return builder.toString();
    }
}
