package net.spookly.rpcgate.config;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, plaintext endpoints on remote hosts).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(RpcGateConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null || config.projects == null) {
            return warnings;
        }
        for (RpcGateConfig.ProjectConfig project : config.projects) {
            if (project == null || project.upstreams == null) {
                continue;
            }
            Set<String> endpoints = new HashSet<>();
            for (RpcGateConfig.UpstreamConfig upstream : project.upstreams) {
                if (upstream == null || upstream.endpoint == null) {
                    continue;
                }
                String label = "projects." + project.id + ".upstreams." + upstream.id;
                if (upstream.metadata == null || upstream.metadata.get("evmChainId") == null) {
                    warnings.add(label + " declares no evmChainId; it will be probed with eth_chainId at startup");
                }
                if (isPlaintextRemote(upstream.endpoint)) {
                    warnings.add(label + ".endpoint uses plain http to a non-loopback host");
                }
                if (!endpoints.add(upstream.endpoint.trim().toLowerCase(Locale.ROOT))) {
                    warnings.add(label + ".endpoint duplicates another upstream in project " + project.id);
                }
            }
        }
        return warnings;
    }

    private static boolean isPlaintextRemote(String endpoint) {
        URI uri;
        try {
            uri = new URI(endpoint.trim());
        } catch (URISyntaxException ignored) {
            return false;
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
            return false;
        }
        String host = uri.getHost();
        if ("localhost".equalsIgnoreCase(host)) {
            return false;
        }
        if (!isIpLiteral(host)) {
            return true;
        }
        try {
            return !InetAddress.getByName(host).isLoopbackAddress();
        } catch (Exception ignored) {
            return true;
        }
    }

    private static boolean isIpLiteral(String host) {
        return host.startsWith("[") || host.chars().allMatch(ch -> Character.isDigit(ch) || ch == '.');
    }
}
