package net.spookly.rpcgate.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(RpcGateConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateServer(config, errors);
        validateTimeouts(config, errors);
        validateProjects(config, errors);

        throwIfErrors(errors);
    }

    private static void validateServer(RpcGateConfig config, List<String> errors) {
        RpcGateConfig.ServerConfig server = config.server;
        if (server == null) {
            return;
        }
        // Port range is checked when binding so that a bad port surfaces as a listener failure.
        if (server.httpHost != null && server.httpHost.isBlank()) {
            errors.add("server.httpHost must not be blank");
        }
        requirePositiveIfSet(errors, server.maxRequestBytes, "server.maxRequestBytes");
        if (server.shutdownGraceMs != null && server.shutdownGraceMs < 0) {
            errors.add("server.shutdownGraceMs must be >= 0");
        }
    }

    private static void validateTimeouts(RpcGateConfig config, List<String> errors) {
        if (config.bootstrap != null) {
            requirePositiveIfSet(errors, config.bootstrap.probeTimeoutMs, "bootstrap.probeTimeoutMs");
        }
        if (config.forwarding != null) {
            requirePositiveIfSet(errors, config.forwarding.timeoutMs, "forwarding.timeoutMs");
        }
    }

    private static void validateProjects(RpcGateConfig config, List<String> errors) {
        if (config.projects == null) {
            return;
        }
        Set<String> projectIds = new HashSet<>();
        for (int i = 0; i < config.projects.size(); i++) {
            RpcGateConfig.ProjectConfig project = config.projects.get(i);
            if (project == null) {
                errors.add("projects[" + i + "] is required");
                continue;
            }
            String label = "projects[" + i + "]";
            requireNonBlank(errors, project.id, label + ".id");
            if (!isBlank(project.id)) {
                label = "projects." + project.id;
                if (project.id.contains("/")) {
                    errors.add(label + ".id must not contain '/'");
                }
                if (!projectIds.add(project.id)) {
                    errors.add("project id must be unique: " + project.id);
                }
            }
            if (!isBlank(project.selectionPolicy) && !isOneOf(project.selectionPolicy, "first", "round_robin")) {
                errors.add(label + ".selectionPolicy must be first or round_robin");
            }
            validateUpstreams(project, label, errors);
        }
    }

    private static void validateUpstreams(RpcGateConfig.ProjectConfig project, String projectLabel, List<String> errors) {
        if (project.upstreams == null) {
            return;
        }
        Set<String> upstreamIds = new HashSet<>();
        for (int i = 0; i < project.upstreams.size(); i++) {
            RpcGateConfig.UpstreamConfig upstream = project.upstreams.get(i);
            String label = projectLabel + ".upstreams[" + i + "]";
            if (upstream == null) {
                errors.add(label + " is required");
                continue;
            }
            requireNonBlank(errors, upstream.id, label + ".id");
            if (!isBlank(upstream.id)) {
                label = projectLabel + ".upstreams." + upstream.id;
                if (!upstreamIds.add(upstream.id)) {
                    errors.add("upstream id must be unique within " + projectLabel + ": " + upstream.id);
                }
            }
            if (!isBlank(upstream.type) && !isOneOf(upstream.type, "evm")) {
                errors.add(label + ".type must be evm");
            }
            requireNonBlank(errors, upstream.endpoint, label + ".endpoint");
            if (!isBlank(upstream.endpoint) && !isHttpUri(upstream.endpoint)) {
                errors.add(label + ".endpoint must be an absolute http or https URL");
            }
        }
    }

    private static boolean isHttpUri(String value) {
        try {
            URI uri = new URI(value.trim());
            return uri.getHost() != null && isOneOf(uri.getScheme(), "http", "https");
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositiveIfSet(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
