package net.spookly.rpcgate.config;

import java.util.List;
import java.util.Map;

public class RpcGateConfig {
    public String logLevel;
    public ServerConfig server;
    public BootstrapConfig bootstrap;
    public ForwardingConfig forwarding;
    public List<ProjectConfig> projects;

    public static class ServerConfig {
        public String httpHost;
        public Integer httpPort;
        /**
         * Upper bound for an aggregated inbound request body.
         */
        public Integer maxRequestBytes;
        public Integer shutdownGraceMs;
    }

    public static class BootstrapConfig {
        public Integer probeTimeoutMs;
    }

    public static class ForwardingConfig {
        public Integer timeoutMs;
    }

    public static class ProjectConfig {
        public String id;
        public String selectionPolicy;
        public List<UpstreamConfig> upstreams;
    }

    public static class UpstreamConfig {
        public String id;
        public String type;
        public String endpoint;
        public Map<String, Object> metadata;
    }
}
