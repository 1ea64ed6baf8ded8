package net.spookly.rpcgate.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    @Test
    void acceptsMinimalConfig() {
        RpcGateConfig config = new RpcGateConfig();
        config.projects = List.of(project("main", upstream("a", "https://eth.example/v2/key")));

        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    @Test
    void acceptsProjectWithoutUpstreams() {
        RpcGateConfig config = new RpcGateConfig();
        config.projects = List.of(project("empty"));

        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    @Test
    void collectsEveryViolation() {
        RpcGateConfig config = new RpcGateConfig();
        RpcGateConfig.ProjectConfig main = project("main",
                upstream("a", "https://eth.example"),
                upstream("a", "ftp://eth.example"),
                upstream(" ", null));
        main.selectionPolicy = "random";
        config.projects = List.of(main, project("main"), project("a/b"));

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        String message = exception.getMessage();
        assertTrue(message.startsWith("Invalid config:"));
        assertTrue(message.contains("upstream id must be unique within projects.main: a"));
        assertTrue(message.contains("projects.main.upstreams.a.endpoint must be an absolute http or https URL"));
        assertTrue(message.contains("projects.main.upstreams[2].id is required"));
        assertTrue(message.contains("projects.main.upstreams[2].endpoint is required"));
        assertTrue(message.contains("projects.main.selectionPolicy must be first or round_robin"));
        assertTrue(message.contains("project id must be unique: main"));
        assertTrue(message.contains("projects.a/b.id must not contain '/'"));
    }

    @Test
    void rejectsUnknownUpstreamType() {
        RpcGateConfig config = new RpcGateConfig();
        RpcGateConfig.UpstreamConfig solana = upstream("sol", "https://sol.example");
        solana.type = "solana";
        config.projects = List.of(project("main", solana));

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("projects.main.upstreams.sol.type must be evm"));
    }

    @Test
    void rejectsNonPositiveTimeouts() {
        RpcGateConfig config = new RpcGateConfig();
        config.bootstrap = new RpcGateConfig.BootstrapConfig();
        config.bootstrap.probeTimeoutMs = 0;
        config.forwarding = new RpcGateConfig.ForwardingConfig();
        config.forwarding.timeoutMs = -5;
        config.server = new RpcGateConfig.ServerConfig();
        config.server.maxRequestBytes = 0;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("bootstrap.probeTimeoutMs must be greater than 0"));
        assertTrue(exception.getMessage().contains("forwarding.timeoutMs must be greater than 0"));
        assertTrue(exception.getMessage().contains("server.maxRequestBytes must be greater than 0"));
    }

    @Test
    void leavesPortRangeToTheListener() {
        RpcGateConfig config = new RpcGateConfig();
        config.server = new RpcGateConfig.ServerConfig();
        config.server.httpPort = 70000;

        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    static RpcGateConfig.ProjectConfig project(String id, RpcGateConfig.UpstreamConfig... upstreams) {
        RpcGateConfig.ProjectConfig project = new RpcGateConfig.ProjectConfig();
        project.id = id;
        project.upstreams = new ArrayList<>(List.of(upstreams));
        return project;
    }

    static RpcGateConfig.UpstreamConfig upstream(String id, String endpoint) {
        RpcGateConfig.UpstreamConfig upstream = new RpcGateConfig.UpstreamConfig();
        upstream.id = id;
        upstream.endpoint = endpoint;
        return upstream;
    }
}
