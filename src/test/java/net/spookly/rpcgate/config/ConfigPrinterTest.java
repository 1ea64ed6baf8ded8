package net.spookly.rpcgate.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigPrinterTest {
    @Test
    void redactsEndpointPaths() {
        RpcGateConfig config = new RpcGateConfig();
        RpcGateConfig.UpstreamConfig upstream = ConfigValidatorTest.upstream("alchemy", "https://eth.example/v2/secret-key");
        upstream.metadata = Map.of("evmChainId", 1);
        config.projects = List.of(ConfigValidatorTest.project("main", upstream));

        String yaml = ConfigPrinter.toYaml(config);

        assertTrue(yaml.contains("https://eth.example/REDACTED"));
        assertTrue(yaml.contains("evmChainId: 1"));
        assertFalse(yaml.contains("secret-key"));
    }

    @Test
    void omitsUnsetSections() {
        RpcGateConfig config = new RpcGateConfig();
        config.logLevel = "INFO";

        String yaml = ConfigPrinter.toYaml(config);

        assertTrue(yaml.contains("logLevel: INFO"));
        assertFalse(yaml.contains("server"));
    }
}
