package net.spookly.rpcgate.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the gateway YAML configuration, resolving placeholders from the process environment.
     */
    public static RpcGateConfig load(Path path) {
        return load(path, System::getenv);
    }

    /**
     * Load and validate the gateway YAML configuration with an explicit environment lookup.
     */
    public static RpcGateConfig load(Path path, Function<String, String> environment) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            throw new ConfigException("Config file does not exist: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = yaml.load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        if (!(raw instanceof Map)) {
            throw new ConfigException("Config root must be a mapping: " + path);
        }
        Object expanded = EnvExpander.expand(raw, environment);
        RpcGateConfig config;
        try {
            config = MAPPER.convertValue(expanded, RpcGateConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        ConfigValidator.validate(config);
        return config;
    }
}
