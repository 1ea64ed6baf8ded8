package net.spookly.rpcgate.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.rpcgate.util.EndpointRedactor;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with upstream credentials redacted.
 */
public final class ConfigPrinter {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(RpcGateConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactEndpoints(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        return yaml.dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactEndpoints(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object projects = data.get("projects");
        if (!(projects instanceof List)) {
            return;
        }
        for (Object project : (List<?>) projects) {
            if (!(project instanceof Map)) {
                continue;
            }
            Object upstreams = ((Map<String, Object>) project).get("upstreams");
            if (!(upstreams instanceof List)) {
                continue;
            }
            for (Object upstream : (List<?>) upstreams) {
                if (upstream instanceof Map) {
                    Map<String, Object> upstreamMap = (Map<String, Object>) upstream;
                    Object endpoint = upstreamMap.get("endpoint");
                    if (endpoint instanceof String) {
                        upstreamMap.put("endpoint", EndpointRedactor.redact((String) endpoint));
                    }
                }
            }
        }
    }
}
