package net.spookly.rpcgate.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class EnvExpanderTest {
    @Test
    void replacesPlaceholdersInNestedStrings() {
        Map<String, Object> raw = Map.of(
                "endpoint", "https://${HOST}/v2/${KEY}",
                "list", List.of("${HOST}", 5)
        );

        Object expanded = EnvExpander.expand(raw, Map.of("HOST", "eth.example", "KEY", "abc")::get);

        assertEquals(Map.of("endpoint", "https://eth.example/v2/abc", "list", List.of("eth.example", 5)), expanded);
    }

    @Test
    void usesFallbackWhenVariableIsUnset() {
        assertEquals("4000", EnvExpander.expand("${PORT:-4000}", name -> null));
        assertEquals("", EnvExpander.expand("${EMPTY:-}", name -> null));
    }

    @Test
    void leavesTextWithoutPlaceholdersAlone() {
        assertEquals("costs $5 {maybe}", EnvExpander.expand("costs $5 {maybe}", name -> null));
    }

    @Test
    void failsOnMissingVariableWithoutFallback() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> EnvExpander.expand("${NOPE}", name -> null));

        assertEquals("Missing required environment variable: NOPE", exception.getMessage());
    }
}
