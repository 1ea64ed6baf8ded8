package net.spookly.rpcgate.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.List;
import java.util.Set;

import net.spookly.rpcgate.upstream.UpstreamDescriptor;
import net.spookly.rpcgate.upstream.UpstreamKind;
import org.junit.jupiter.api.Test;

class UpstreamRegistryTest {
    @Test
    void bucketsKeepInsertionOrder() {
        UpstreamDescriptor a = resolved("main", "a", 1);
        UpstreamDescriptor b = resolved("main", "b", 137);
        UpstreamDescriptor c = resolved("main", "c", 1);
        UpstreamRegistry registry = new UpstreamRegistry(RoutingIndex.builder().add(a).add(b).add(c).build());

        assertEquals(List.of(a, c), registry.lookup("main", 1));
        assertEquals(List.of(b), registry.lookup("main", 137));
        assertEquals(Set.of(1L, 137L), registry.chainIds("main"));
    }

    @Test
    void absentPairsLookUpEmpty() {
        UpstreamRegistry registry = new UpstreamRegistry(RoutingIndex.builder()
                .project("empty")
                .add(resolved("main", "a", 1))
                .build());

        assertTrue(registry.lookup("main", 5).isEmpty());
        assertTrue(registry.lookup("other", 1).isEmpty());
        assertTrue(registry.lookup(null, 1).isEmpty());
        assertTrue(registry.exists("empty"));
        assertTrue(registry.lookup("empty", 1).isEmpty());
        assertFalse(registry.exists("other"));
        assertTrue(registry.chainIds("empty").isEmpty());
    }

    @Test
    void indexIsReadOnly() {
        RoutingIndex index = RoutingIndex.builder().add(resolved("main", "a", 1)).build();

        List<UpstreamDescriptor> bucket = index.upstreams("main", 1);

        assertThrows(UnsupportedOperationException.class,
                () -> bucket.add(resolved("main", "b", 1)));
    }

    @Test
    void indexesWithSameContentAreEqual() {
        RoutingIndex first = RoutingIndex.builder().add(resolved("main", "a", 1)).build();
        RoutingIndex second = RoutingIndex.builder().add(resolved("main", "a", 1)).build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    static UpstreamDescriptor resolved(String projectId, String id, long chainId) {
        UpstreamDescriptor descriptor = new UpstreamDescriptor(
                id, projectId, UpstreamKind.EVM, URI.create("https://" + id + ".example/rpc"), null);
        descriptor.assignChainId(chainId);
        return descriptor;
    }
}
