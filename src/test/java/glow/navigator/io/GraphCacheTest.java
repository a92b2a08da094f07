package glow.navigator.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import glow.navigator.graph.Graph;

import static org.junit.jupiter.api.Assertions.*;

class GraphCacheTest {

    @TempDir
    Path dir;

    private static Graph sample() {
        final Graph graph = new Graph("Glow");
        final Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("name", "Invoice");
        entity.put("type", "entity");
        entity.put("active", true);
        graph.addNode("Invoice", entity);
        final Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("name", "Approve");
        rule.put("type", "command");
        rule.put("conditions", List.of("c1", "c2"));
        graph.addNode("Approve-Invoice", rule);
        graph.addEdge("Invoice", "Approve-Invoice", Map.of("type", "link", "link_type", "command"));
        graph.addEdge("Invoice", "Approve-Invoice", Map.of("type", "link", "link_type", "command"));
        graph.addEdge("Approve-Invoice", "unresolved:Foo", Map.of("type", "link", "link_type", "jump to workflow"));
        graph.freeze();
        return graph;
    }

    @Test
    void roundTripKeepsNodesEdgesAndOrder() throws IOException {
        final Path file = dir.resolve("cache/graph.json.gz");
        final GraphCache cache = new GraphCache();
        cache.save(sample(), file);

        final Graph loaded = cache.load(file);
        assertTrue(loaded.isFrozen());
        assertEquals("Glow", loaded.name());
        assertEquals(3, loaded.nodeCount());
        assertEquals(3, loaded.edgeCount());
        assertEquals(2, loaded.edgesBetween("Invoice", "Approve-Invoice").size());
        assertEquals(List.of("name", "type", "active"), List.copyOf(loaded.attributes("Invoice").keySet()));
        assertEquals(Boolean.TRUE, loaded.attributes("Invoice").get("active"));
        assertEquals(List.of("c1", "c2"), loaded.attributes("Approve-Invoice").get("conditions"));
        assertFalse(loaded.node("unresolved:Foo").orElseThrow().isDefined());
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(IOException.class, () -> new GraphCache().load(dir.resolve("none.gz")));
    }

    @Test
    void otherSchemaIsRejected() throws IOException {
        final Path file = dir.resolve("old.gz");
        try (var out = new java.util.zip.GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("{\"schema\":\"glow-graph/v0\",\"nodes\":[],\"edges\":[]}".getBytes(java.nio.charset.StandardCharsets.UTF_8));
        }
        assertThrows(IOException.class, () -> new GraphCache().load(file));
    }

    @Test
    void notGzipIsAnIoError() throws IOException {
        final Path file = dir.resolve("plain.json");
        Files.writeString(file, "{}");
        assertThrows(IOException.class, () -> new GraphCache().load(file));
    }
}
