package glow.navigator.io;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import glow.navigator.graph.Graph;
import glow.navigator.model.Edge;
import glow.navigator.model.Node;

/**
 * Saves a built graph as gzip-compressed JSON and reads it back frozen.
 * Snapshots of another schema are rejected, not migrated.
 */
public final class GraphCache {

    public static final String SCHEMA_VERSION = "glow-graph/v1";

    private final ObjectMapper mapper;

    public GraphCache() {
        this.mapper = new ObjectMapper()
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
                .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void save(Graph graph, Path file) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(file, "file");

        final List<NodeEntry> nodes = new ArrayList<>(graph.nodeCount());
        for (Node node : graph.nodes()) {
            nodes.add(new NodeEntry(node.key(), node.attributes()));
        }
        final List<EdgeEntry> edges = new ArrayList<>(graph.edgeCount());
        for (Edge edge : graph.edges()) {
            edges.add(new EdgeEntry(edge.from(), edge.to(), edge.attributes()));
        }
        final GraphSnapshot snapshot = new GraphSnapshot(SCHEMA_VERSION, graph.name(), nodes, edges);

        final Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        // write next to the target, then move, so a failed save keeps the old cache
        final Path tmp = Files.createTempFile(dir, "glow-cache", ".tmp");
        try {
            try (OutputStream out = new GZIPOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp)))) {
                mapper.writeValue(out, snapshot);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public Graph load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Cache file not found: " + file);
        }
        final GraphSnapshot snapshot;
        try (InputStream in = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            snapshot = mapper.readValue(in, GraphSnapshot.class);
        }
        if (!SCHEMA_VERSION.equals(snapshot.schema())) {
            throw new IOException("Unsupported cache schema '" + snapshot.schema() + "' in " + file);
        }

        final Graph graph = new Graph(snapshot.name() == null ? "Glow" : snapshot.name());
        for (NodeEntry node : snapshot.nodes()) {
            graph.addNode(node.key(), node.attributes() == null ? Map.of() : node.attributes());
        }
        for (EdgeEntry edge : snapshot.edges()) {
            graph.addEdge(edge.from(), edge.to(), edge.attributes() == null ? Map.of() : edge.attributes());
        }
        graph.freeze();
        return graph;
    }

    // --- snapshot records ---

    public record GraphSnapshot(
            String schema,
            String name,
            List<NodeEntry> nodes,
            List<EdgeEntry> edges
    ) {
        public GraphSnapshot {
            nodes = nodes == null ? List.of() : nodes;
            edges = edges == null ? List.of() : edges;
        }
    }

    public record NodeEntry(String key, Map<String, Object> attributes) {
    }

    public record EdgeEntry(String from, String to, Map<String, Object> attributes) {
    }
}
