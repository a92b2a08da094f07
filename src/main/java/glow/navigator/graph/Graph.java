package glow.navigator.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import glow.navigator.model.Attr;
import glow.navigator.model.Edge;
import glow.navigator.model.Node;

/**
 * Directed multigraph of Glow objects.
 * - nodes keyed by a stable string; an edge to an unknown key creates an empty node
 * - parallel edges are kept and returned individually
 * - mutable while being assembled, read-only once frozen
 * - changes made between {@link #begin()} and {@link #rollback()} are taken back as a unit
 */
public final class Graph {

    private final String name;
    private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Edge>> incoming = new LinkedHashMap<>();
    private List<Runnable> undo;
    private boolean frozen;

    public Graph(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /**
     * Adds a node or merges attributes into an existing one. The type of a
     * node that already has one is never replaced.
     */
    public void addNode(String key, Map<String, Object> attributes) {
        checkMutable();
        Objects.requireNonNull(key, "key");
        final Map<String, Object> existing = nodes.get(key);
        if (existing == null) {
            nodes.put(key, new LinkedHashMap<>(attributes));
            journal(() -> nodes.remove(key));
            return;
        }
        if (undo != null) {
            final Map<String, Object> before = new LinkedHashMap<>(existing);
            journal(() -> {
                existing.clear();
                existing.putAll(before);
            });
        }
        final Object kind = existing.get(Attr.TYPE);
        existing.putAll(attributes);
        if (kind != null) {
            existing.put(Attr.TYPE, kind);
        }
    }

    public Edge addEdge(String from, String to, Map<String, Object> attributes) {
        checkMutable();
        final Edge edge = new Edge(from, to, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
        final boolean newFrom = !nodes.containsKey(from);
        nodes.computeIfAbsent(from, k -> new LinkedHashMap<>());
        final boolean newTo = !nodes.containsKey(to);
        nodes.computeIfAbsent(to, k -> new LinkedHashMap<>());
        edges.add(edge);
        outgoing.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(to, k -> new ArrayList<>()).add(edge);
        journal(() -> {
            edges.remove(edges.size() - 1);
            removeLast(outgoing, from);
            removeLast(incoming, to);
            if (newTo) {
                nodes.remove(to);
            }
            if (newFrom) {
                nodes.remove(from);
            }
        });
        return edge;
    }

    /**
     * Starts journaling changes. Only one unit is open at a time.
     */
    void begin() {
        checkMutable();
        undo = new ArrayList<>();
    }

    void commit() {
        undo = null;
    }

    /**
     * Undoes every change since {@link #begin()}, newest first.
     */
    void rollback() {
        if (undo == null) {
            return;
        }
        final List<Runnable> changes = undo;
        undo = null;
        for (int i = changes.size() - 1; i >= 0; i--) {
            changes.get(i).run();
        }
    }

    public void freeze() {
        undo = null;
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean hasNode(String key) {
        return nodes.containsKey(key);
    }

    public Optional<Node> node(String key) {
        final Map<String, Object> attrs = nodes.get(key);
        return attrs == null ? Optional.empty() : Optional.of(view(key, attrs));
    }

    /**
     * Attributes of a node, empty for implicit or unknown nodes.
     */
    public Map<String, Object> attributes(String key) {
        final Map<String, Object> attrs = nodes.get(key);
        return attrs == null ? Map.of() : Collections.unmodifiableMap(attrs);
    }

    public List<Node> nodes() {
        final List<Node> out = new ArrayList<>(nodes.size());
        nodes.forEach((key, attrs) -> out.add(view(key, attrs)));
        return out;
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> outEdges(String key) {
        return Collections.unmodifiableList(outgoing.getOrDefault(key, List.of()));
    }

    public List<Edge> inEdges(String key) {
        return Collections.unmodifiableList(incoming.getOrDefault(key, List.of()));
    }

    /**
     * Every parallel edge from one node to another, in insertion order.
     */
    public List<Edge> edgesBetween(String from, String to) {
        final List<Edge> out = new ArrayList<>();
        for (Edge edge : outgoing.getOrDefault(from, List.of())) {
            if (edge.to().equals(to)) {
                out.add(edge);
            }
        }
        return out;
    }

    public List<String> successors(String key) {
        final LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Edge edge : outgoing.getOrDefault(key, List.of())) {
            out.add(edge.to());
        }
        return new ArrayList<>(out);
    }

    public List<String> predecessors(String key) {
        final LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Edge edge : incoming.getOrDefault(key, List.of())) {
            out.add(edge.from());
        }
        return new ArrayList<>(out);
    }

    public int inDegree(String key) {
        return incoming.getOrDefault(key, List.of()).size();
    }

    public int outDegree(String key) {
        return outgoing.getOrDefault(key, List.of()).size();
    }

    /**
     * Keys of nodes whose name attribute equals {@code value}.
     */
    public List<String> keysByName(String value) {
        final List<String> out = new ArrayList<>();
        nodes.forEach((key, attrs) -> {
            final Object nodeName = attrs.get(Attr.NAME);
            if (nodeName != null && nodeName.toString().equals(value)) {
                out.add(key);
            }
        });
        return out;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    private void journal(Runnable change) {
        if (undo != null) {
            undo.add(change);
        }
    }

    private static void removeLast(Map<String, List<Edge>> index, String key) {
        final List<Edge> list = index.get(key);
        list.remove(list.size() - 1);
        if (list.isEmpty()) {
            index.remove(key);
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Graph '" + name + "' is read-only");
        }
    }

    private static Node view(String key, Map<String, Object> attrs) {
        return new Node(key, Collections.unmodifiableMap(attrs));
    }
}
