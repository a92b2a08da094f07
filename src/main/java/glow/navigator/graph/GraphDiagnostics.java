package glow.navigator.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import glow.navigator.model.Edge;
import glow.navigator.model.Node;

/**
 * Reports on nodes that are referenced but never defined.
 */
public final class GraphDiagnostics {

    private GraphDiagnostics() {
    }

    /**
     * One undefined node with the edges pointing at it.
     *
     * @param key     undefined node key
     * @param callers incoming edges, each with its source node data
     */
    public record MissingNode(String key, List<Caller> callers) {
    }

    /**
     * @param key        caller node key
     * @param attributes caller node data
     * @param via        edge data, one entry per parallel edge
     */
    public record Caller(String key, Map<String, Object> attributes, List<Map<String, Object>> via) {
    }

    public static List<MissingNode> missingData(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        final List<MissingNode> out = new ArrayList<>();
        for (Node node : graph.nodes()) {
            if (node.isDefined()) {
                continue;
            }
            final List<Caller> callers = new ArrayList<>();
            for (String caller : graph.predecessors(node.key())) {
                final List<Map<String, Object>> via = new ArrayList<>();
                for (Edge edge : graph.edgesBetween(caller, node.key())) {
                    via.add(edge.attributes());
                }
                callers.add(new Caller(caller, graph.attributes(caller), via));
            }
            out.add(new MissingNode(node.key(), callers));
        }
        return out;
    }

    public static long undefinedCount(Graph graph) {
        return graph.nodes().stream().filter(n -> !n.isDefined()).count();
    }

    /**
     * Single line such as {@code Glow: 120 nodes, 340 edges, 4 undefined}.
     */
    public static String summary(Graph graph) {
        return graph.name() + ": " + graph.nodeCount() + " nodes, "
                + graph.edgeCount() + " edges, "
                + undefinedCount(graph) + " undefined";
    }
}
