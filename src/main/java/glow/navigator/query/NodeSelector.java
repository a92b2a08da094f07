package glow.navigator.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import glow.navigator.graph.Graph;
import glow.navigator.model.Attr;
import glow.navigator.model.Edge;
import glow.navigator.model.Node;

/**
 * Regex selection over serialized node data.
 */
public final class NodeSelector {

    private NodeSelector() {
    }

    /**
     * One selected node.
     *
     * @param key  node key
     * @param data copy of the node data with {@code counts} added
     */
    public record Selection(String key, Map<String, Object> data) {

        public String name() {
            final Object name = data.get(Attr.NAME);
            return name == null ? null : name.toString();
        }
    }

    public static Pattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new PatternException(pattern, "Empty pattern", null);
        }
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            throw new PatternException(pattern, "'" + pattern + "' is an invalid regex", ex);
        }
    }

    public static List<Selection> select(Graph graph, String pattern, QueryOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(options, "options");
        final Pattern regex = compile(pattern);

        final List<Selection> out = new ArrayList<>();
        for (Node node : graph.nodes()) {
            if (options.ignores(node.attributes())) {
                continue;
            }
            final Map<String, Object> data = withCounts(graph, node);
            if (regex.matcher(serialize(data)).find() || edgeMatches(graph, node.key(), regex, options)) {
                out.add(new Selection(node.key(), data));
            }
        }
        out.sort(Comparator.comparing(Selection::name, Comparator.nullsFirst(Comparator.<String>naturalOrder())));
        return out;
    }

    /**
     * Node data plus {@code counts: in<out}. Undefined nodes stay empty.
     */
    public static Map<String, Object> withCounts(Graph graph, Node node) {
        final Map<String, Object> data = new LinkedHashMap<>(node.attributes());
        if (!data.isEmpty()) {
            data.put(Attr.COUNTS, graph.inDegree(node.key()) + "<" + graph.outDegree(node.key()));
        }
        return data;
    }

    /**
     * {@code k: v, k: v} in insertion order.
     */
    public static String serialize(Map<String, Object> data) {
        final StringJoiner joiner = new StringJoiner(", ");
        data.forEach((k, v) -> joiner.add(k + ": " + v));
        return joiner.toString();
    }

    private static boolean edgeMatches(Graph graph, String key, Pattern regex, QueryOptions options) {
        if (!options.includeEdges()) {
            return false;
        }
        for (Edge edge : graph.outEdges(key)) {
            if (options.ignores(graph.attributes(edge.to()))) {
                continue;
            }
            if (regex.matcher(serialize(edge.attributes())).find()) {
                return true;
            }
        }
        return false;
    }
}
