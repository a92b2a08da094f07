package glow.navigator.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import glow.navigator.graph.Graph;

import static org.junit.jupiter.api.Assertions.*;

class NodeSelectorTest {

    private Graph graph;

    private static Map<String, Object> node(String name, String type) {
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("type", type);
        return out;
    }

    @BeforeEach
    void setUp() {
        graph = new Graph("t");
        graph.addNode("t2", node("Receipt", "template"));
        graph.addNode("t1", node("InvoiceDetail", "template"));
        graph.addNode("f1", node("Approve", "formflow"));
        graph.addEdge("f1", "t1", Map.of("type", "link", "link_type", "show form"));
        graph.addEdge("f1", "t1", Map.of("type", "link", "link_type", "show form"));
        graph.addEdge("f1", "missing", Map.of("type", "link", "link_type", "jump to workflow"));
    }

    @Test
    @DisplayName("matches are case-insensitive and sorted by name")
    void selectsByType() {
        final List<NodeSelector.Selection> hits = NodeSelector.select(graph, "TYPE: template", QueryOptions.defaults());
        assertEquals(List.of("InvoiceDetail", "Receipt"), hits.stream().map(NodeSelector.Selection::name).toList());
    }

    @Test
    @DisplayName("counts are in-degree and out-degree and are not written to the graph")
    void countsAreAddedToCopies() {
        final List<NodeSelector.Selection> hits = NodeSelector.select(graph, "counts: 0<3", QueryOptions.defaults());
        assertEquals(1, hits.size());
        assertEquals("f1", hits.get(0).key());
        assertFalse(graph.attributes("f1").containsKey("counts"));

        assertEquals("2<0", NodeSelector.select(graph, "InvoiceDetail", QueryOptions.defaults()).get(0).data().get("counts"));
    }

    @Test
    void lookaheadQueries() {
        final List<NodeSelector.Selection> hits =
                NodeSelector.select(graph, "(?=.*type: template)(?=.*name: rec)", QueryOptions.defaults());
        assertEquals(1, hits.size());
        assertEquals("t2", hits.get(0).key());
    }

    @Test
    void ignoredKindsAreSkipped() {
        final QueryOptions options = QueryOptions.defaults().withIgnoredKinds(Set.of("template"));
        assertTrue(NodeSelector.select(graph, "template", options).isEmpty());
    }

    @Test
    @DisplayName("edge data only selects a node when edges are included")
    void edgeMatching() {
        assertTrue(NodeSelector.select(graph, "jump to workflow", QueryOptions.defaults()).isEmpty());

        final QueryOptions withEdges = QueryOptions.defaults().withIncludeEdges(true);
        final List<NodeSelector.Selection> hits = NodeSelector.select(graph, "jump to workflow", withEdges);
        assertEquals(1, hits.size());
        assertEquals("f1", hits.get(0).key());
    }

    @Test
    void edgesToIgnoredKindsDoNotCount() {
        final QueryOptions options = QueryOptions.defaults().withIncludeEdges(true).withIgnoredKinds(Set.of("template"));
        assertTrue(NodeSelector.select(graph, "show form", options).isEmpty());
    }

    @Test
    void undefinedNodesSortFirstAndCarryNoCounts() {
        final List<NodeSelector.Selection> all = NodeSelector.select(graph, ".*", QueryOptions.defaults());
        assertEquals(4, all.size());
        assertEquals("missing", all.get(0).key());
        assertTrue(all.get(0).data().isEmpty());
    }

    @Test
    void invalidPatternIsRejected() {
        final PatternException ex = assertThrows(PatternException.class,
                () -> NodeSelector.select(graph, "name: (", QueryOptions.defaults()));
        assertEquals("name: (", ex.pattern());
        assertThrows(PatternException.class, () -> NodeSelector.select(graph, "  ", QueryOptions.defaults()));
    }
}
