package glow.navigator.graph;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import glow.navigator.model.NodeKind;

import static org.junit.jupiter.api.Assertions.*;

class GraphTest {

    @Test
    void edgeToUnknownKeyCreatesUndefinedNode() {
        final Graph graph = new Graph("t");
        graph.addNode("a", Map.of("name", "A", "type", "template"));
        graph.addEdge("a", "b", Map.of("type", "link", "link_type", "show form"));

        assertTrue(graph.hasNode("b"));
        assertFalse(graph.node("b").orElseThrow().isDefined());
        assertEquals(NodeKind.UNRESOLVED, graph.node("b").orElseThrow().kind());
    }

    @Test
    void parallelEdgesAreKept() {
        final Graph graph = new Graph("t");
        graph.addEdge("a", "b", Map.of("link_type", "show form"));
        graph.addEdge("a", "b", Map.of("link_type", "show form"));

        assertEquals(2, graph.edgesBetween("a", "b").size());
        assertEquals(List.of("b"), graph.successors("a"));
        assertEquals(2, graph.outDegree("a"));
        assertEquals(2, graph.inDegree("b"));
    }

    @Test
    void rollbackRestoresTheGraph() {
        final Graph graph = new Graph("t");
        graph.addNode("a", Map.of("name", "A", "type", "template"));
        graph.addEdge("a", "b", Map.of("link_type", "show form"));

        graph.begin();
        graph.addNode("a", Map.of("name", "Renamed"));
        graph.addNode("c", Map.of("name", "C"));
        graph.addEdge("a", "b", Map.of("link_type", "jump"));
        graph.addEdge("c", "d", Map.of("link_type", "jump"));
        graph.rollback();

        assertEquals("A", graph.attributes("a").get("name"));
        assertEquals(List.of("a", "b"), graph.nodes().stream().map(n -> n.key()).toList());
        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.inDegree("b"));
        assertTrue(graph.outEdges("c").isEmpty());

        graph.begin();
        graph.addEdge("b", "a", Map.of());
        graph.commit();
        graph.rollback();
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void mergeKeepsOriginalType() {
        final Graph graph = new Graph("t");
        graph.addNode("Invoice", Map.of("name", "Invoice", "type", "entity"));
        graph.addNode("Invoice", Map.of("type", "metadata", "icon", "x"));

        assertEquals("entity", graph.attributes("Invoice").get("type"));
        assertEquals("x", graph.attributes("Invoice").get("icon"));
    }

    @Test
    void diagnosticsListCallers() {
        final Graph graph = new Graph("Glow");
        graph.addNode("f", Map.of("name", "Approve", "type", "formflow"));
        graph.addEdge("f", "unresolved:Foo", Map.of("type", "link", "link_type", "jump to workflow"));

        final List<GraphDiagnostics.MissingNode> missing = GraphDiagnostics.missingData(graph);
        assertEquals(1, missing.size());
        assertEquals("unresolved:Foo", missing.get(0).key());
        assertEquals("f", missing.get(0).callers().get(0).key());
        assertEquals("jump to workflow", missing.get(0).callers().get(0).via().get(0).get("link_type"));
        assertEquals("Glow: 2 nodes, 1 edges, 1 undefined", GraphDiagnostics.summary(graph));
    }
}
