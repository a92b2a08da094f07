package glow.navigator.query;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import glow.navigator.graph.Graph;

import static org.junit.jupiter.api.Assertions.*;

class GraphWalkerTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = new Graph("t");
        graph.addNode("A", Map.of("name", "A", "type", "formflow"));
        graph.addNode("B", Map.of("name", "B", "type", "formflow"));
        graph.addNode("C", Map.of("name", "C", "type", "template"));
        graph.addEdge("A", "B", Map.of("type", "link", "link_type", "jump to workflow"));
        graph.addEdge("B", "A", Map.of("type", "link", "link_type", "jump to workflow"));
        graph.addEdge("B", "C", Map.of("type", "link", "link_type", "show form"));
        graph.addEdge("B", "C", Map.of("type", "link", "link_type", "show form"));
        graph.addEdge("C", "gone", Map.of("type", "link", "link_type", "background image"));
    }

    private static QueryOptions unbounded() {
        return QueryOptions.defaults().withMaxDepth(0);
    }

    @Test
    @DisplayName("a cycle ends with the start node reported as revisited")
    void cycleTerminates() {
        final List<WalkStep> steps = GraphWalker.walk(graph, "A", GraphWalker.Direction.SUCCESSORS, unbounded());

        assertEquals(List.of("B", "A", "C", "gone"), steps.stream().map(WalkStep::key).toList());
        assertEquals(List.of(1, 2, 2, 3), steps.stream().map(WalkStep::level).toList());
        assertEquals(WalkStep.Outcome.EXPANDED, steps.get(0).outcome());
        assertEquals(WalkStep.Outcome.REVISITED, steps.get(1).outcome());
        assertEquals(WalkStep.Outcome.EXPANDED, steps.get(2).outcome());
        assertEquals(WalkStep.Outcome.UNDEFINED, steps.get(3).outcome());
    }

    @Test
    void parallelEdgesTravelWithTheStep() {
        final List<WalkStep> steps = GraphWalker.walk(graph, "B", GraphWalker.Direction.SUCCESSORS, unbounded());
        final WalkStep toC = steps.stream().filter(s -> s.key().equals("C")).findFirst().orElseThrow();
        assertEquals(2, toC.edges().size());
    }

    @Test
    void depthLimitStopsExpansion() {
        final List<WalkStep> steps = GraphWalker.walk(graph, "A", GraphWalker.Direction.SUCCESSORS, QueryOptions.defaults());
        assertEquals(1, steps.size());
        assertEquals("B", steps.get(0).key());
        assertEquals(WalkStep.Outcome.DEPTH_LIMIT, steps.get(0).outcome());
    }

    @Test
    void predecessorsUseIncomingEdges() {
        final List<WalkStep> steps = GraphWalker.walk(graph, "C", GraphWalker.Direction.PREDECESSORS, unbounded());
        assertEquals("B", steps.get(0).key());
        assertEquals(2, steps.get(0).edges().size());
        assertEquals("A", steps.get(1).key());
    }

    @Test
    void ignoredKindsAreSkipped() {
        final QueryOptions options = unbounded().withIgnoredKinds(Set.of("template"));
        final List<WalkStep> steps = GraphWalker.walk(graph, "B", GraphWalker.Direction.SUCCESSORS, options);
        assertEquals(List.of("A", "B"), steps.stream().map(WalkStep::key).toList());
    }

    @Test
    void unknownStartIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> GraphWalker.walk(graph, "nope", GraphWalker.Direction.SUCCESSORS, unbounded()));
    }
}
