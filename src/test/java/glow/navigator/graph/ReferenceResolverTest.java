package glow.navigator.graph;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private ReferenceTables tables;
    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        tables = new ReferenceTables();
        resolver = new ReferenceResolver(tables);
    }

    private static Map<String, Object> attrs(String name) {
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("type", "property");
        return out;
    }

    @Test
    @DisplayName("a command defined elsewhere binds to its first owner")
    void inheritedCommand() {
        resolver.recordCommand("Approve", "Invoice");
        resolver.recordCommand("Approve", "Order");

        final ReferenceResolver.Resolution fromReceipt = resolver.resolveOwner("Approve", "Receipt");
        assertEquals("Invoice", fromReceipt.owner());
        assertFalse(fromReceipt.miss());

        assertEquals("Order", resolver.resolveOwner("Approve", "Order").owner());
        assertEquals("Approve-Invoice", resolver.commandKey("Approve", "Receipt"));
        assertEquals(0, resolver.misses());
    }

    @Test
    void unknownCommandStaysWithRequester() {
        final ReferenceResolver.Resolution r = resolver.resolveOwner("Archive", "Receipt");
        assertEquals("Receipt", r.owner());
        assertTrue(r.miss());
        assertEquals(1, resolver.misses());
    }

    @Test
    void exactPropertyKeyWins() {
        final Graph graph = new Graph("t");
        graph.addNode("Total-Invoice", attrs("Total"));
        graph.addNode("Total-Order", attrs("Total"));

        assertTrue(resolver.resolvePropertyEdge(graph, "form", "Invoice.Lines.Total", "Invoice", Map.of("type", "link")));
        assertEquals(1, graph.edgesBetween("form", "Total-Invoice").size());
    }

    @Test
    void uniqueNameFallback() {
        final Graph graph = new Graph("t");
        graph.addNode("Discount-Customer", attrs("Discount"));

        assertTrue(resolver.resolvePropertyEdge(graph, "form", "Customer.Discount", "Invoice", Map.of()));
        assertEquals(1, graph.outDegree("form"));
    }

    @Test
    @DisplayName("no match or an ambiguous name adds no edge")
    void ambiguousOrMissingIsDropped() {
        final Graph graph = new Graph("t");
        graph.addNode("Total-Order", attrs("Total"));
        graph.addNode("Total-Quote", attrs("Total"));

        assertFalse(resolver.resolvePropertyEdge(graph, "form", "Total", "Invoice", Map.of()));
        assertFalse(resolver.resolvePropertyEdge(graph, "form", "Missing", "Invoice", Map.of()));
        assertFalse(graph.hasNode("form"));
    }

    @Test
    void linkIfPresentHasNoFallback() {
        final Graph graph = new Graph("t");
        graph.addNode("Discount-Customer", attrs("Discount"));

        assertFalse(resolver.linkIfPresent(graph, "cond", "Discount", "Invoice", Map.of()));
        assertTrue(resolver.linkIfPresent(graph, "cond", "Customer.Discount", "Customer", Map.of()));
        assertFalse(resolver.linkIfPresent(graph, "cond", "Discount", null, Map.of()));
    }

    @Test
    void lookupTableKeepsFirstRegistration() {
        final LookupTable table = tables.templates();
        table.record("Home", "a");
        table.record("Home", "b");
        table.record("Home", "a");
        assertEquals("a", table.first("Home").orElseThrow());
        assertTrue(table.contains("Home", "b"));
        assertTrue(table.first("Other").isEmpty());
    }

    @Test
    void frozenTablesRejectWrites() {
        tables.freeze();
        assertThrows(IllegalStateException.class, () -> tables.modules().record("FIN", "x"));
    }

    @Test
    void matcherTables() {
        assertSame(tables.workflows(), tables.forMatcher("workflow"));
        assertSame(tables.modules(), tables.forMatcher("module"));
        assertThrows(IllegalArgumentException.class, () -> tables.forMatcher("sound"));
    }
}
