package glow.navigator.graph;

import java.util.Objects;

/**
 * Outcome of one build.
 *
 * @param graph           frozen graph
 * @param tables          lookup tables filled during the build
 * @param parseWarnings   records skipped because they could not be read
 * @param unresolvedNames name references that matched nothing
 */
public record AssemblyResult(Graph graph, ReferenceTables tables, int parseWarnings, int unresolvedNames) {

    public AssemblyResult {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(tables, "tables");
    }

    /**
     * Result for a graph read back from a cache. Lookup tables are not
     * cached, so they are empty.
     */
    public static AssemblyResult cached(Graph graph) {
        final ReferenceTables tables = new ReferenceTables();
        tables.freeze();
        return new AssemblyResult(graph, tables, 0, 0);
    }
}
