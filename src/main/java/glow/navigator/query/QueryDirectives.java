package glow.navigator.query;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import glow.navigator.graph.GraphDiagnostics;

/**
 * Console lines starting with {@code $$} that change the session:
 * - $$max_level=n walk depth, 0 for unbounded
 * - $$ignore=a b node types to leave out; empty clears the list
 * - $$edges=true|false also match outgoing edge data
 * - $$rebuild rebuild the graph from the sources
 * - $$missing report undefined nodes
 */
public final class QueryDirectives {

    private static final Logger log = LoggerFactory.getLogger(QueryDirectives.class);

    public static final String PREFIX = "$$";

    public enum Action {
        MAX_LEVEL,
        IGNORE,
        EDGES,
        REBUILD,
        MISSING,
        UNKNOWN
    }

    /**
     * @param action  directive recognised
     * @param ok      false when the value was rejected and nothing changed
     * @param message text for the operator
     */
    public record Result(Action action, boolean ok, String message) {
    }

    private QueryDirectives() {
    }

    public static boolean isDirective(String line) {
        return line != null && line.trim().startsWith(PREFIX);
    }

    /**
     * A rebuild that fails leaves the current graph in place and is reported
     * as a rejected directive.
     */
    public static Result apply(String line, NavigatorSession session) {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(session, "session");
        final String directive = line.trim();
        final QueryOptions options = session.options();

        if (directive.startsWith("$$max_level=")) {
            final String value = valueOf(directive);
            try {
                final int level = Integer.parseInt(value);
                session.options(options.withMaxDepth(level));
                return new Result(Action.MAX_LEVEL, true, "MAX_LEVEL updated to " + level);
            } catch (IllegalArgumentException ex) {
                return new Result(Action.MAX_LEVEL, false, "Invalid value for max level: '" + value + "'");
            }
        }
        if (directive.startsWith("$$ignore=")) {
            final Set<String> kinds = new LinkedHashSet<>();
            final String value = valueOf(directive);
            if (!value.isEmpty()) {
                kinds.addAll(Arrays.asList(value.split("\\s+")));
            }
            session.options(options.withIgnoredKinds(kinds));
            return new Result(Action.IGNORE, true, "IGNORE_TYPES updated to " + kinds);
        }
        if (directive.startsWith("$$edges=")) {
            final String value = valueOf(directive);
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                return new Result(Action.EDGES, false, "Invalid value for edges: '" + value + "'");
            }
            final boolean include = Boolean.parseBoolean(value);
            session.options(options.withIncludeEdges(include));
            return new Result(Action.EDGES, true, "EDGES updated to " + include);
        }
        if ("$$rebuild".equals(directive)) {
            try {
                session.rebuild();
            } catch (IOException ex) {
                log.warn("Rebuild failed, keeping the current graph", ex);
                return new Result(Action.REBUILD, false, "Rebuild failed: " + ex.getMessage());
            }
            return new Result(Action.REBUILD, true, "Rebuilt " + GraphDiagnostics.summary(session.current().graph()));
        }
        if ("$$missing".equals(directive)) {
            final int count = GraphDiagnostics.missingData(session.current().graph()).size();
            return new Result(Action.MISSING, true, count + " nodes have no data");
        }
        return new Result(Action.UNKNOWN, false, "Unknown directive: " + directive);
    }

    private static String valueOf(String directive) {
        return directive.substring(directive.indexOf('=') + 1).trim();
    }
}
