package glow.navigator.query;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import glow.navigator.model.Attr;

/**
 * Options shared by selection and traversal.
 *
 * @param maxDepth     walk depth; 0 is unbounded
 * @param ignoredKinds node types left out of results and walks
 * @param includeEdges also select nodes through their outgoing edge data
 */
public record QueryOptions(int maxDepth, Set<String> ignoredKinds, boolean includeEdges) {

    public static final int DEFAULT_DEPTH = 1;

    public QueryOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        ignoredKinds = ignoredKinds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(ignoredKinds));
    }

    public static QueryOptions defaults() {
        return new QueryOptions(DEFAULT_DEPTH, Set.of(), false);
    }

    public QueryOptions withMaxDepth(int depth) {
        return new QueryOptions(depth, ignoredKinds, includeEdges);
    }

    public QueryOptions withIgnoredKinds(Set<String> kinds) {
        return new QueryOptions(maxDepth, kinds, includeEdges);
    }

    public QueryOptions withIncludeEdges(boolean include) {
        return new QueryOptions(maxDepth, ignoredKinds, include);
    }

    /**
     * True when a node's type is ignored. Undefined nodes have no type and
     * are never ignored.
     */
    public boolean ignores(Map<String, Object> attributes) {
        final Object type = attributes.get(Attr.TYPE);
        return type != null && ignoredKinds.contains(type.toString());
    }
}
