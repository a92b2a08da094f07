package glow.navigator.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import glow.navigator.model.Edge;

/**
 * One neighbour reached during a walk.
 *
 * @param level   distance from the start node, starting at 1
 * @param key     neighbour key
 * @param data    neighbour data, empty when undefined
 * @param edges   every parallel edge between the pair
 * @param outcome what the walker did with the neighbour
 */
public record WalkStep(int level, String key, Map<String, Object> data, List<Edge> edges, Outcome outcome) {

    public enum Outcome {
        EXPANDED,
        /** Seen before; listed but not expanded again. */
        REVISITED,
        UNDEFINED,
        DEPTH_LIMIT
    }

    public WalkStep {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        edges = List.copyOf(edges);
    }
}
