package glow.navigator.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import glow.navigator.graph.Graph;
import glow.navigator.model.Edge;

/**
 * Depth-first walk over the parents or children of a node.
 * Uses an explicit stack so deep graphs cannot overflow the call stack.
 */
public final class GraphWalker {

    public enum Direction {
        PREDECESSORS,
        SUCCESSORS
    }

    private GraphWalker() {
    }

    private static final class Frame {
        final String key;
        final int level;
        final Iterator<String> neighbours;

        Frame(String key, int level, Iterator<String> neighbours) {
            this.key = key;
            this.level = level;
            this.neighbours = neighbours;
        }
    }

    /**
     * Steps in pre-order. A node already expanded is reported as REVISITED
     * and not expanded again.
     */
    public static List<WalkStep> walk(Graph graph, String start, Direction direction, QueryOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(options, "options");
        if (start == null || !graph.hasNode(start)) {
            throw new IllegalArgumentException("Unknown node: " + start);
        }

        final List<WalkStep> steps = new ArrayList<>();
        final Set<String> visited = new HashSet<>();
        visited.add(start);

        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, 1, neighbours(graph, start, direction).iterator()));

        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();
            if (!frame.neighbours.hasNext()) {
                stack.pop();
                continue;
            }
            final String next = frame.neighbours.next();
            final Map<String, Object> data = graph.attributes(next);
            if (options.ignores(data)) {
                continue;
            }
            final List<Edge> edges = direction == Direction.PREDECESSORS
                    ? graph.edgesBetween(next, frame.key)
                    : graph.edgesBetween(frame.key, next);

            if (data.isEmpty()) {
                steps.add(new WalkStep(frame.level, next, data, edges, WalkStep.Outcome.UNDEFINED));
            } else if (visited.contains(next)) {
                steps.add(new WalkStep(frame.level, next, data, edges, WalkStep.Outcome.REVISITED));
            } else if (options.maxDepth() != 0 && frame.level >= options.maxDepth()) {
                steps.add(new WalkStep(frame.level, next, data, edges, WalkStep.Outcome.DEPTH_LIMIT));
            } else {
                steps.add(new WalkStep(frame.level, next, data, edges, WalkStep.Outcome.EXPANDED));
                visited.add(next);
                stack.push(new Frame(next, frame.level + 1, neighbours(graph, next, direction).iterator()));
            }
        }
        return steps;
    }

    private static List<String> neighbours(Graph graph, String key, Direction direction) {
        return direction == Direction.PREDECESSORS ? graph.predecessors(key) : graph.successors(key);
    }
}
