package glow.navigator.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import glow.navigator.model.Ids;

/**
 * Binds references expressed by name rather than by stable key.
 */
public final class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ReferenceTables tables;
    private int misses;

    public ReferenceResolver(ReferenceTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
    }

    /**
     * Result of an owner lookup.
     *
     * @param owner entity the reference binds to
     * @param miss  true when the name was never registered
     */
    public record Resolution(String owner, boolean miss) {
    }

    public void recordCommand(String command, String owner) {
        tables.commands().record(command, owner);
    }

    /**
     * Entity owning a command: the requester when it defines the command,
     * otherwise the first entity that registered it. An entity may invoke a
     * command it inherits from another.
     */
    public Resolution resolveOwner(String command, String requestingOwner) {
        final LookupTable commands = tables.commands();
        if (!commands.contains(command)) {
            misses++;
            return new Resolution(requestingOwner, true);
        }
        if (commands.contains(command, requestingOwner)) {
            return new Resolution(requestingOwner, false);
        }
        return new Resolution(commands.first(command).orElse(requestingOwner), false);
    }

    /**
     * Key of the command node a caller in {@code requestingOwner} refers to.
     */
    public String commandKey(String command, String requestingOwner) {
        return Ids.memberKey(command, resolveOwner(command, requestingOwner).owner());
    }

    /**
     * Links {@code source} to a property named by a possibly dotted path.
     * The exact key {@code bare-owner} wins; otherwise a single node whose
     * name equals the bare name is used. No match or several matches drop
     * the edge.
     *
     * @return true when an edge was added
     */
    public boolean resolvePropertyEdge(Graph graph,
                                       String source,
                                       String propertyPath,
                                       String owner,
                                       Map<String, Object> edgeAttributes) {
        final String bare = Ids.bareProperty(propertyPath);
        if (bare.isEmpty()) {
            return false;
        }
        if (owner != null && graph.hasNode(Ids.memberKey(bare, owner))) {
            graph.addEdge(source, Ids.memberKey(bare, owner), edgeAttributes);
            return true;
        }
        final List<String> candidates = graph.keysByName(bare);
        if (candidates.size() == 1) {
            graph.addEdge(source, candidates.get(0), edgeAttributes);
            return true;
        }
        log.debug("Dropped property reference {} from {}: {} candidates", propertyPath, source, candidates.size());
        return false;
    }

    /**
     * Links {@code source} to {@code bare-owner} only if that node exists.
     */
    public boolean linkIfPresent(Graph graph,
                                 String source,
                                 String propertyPath,
                                 String owner,
                                 Map<String, Object> edgeAttributes) {
        if (owner == null) {
            return false;
        }
        final String key = Ids.memberKey(Ids.bareProperty(propertyPath), owner);
        if (!graph.hasNode(key)) {
            return false;
        }
        graph.addEdge(source, key, edgeAttributes);
        return true;
    }

    public int misses() {
        return misses;
    }
}
