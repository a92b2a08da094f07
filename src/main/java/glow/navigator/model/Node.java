package glow.navigator.model;

import java.util.Map;
import java.util.Objects;

/**
 * A graph node. Nodes created implicitly by an edge carry no attributes.
 */
public record Node(String key, Map<String, Object> attributes) {

    public Node {
        Objects.requireNonNull(key, "key");
        attributes = attributes == null ? Map.of() : attributes;
    }

    public NodeKind kind() {
        return NodeKind.of(attributes);
    }

    public boolean isDefined() {
        return !attributes.isEmpty();
    }

    public String name() {
        final Object name = attributes.get(Attr.NAME);
        return name == null ? null : name.toString();
    }
}
