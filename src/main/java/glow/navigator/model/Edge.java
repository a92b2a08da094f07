package glow.navigator.model;

import java.util.Map;
import java.util.Objects;

/**
 * Directed edge from referrer to referent. Parallel edges between the same
 * pair are distinct instances.
 */
public record Edge(String from, String to, Map<String, Object> attributes) {

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        attributes = attributes == null ? Map.of() : attributes;
    }

    public String linkType() {
        final Object linkType = attributes.get(Attr.LINK_TYPE);
        return linkType == null ? null : linkType.toString();
    }
}
