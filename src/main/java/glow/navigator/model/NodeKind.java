package glow.navigator.model;

import java.util.Locale;
import java.util.Map;

/**
 * Role of a node in the graph. Stored under the {@code type} attribute.
 */
public enum NodeKind {
    ENTITY,
    PROPERTY,
    COMMAND,
    CONDITION,
    FORMFLOW,
    TEMPLATE,
    MODULE,
    IMAGE,
    SOUND,
    INDEX,
    TEST,
    UNRESOLVED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kind of an attribute bag; an empty bag is an unresolved reference.
     */
    public static NodeKind of(Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return UNRESOLVED;
        }
        final Object type = attributes.get(Attr.TYPE);
        if (type == null) {
            return UNRESOLVED;
        }
        try {
            return valueOf(type.toString().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNRESOLVED;
        }
    }
}
