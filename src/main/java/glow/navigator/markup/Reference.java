package glow.navigator.markup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import glow.navigator.model.Attr;

/**
 * Reference descriptor extracted from one embedded element.
 *
 * @param kind   descriptor shape
 * @param tag    element tag with any namespace removed
 * @param topics mapped attribute values; empty values are never present
 */
public record Reference(ReferenceKind kind, String tag, Map<String, String> topics) {

    public Reference {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(tag, "tag");
        topics = Collections.unmodifiableMap(new LinkedHashMap<>(topics));
    }

    public Optional<String> get(String topic) {
        return Optional.ofNullable(topics.get(topic));
    }

    public boolean has(String topic) {
        return topics.containsKey(topic);
    }

    /**
     * Topics of {@code other} are added where this descriptor has none.
     */
    public Reference mergedWith(Reference other) {
        final Map<String, String> merged = new LinkedHashMap<>(topics);
        other.topics.forEach(merged::putIfAbsent);
        return new Reference(kind, tag, merged);
    }

    public Map<String, Object> toEdgeAttributes() {
        return toEdgeAttributes(kind.linkType());
    }

    public Map<String, Object> toEdgeAttributes(String linkType) {
        final Map<String, Object> out = new LinkedHashMap<>(topics);
        out.put(Attr.TYPE, Attr.LINK);
        out.put(Attr.LINK_TYPE, linkType);
        return out;
    }
}
