package glow.navigator.record;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import glow.navigator.config.ArtifactType;
import glow.navigator.model.Attr;
import glow.navigator.model.Ids;

/**
 * Read-time view over a raw record using the friendly field names of its
 * artifact type. Unmapped names pass through to the raw record; missing
 * values read as empty.
 */
public final class RecordView {

    static final Set<String> NOISY = Set.of(
            "data", "guid", "tasks", "conditions", "dependencies", "properties", "expression", "content");

    private static final String GUID = "guid";

    private final ArtifactType type;
    private final Map<String, Object> values;

    private RecordView(ArtifactType type, Map<String, Object> values) {
        this.type = Objects.requireNonNull(type, "type");
        this.values = Objects.requireNonNull(values, "values");
    }

    public static RecordView of(ArtifactType type, Map<String, Object> values) {
        return new RecordView(type, values);
    }

    /**
     * Views a nested map (a task, an aggregate rule) through another type.
     * Anything that is not a map reads as an empty record.
     */
    @SuppressWarnings("unchecked")
    public static RecordView nested(ArtifactType type, Object value) {
        if (value instanceof Map<?, ?> map) {
            return new RecordView(type, (Map<String, Object>) map);
        }
        return new RecordView(type, Map.of());
    }

    public ArtifactType type() {
        return type;
    }

    public Optional<Object> get(String friendly) {
        final Object value = values.get(type.rawField(friendly));
        if (value == null) {
            return Optional.empty();
        }
        if (GUID.equals(friendly)) {
            return Optional.of(Ids.guid(value.toString()));
        }
        return Optional.of(value);
    }

    /**
     * String value; blank strings read as absent.
     */
    public Optional<String> text(String friendly) {
        return get(friendly)
                .filter(v -> !(v instanceof Map) && !(v instanceof Collection))
                .map(Object::toString)
                .filter(s -> !s.isBlank());
    }

    public Optional<String> guid() {
        return text(GUID);
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> map(String friendly) {
        return get(friendly)
                .filter(v -> v instanceof Map)
                .map(v -> (Map<String, Object>) v);
    }

    public List<Object> list(String friendly) {
        return get(friendly)
                .filter(v -> v instanceof List)
                .map(v -> Collections.unmodifiableList(new ArrayList<Object>((List<?>) v)))
                .orElse(List.of());
    }

    /**
     * Node attribute bag: mapped scalar fields under friendly names plus the
     * type discriminator. Embedded documents and nested collections are left out.
     */
    public Map<String, Object> attributes() {
        final Map<String, Object> out = new LinkedHashMap<>();
        for (var e : type.fields().entrySet()) {
            final String friendly = e.getKey();
            if (NOISY.contains(friendly) || !values.containsKey(e.getValue())) {
                continue;
            }
            final Object value = values.get(e.getValue());
            if (value == null || value instanceof Map || value instanceof Collection) {
                continue;
            }
            out.put(friendly, value);
        }
        out.put(Attr.TYPE, type.type());
        return out;
    }
}
