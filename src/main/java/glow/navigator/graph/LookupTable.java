package glow.navigator.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name to node keys, filled while records are processed:
 * - command name -> owning entities
 * - workflow/template/module name -> guid
 * The first registration is canonical.
 */
public final class LookupTable {

    private final String name;
    private final Map<String, List<String>> entries = new HashMap<>();
    private boolean frozen;

    public LookupTable(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public void record(String key, String value) {
        if (frozen) {
            throw new IllegalStateException("Lookup table '" + name + "' is read-only");
        }
        if (key == null || value == null) {
            return;
        }
        final List<String> values = entries.computeIfAbsent(key, k -> new ArrayList<>());
        if (!values.contains(value)) {
            values.add(value);
        }
    }

    public Optional<String> first(String key) {
        final List<String> values = entries.get(key);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean contains(String key, String value) {
        return entries.getOrDefault(key, List.of()).contains(value);
    }

    void freeze() {
        frozen = true;
    }
}
