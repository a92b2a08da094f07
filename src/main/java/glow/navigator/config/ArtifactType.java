package glow.navigator.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of glow-settings.yaml.
 *
 * @param type     node kind written to the type attribute
 * @param color    console colour for display
 * @param display  fields shown on the console, in order
 * @param path     glob relative to the source root; null for nested or synthetic types
 * @param format   "yaml" (default) or "text"
 * @param fields   friendly name to raw field name
 * @param matchers free-text matcher regexes keyed by target kind (tests only)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactType(
        String type,
        String color,
        List<String> display,
        String path,
        String format,
        Map<String, String> fields,
        Map<String, String> matchers
) {

    public static final String FORMAT_TEXT = "text";

    public ArtifactType {
        display = display == null ? List.of() : List.copyOf(display);
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        matchers = matchers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(matchers));
    }

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }

    public boolean isText() {
        return FORMAT_TEXT.equalsIgnoreCase(format);
    }

    /**
     * Raw field name behind a friendly name; unmapped names pass through.
     */
    public String rawField(String friendly) {
        return fields.getOrDefault(friendly, friendly);
    }
}
