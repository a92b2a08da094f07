package glow.navigator.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Artifact type catalogue loaded from glow-settings.yaml.
 * Keys keep file order.
 */
public final class Settings {

    public static final String DEFAULT_RESOURCE = "/glow-settings.yaml";

    private static final TypeReference<LinkedHashMap<String, ArtifactType>> TYPES =
            new TypeReference<>() {
            };

    private final Map<String, ArtifactType> types;

    private Settings(Map<String, ArtifactType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static Settings of(Map<String, ArtifactType> types) {
        Objects.requireNonNull(types, "types");
        return new Settings(types);
    }

    public static Settings loadDefault() {
        try (InputStream in = Settings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new SettingsException("Settings resource not found: " + DEFAULT_RESOURCE);
            }
            return new Settings(mapper().readValue(in, TYPES));
        } catch (IOException ex) {
            throw new SettingsException("Unable to read " + DEFAULT_RESOURCE, ex);
        }
    }

    public static Settings load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new SettingsException("Settings file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return new Settings(mapper().readValue(in, TYPES));
        } catch (IOException ex) {
            throw new SettingsException("Unable to read " + file, ex);
        }
    }

    public Optional<ArtifactType> find(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public ArtifactType require(String name) {
        final ArtifactType type = types.get(name);
        if (type == null) {
            throw new SettingsException("Artifact type not configured: " + name);
        }
        return type;
    }

    /**
     * Lookup by the node kind written to the type attribute, used for display.
     */
    public Optional<ArtifactType> forKind(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        final ArtifactType direct = types.get(kind);
        if (direct != null) {
            return Optional.of(direct);
        }
        return types.values().stream().filter(t -> kind.equals(t.type())).findFirst();
    }

    public Map<String, ArtifactType> types() {
        return types;
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper(new YAMLFactory());
    }
}
