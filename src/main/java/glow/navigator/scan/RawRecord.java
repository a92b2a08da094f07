package glow.navigator.scan;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * One raw record as read from disk, before any field mapping.
 *
 * @param source file the record came from (used for base names and warnings)
 * @param values raw field values
 */
public record RawRecord(Path source, Map<String, Object> values) {

    public RawRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(values, "values");
    }
}
