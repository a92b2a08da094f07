package glow.navigator.scan;

import java.io.IOException;
import java.util.List;

import glow.navigator.config.ArtifactType;

/**
 * Enumerates the raw records of one artifact type.
 */
public interface RecordSource {

    /**
     * Records in a stable order. Types without a path yield nothing;
     * unreadable records are skipped, enumeration failures propagate.
     */
    List<RawRecord> enumerate(ArtifactType type) throws IOException;

    /**
     * Records skipped so far because they could not be read or parsed.
     */
    default int skippedCount() {
        return 0;
    }
}
