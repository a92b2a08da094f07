package glow.navigator.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Node key conventions.
 * - guids: lower-case, hyphenated
 * - properties and commands: name-owner
 * - tests: test:name
 * - names that never resolved: unresolved:name
 */
public final class Ids {

    public static final String NULL_GUID = "00000000-0000-0000-0000-000000000000";

    private Ids() {
    }

    public static String guid(String raw) {
        Objects.requireNonNull(raw, "raw");
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Formats a plain 32 digit guid with hyphens; hyphenated input is kept.
     */
    public static String fullGuid(String raw) {
        Objects.requireNonNull(raw, "raw");
        final String trimmed = raw.trim();
        if (trimmed.length() == 32 && trimmed.indexOf('-') < 0) {
            final String hyphenated = trimmed.substring(0, 8) + "-" + trimmed.substring(8, 12) + "-"
                    + trimmed.substring(12, 16) + "-" + trimmed.substring(16, 20) + "-" + trimmed.substring(20);
            return UUID.fromString(hyphenated).toString();
        }
        if (trimmed.length() != 36) {
            throw new IllegalArgumentException("Not a guid: " + raw);
        }
        return UUID.fromString(trimmed).toString();
    }

    public static boolean looksLikeGuid(String value) {
        if (value == null) {
            return false;
        }
        try {
            fullGuid(value);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    public static String memberKey(String name, String owner) {
        Objects.requireNonNull(name, "name");
        return name + "-" + owner;
    }

    public static String testKey(String name) {
        Objects.requireNonNull(name, "name");
        return "test:" + name;
    }

    public static String unresolvedKey(String name) {
        Objects.requireNonNull(name, "name");
        return "unresolved:" + name;
    }

    /**
     * Last segment of a dotted path, so entity.collection.field gives field.
     */
    public static String bareProperty(String path) {
        if (path == null) {
            return "";
        }
        final int i = path.lastIndexOf('.');
        return i >= 0 ? path.substring(i + 1) : path;
    }

    public static String baseName(Path file) {
        final Path name = file.getFileName();
        return baseName(name == null ? "" : name.toString());
    }

    public static String baseName(String fileName) {
        final int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        final String last = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        final int dot = last.lastIndexOf('.');
        return dot > 0 ? last.substring(0, dot) : last;
    }
}
