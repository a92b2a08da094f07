package glow.navigator.scan;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import glow.navigator.config.ArtifactType;
import glow.navigator.model.Ids;

/**
 * Reads records below a source root, matching each type's path glob against
 * root-relative paths.
 * - yaml types: one record per file
 * - text types: {name, content} per file
 */
public final class FileRecordSource implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(FileRecordSource.class);

    private static final Set<String> SKIPPED_DIRS = Set.of(".git", ".idea", "bin", "obj", "node_modules");

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD =
            new TypeReference<>() {
            };

    private final Path root;
    private final ObjectMapper yamlMapper;
    private int skipped;

    public FileRecordSource(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    @Override
    public List<RawRecord> enumerate(ArtifactType type) throws IOException {
        Objects.requireNonNull(type, "type");
        if (!type.hasPath() || !Files.isDirectory(root)) {
            return List.of();
        }

        final List<RawRecord> out = new ArrayList<>();
        for (Path file : matchingFiles(type.path())) {
            if (type.isText()) {
                final RawRecord text = textRecord(file);
                if (text != null) {
                    out.add(text);
                }
                continue;
            }
            final Map<String, Object> values = readYaml(file);
            if (values != null && !values.isEmpty()) {
                out.add(new RawRecord(file, values));
            }
        }
        return out;
    }

    @Override
    public int skippedCount() {
        return skipped;
    }

    List<Path> matchingFiles(String glob) throws IOException {
        final PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (!dir.equals(root) && SKIPPED_DIRS.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final Path rel = root.relativize(file);
                if (attrs.isRegularFile() && matcher.matches(rel)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }

    private Map<String, Object> readYaml(Path file) throws IOException {
        final String text = readUtf8(file);
        if (text == null) {
            return null;
        }
        if (text.isBlank()) {
            log.debug("Skipping empty record {}", file);
            return null;
        }
        try {
            return yamlMapper.readValue(text, RECORD);
        } catch (JsonProcessingException ex) {
            skipped++;
            log.warn("Skipping unparsable record {}: {}", file, safeMsg(ex.getOriginalMessage()));
            return null;
        }
    }

    private RawRecord textRecord(Path file) throws IOException {
        final String content = readUtf8(file);
        if (content == null) {
            return null;
        }
        final Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", Ids.baseName(file));
        values.put("file", root.relativize(file).toString().replace('\\', '/'));
        values.put("content", content);
        return new RawRecord(file, values);
    }

    /**
     * File content, or null (counted as skipped) when it is not UTF-8.
     */
    private String readUtf8(Path file) throws IOException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            skipped++;
            log.warn("Skipping record {}: not valid UTF-8", file);
            return null;
        }
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
