package glow.navigator.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import glow.navigator.config.ArtifactType;

import static org.junit.jupiter.api.Assertions.*;

class FileRecordSourceTest {

    @TempDir
    Path root;

    private static ArtifactType yamlType(String glob) {
        return new ArtifactType("module", "blue", List.of(), glob, null, Map.of("name", "V9_Name"), null);
    }

    private void write(String rel, String text) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
    }

    @Test
    @DisplayName("yaml records come back sorted by path")
    void readsYamlSorted() throws IOException {
        write("Modules/b.yaml", "V9_Name: Beta\n");
        write("Modules/a.yaml", "V9_Name: Alpha\nV9_Code: A\n");
        write("Modules/notes.txt", "ignored");

        final List<RawRecord> records = new FileRecordSource(root).enumerate(yamlType("Modules/*.yaml"));
        assertEquals(2, records.size());
        assertEquals("Alpha", records.get(0).values().get("V9_Name"));
        assertEquals("a.yaml", records.get(0).source().getFileName().toString());
    }

    @Test
    @DisplayName("empty and unparsable files are skipped")
    void skipsBadFiles() throws IOException {
        write("Modules/empty.yaml", "");
        write("Modules/bad.yaml", "V9_Name: [unclosed\n");
        write("Modules/good.yaml", "V9_Name: Good\n");

        final FileRecordSource source = new FileRecordSource(root);
        final List<RawRecord> records = source.enumerate(yamlType("Modules/*.yaml"));
        assertEquals(1, records.size());
        assertEquals(1, source.skippedCount());
    }

    @Test
    @DisplayName("a file that is not UTF-8 is skipped, not fatal")
    void skipsNonUtf8Files() throws IOException {
        write("Modules/good.yaml", "V9_Name: Good\n");
        Files.write(root.resolve("Modules/latin1.yaml"),
                new byte[]{'V', '9', '_', 'N', 'a', 'm', 'e', ':', ' ', 'C', 'a', 'f', (byte) 0xE9, '\n'});
        write("Tests/latin1.feature", "placeholder");
        Files.write(root.resolve("Tests/latin1.feature"), new byte[]{'C', 'a', 'f', (byte) 0xE9});
        write("Tests/ok.feature", "Feature: ok");

        final FileRecordSource source = new FileRecordSource(root);
        final List<RawRecord> records = source.enumerate(yamlType("Modules/*.yaml"));
        assertEquals(1, records.size());
        assertEquals("Good", records.get(0).values().get("V9_Name"));

        final ArtifactType test = new ArtifactType("test", "green", List.of(), "Tests/**.feature", "text",
                Map.of(), Map.of());
        final List<RawRecord> tests = source.enumerate(test);
        assertEquals(1, tests.size());
        assertEquals("ok", tests.get(0).values().get("name"));
        assertEquals(2, source.skippedCount());
    }

    @Test
    void textRecordsCarryNameFileAndContent() throws IOException {
        write("Tests/billing/pay.feature", "Given module \"Finance\"");
        write("Tests/top.feature", "Feature: top");
        final ArtifactType test = new ArtifactType("test", "green", List.of(), "Tests/**.feature", "text",
                Map.of(), Map.of());

        final List<RawRecord> records = new FileRecordSource(root).enumerate(test);
        assertEquals(2, records.size());
        assertEquals("pay", records.get(0).values().get("name"));
        assertEquals("Tests/billing/pay.feature", records.get(0).values().get("file"));
        assertEquals("Feature: top", records.get(1).values().get("content"));
    }

    @Test
    void skippedDirectoriesAreNotWalked() throws IOException {
        write("bin/Modules/a.yaml", "V9_Name: Hidden\n");
        assertTrue(new FileRecordSource(root).enumerate(yamlType("**/Modules/*.yaml")).isEmpty());
    }

    @Test
    void missingRootOrPathYieldsNothing() throws IOException {
        assertTrue(new FileRecordSource(root.resolve("absent")).enumerate(yamlType("*.yaml")).isEmpty());
        assertTrue(new FileRecordSource(root).enumerate(yamlType(null)).isEmpty());
    }
}
