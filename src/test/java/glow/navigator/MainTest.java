package glow.navigator;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void helpExitsCleanly() {
        assertEquals(0, Main.run(new String[]{"--help"}));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(2, Main.run(new String[]{"--colour=red"}));
    }

    @Test
    void secondPositionalIsAUsageError(@TempDir Path dir) {
        assertEquals(2, Main.run(new String[]{dir.toString(), "other"}));
    }

    @Test
    void badNumbersAndSettingsAreUsageErrors(@TempDir Path dir) {
        assertEquals(2, Main.run(new String[]{dir.toString(), "--maxLevel=deep"}));
        assertEquals(2, Main.run(new String[]{dir.toString(), "--settings=" + dir.resolve("none.yaml")}));
    }

    @Test
    void emptySourceRootBuildsNothing(@TempDir Path dir) {
        assertEquals(0, Main.run(new String[]{dir.toString()}));
    }
}
