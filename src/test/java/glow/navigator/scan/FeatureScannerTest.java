package glow.navigator.scan;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import glow.navigator.Fixtures;
import glow.navigator.config.Settings;

import static org.junit.jupiter.api.Assertions.*;

class FeatureScannerTest {

    private final FeatureScanner scanner = new FeatureScanner(Settings.loadDefault().require("test").matchers());

    @Test
    void findsNamesPerKind() {
        final String content = Fixtures.read("sample.feature");

        assertEquals(List.of("module", "template", "workflow"), List.copyOf(scanner.kinds()));
        assertEquals(Set.of("Finance"), scanner.matches("module", content));
        assertEquals(List.of("InvoiceDetail", "Receipt"), List.copyOf(scanner.matches("template", content)));
        assertEquals(Set.of("Approve"), scanner.matches("workflow", content));
    }

    @Test
    void unknownKindOrNoContentMatchesNothing() {
        assertTrue(scanner.matches("sound", "sound \"beep\"").isEmpty());
        assertTrue(scanner.matches("module", null).isEmpty());
    }
}
