package com.decisiontree.config;

import com.decisiontree.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EngineSettingsLoader.
 */
class EngineSettingsLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load settings from the classpath")
    void shouldLoadFromClasspath() {
        EngineSettings settings = EngineSettingsLoader.load("classpath:decision-tree-test.yaml");

        assertEquals(8, settings.maxDepth());
        assertFalse(settings.traceEnabled());
    }

    @Test
    @DisplayName("Should load settings from the filesystem")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.yaml");
        Files.writeString(file, "decision-tree:\n  max-depth: 12\n");

        EngineSettings settings = EngineSettingsLoader.load(file.toString());

        assertEquals(12, settings.maxDepth());
        assertTrue(settings.traceEnabled());
    }

    @Test
    @DisplayName("Should accept keys at the document root and camelCase keys")
    void shouldAcceptRootAndCamelCaseKeys() {
        EngineSettings settings = EngineSettingsLoader.parse(yaml("maxDepth: 20\ntraceEnabled: \"false\"\n"));

        assertEquals(20, settings.maxDepth());
        assertFalse(settings.traceEnabled());
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document or section")
    void shouldUseDefaultsWhenEmpty() {
        assertEquals(EngineSettings.defaults(), EngineSettingsLoader.parse(yaml("")));
        assertEquals(EngineSettings.defaults(), EngineSettingsLoader.parse(yaml("decision-tree:\n")));
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree:\n  max-depth: deep\n")));
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree:\n  max-depth: 0\n")));
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree:\n  trace-enabled: sometimes\n")));
    }

    @Test
    @DisplayName("Should reject max-depth values outside the int range")
    void shouldRejectOutOfRangeMaxDepth() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree:\n  max-depth: 4294967297\n")));
        assertTrue(e.getMessage().contains("max-depth"));
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree:\n  max-depth: 100000000000000000000\n")));
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree:\n  max-depth: 12.5\n")));
    }

    @Test
    @DisplayName("Should reject malformed documents")
    void shouldRejectMalformedDocuments() {
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("- just\n- a list\n")));
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree: 5\n")));
        assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.parse(yaml("decision-tree: [unclosed\n")));
    }

    @Test
    @DisplayName("Should fail fast on a missing file")
    void shouldFailOnMissingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> EngineSettingsLoader.load("classpath:does-not-exist.yaml"));
        assertTrue(e.getMessage().contains("does-not-exist.yaml"));
    }
}
