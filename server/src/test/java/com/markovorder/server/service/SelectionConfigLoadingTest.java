package com.markovorder.server.service;

import com.markovorder.server.ai.selection.SelectionConfig;
import com.markovorder.server.util.SelectionConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionConfigLoadingTest {

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testBundledConfigLoads() throws Exception {
        InputStream is = getClass().getResourceAsStream(SelectionConfigLoader.DEFAULT_RESOURCE);
        assertNotNull(is, "selection_config.json not found in classpath");

        SelectionConfig config = SelectionConfigLoader.load(is);

        assertEquals("bic", config.selector);
        assertEquals(2, config.minStates());
        assertEquals(10, config.maxStates());
        assertEquals(3, config.defaultStates());
        assertEquals(14L, config.seed());
        assertEquals(3, config.folds());
        assertEquals(9, config.candidateCount());
        assertFalse(config.parallel());
    }

    @Test
    public void testMissingValuesResolveToDefaults() throws Exception {
        SelectionConfig config = SelectionConfigLoader.load(json("{\"selection\": {\"maxStates\": 4, \"extra\": 1}}"));

        assertEquals(2, config.minStates());
        assertEquals(4, config.maxStates());
        assertEquals(3, config.defaultStates());
        assertEquals(14L, config.seed());
        assertNull(config.selector);

        SelectionConfig noSection = SelectionConfigLoader.load(json("{\"markov_data_directory\": \"/data\"}"));
        assertEquals(10, noSection.maxStates());
    }

    @Test
    public void testInvalidRangeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SelectionConfigLoader.load(json("{\"selection\": {\"minStates\": 5, \"maxStates\": 3}}")));
        assertThrows(IllegalArgumentException.class,
                () -> SelectionConfigLoader.load(json("{\"selection\": {\"folds\": 1}}")));
    }

    @Test
    public void testOverrideFileFallsBackToDefaultsWhenInvalid(@TempDir Path dir) throws Exception {
        Path valid = dir.resolve("valid.json");
        Files.writeString(valid, "{\"selection\": {\"selector\": \"cv\", \"folds\": 5}}");
        Path invalid = dir.resolve("invalid.json");
        Files.writeString(invalid, "{\"selection\": {\"minStates\": 0}}");
        try {
            System.setProperty(SelectionConfigLoader.CONFIG_PROPERTY, valid.toString());
            SelectionConfig config = SelectionConfigLoader.loadOrDefault();
            assertEquals("cv", config.selector);
            assertEquals(5, config.folds());

            System.setProperty(SelectionConfigLoader.CONFIG_PROPERTY, invalid.toString());
            assertEquals(2, SelectionConfigLoader.loadOrDefault().minStates());

            System.setProperty(SelectionConfigLoader.CONFIG_PROPERTY, dir.resolve("missing.json").toString());
            assertEquals(10, SelectionConfigLoader.loadOrDefault().maxStates());
        } finally {
            System.clearProperty(SelectionConfigLoader.CONFIG_PROPERTY);
        }
    }
}
