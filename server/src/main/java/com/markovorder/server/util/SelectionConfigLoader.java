package com.markovorder.server.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.markovorder.server.ai.selection.SelectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the {@code selection} section of {@code selection_config.json}. The
 * system property {@value #CONFIG_PROPERTY} points at a file that replaces the
 * bundled resource.
 */
public class SelectionConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(SelectionConfigLoader.class);

    public static final String CONFIG_PROPERTY = "markov.selection.config";
    public static final String DEFAULT_RESOURCE = "/selection_config.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static SelectionConfig load(InputStream is) throws IOException {
        JsonNode root = mapper.readTree(is);
        if (root == null || !root.has("selection")) {
            return SelectionConfig.defaults();
        }
        SelectionConfig config = mapper.treeToValue(root.get("selection"), SelectionConfig.class);
        config.validate();
        return config;
    }

    /**
     * Never fails: unreadable or invalid configuration logs a warning and yields
     * the defaults.
     */
    public static SelectionConfig loadOrDefault() {
        String override = System.getProperty(CONFIG_PROPERTY);
        try {
            if (override != null && !override.isEmpty()) {
                try (InputStream is = new FileInputStream(override)) {
                    logger.info("Loading selection config from {}", override);
                    return load(is);
                }
            }
            try (InputStream is = SelectionConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is != null) {
                    return load(is);
                }
            }
            logger.warn("No {} on classpath, using defaults", DEFAULT_RESOURCE);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load selection config, using defaults. Error: {}", e.getMessage());
        }
        return SelectionConfig.defaults();
    }
}
