package com.markovorder.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "markov.data.dir";

    public static String resolveDataDirectory() {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config file
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream(SelectionConfigLoader.DEFAULT_RESOURCE)) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.has("markov_data_directory")) {
                        String configDir = root.get("markov_data_directory").asText();
                        if (configDir != null && !configDir.isEmpty()) {
                            return configDir;
                        }
                    }
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read markov_data_directory from config: {}", e.getMessage());
        }

        // 3. Default
        return ".";
    }

    public static String resolveTrainingDirectory() {
        return resolveDataDirectory() + File.separator + "training";
    }

    public static String resolveDbPath() {
        return resolveDataDirectory() + File.separator + "markov_selection.db";
    }
}
