package com.markovorder.server.ai.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads a {@link SequenceDataset} from a directory laid out as
 * {@code <root>/<label>/<sequence>.csv}, one frame per line. Files that
 * cannot be read are logged and left out.
 */
public class SequenceDatasetLoader {

    private static final Logger logger = LoggerFactory.getLogger(SequenceDatasetLoader.class);

    public SequenceDataset load(String rootDir) throws IOException {
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        String pattern = "file:" + rootDir + "/*/*.csv";
        Resource[] resources = resolver.getResources(pattern);
        Arrays.sort(resources, Comparator.comparing(SequenceDatasetLoader::pathOf));

        logger.info("Found {} sequence files for pattern: {}", resources.length, pattern);

        Map<String, List<FeatureSequence>> byLabel = new TreeMap<>();
        int skipped = 0;
        for (Resource res : resources) {
            File file;
            try {
                file = res.getFile();
            } catch (IOException e) {
                logger.warn("Could not determine label for {}", res.getDescription());
                continue;
            }
            String label = file.getParentFile().getName();
            try (InputStream is = res.getInputStream()) {
                FeatureSequence sequence = readSequence(is, file.getPath());
                byLabel.computeIfAbsent(label, k -> new ArrayList<>()).add(sequence);
            } catch (IOException e) {
                logger.warn("Failed to load sequence: {}", file.getPath(), e);
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.warn("Skipped {} unreadable sequence files", skipped);
        }

        SequenceDataset.Builder builder = SequenceDataset.builder();
        for (Map.Entry<String, List<FeatureSequence>> e : byLabel.entrySet()) {
            logger.debug("Class {}: {} sequences", e.getKey(), e.getValue().size());
            builder.add(e.getKey(), e.getValue());
        }
        return builder.build();
    }

    /**
     * Reads one sequence, one comma-separated frame per line. Blank lines are
     * skipped.
     */
    public static FeatureSequence readSequence(InputStream is, String sourceName) throws IOException {
        List<double[]> frames = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] cells = trimmed.split(",");
            double[] frame = new double[cells.length];
            for (int i = 0; i < cells.length; i++) {
                try {
                    frame[i] = Double.parseDouble(cells[i].trim());
                } catch (NumberFormatException e) {
                    throw new IOException("Malformed value '" + cells[i] + "' in " + sourceName + " line " + lineNo, e);
                }
            }
            frames.add(frame);
        }
        if (frames.isEmpty()) {
            throw new IOException("No frames in " + sourceName);
        }
        try {
            return new FeatureSequence(frames.toArray(new double[0][]));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid sequence in " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private static String pathOf(Resource res) {
        try {
            return res.getFile().getPath();
        } catch (IOException e) {
            return String.valueOf(res.getFilename());
        }
    }
}
