package com.markovorder.server.service;

import com.markovorder.db.SelectionRecord;
import com.markovorder.db.SelectionResultDao;
import com.markovorder.db.SqliteInitializer;
import com.markovorder.server.ai.TestSequences;
import com.markovorder.server.ai.data.ObservationBatch;
import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.SequenceModel;
import com.markovorder.server.ai.hmm.TrainingException;
import com.markovorder.server.ai.recognition.RecognitionResult;
import com.markovorder.server.ai.selection.SelectionConfig;
import com.markovorder.server.ai.selection.SelectionResult;
import com.markovorder.server.ai.selection.SelectorType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ModelSelectionServiceTest {

    /**
     * Models score by distance between the item's first value and the value
     * the model was fitted on; classes marked with a negative value cannot be
     * fitted at all.
     */
    private static final ModelTrainer MARKER_TRAINER = (batch, n, seed) -> {
        double center = batch.getMatrix()[0][0];
        if (center < 0) {
            throw new TrainingException(n, "negative marker");
        }
        return new SequenceModel() {
            @Override
            public double score(ObservationBatch b) throws ScoringException {
                double diff = b.getMatrix()[0][0] - center;
                return -diff * diff * b.getFrameCount() - n;
            }

            @Override
            public int getStateCount() {
                return n;
            }

            @Override
            public int getFeatureCount() {
                return batch.getFeatureCount();
            }
        };
    };

    private static SequenceDataset dataset() {
        return SequenceDataset.builder()
                .add("one", TestSequences.constants(1.0, 4, 5, 2))
                .add("broken", TestSequences.constants(-1.0, 4, 5, 2))
                .add("two", TestSequences.constants(2.0, 4, 5, 2))
                .add("three", TestSequences.constants(3.0, 4, 5, 2))
                .build();
    }

    private static SelectionConfig config(boolean parallel) {
        SelectionConfig config = new SelectionConfig(2, 4, 3, 14L);
        config.parallel = parallel;
        return config;
    }

    @Test
    public void testParallelMatchesSequential() {
        for (SelectorType type : SelectorType.values()) {
            Map<String, SelectionResult> sequential = new ModelSelectionService(config(false), MARKER_TRAINER, null)
                    .selectAll(dataset(), type);
            Map<String, SelectionResult> parallel = new ModelSelectionService(config(true), MARKER_TRAINER, null)
                    .selectAll(dataset(), type);

            assertEquals(List.copyOf(sequential.keySet()), List.copyOf(parallel.keySet()), type.id());
            for (String label : sequential.keySet()) {
                SelectionResult s = sequential.get(label);
                SelectionResult p = parallel.get(label);
                assertEquals(s.getSelectedStateCount(), p.getSelectedStateCount(), type.id() + "/" + label);
                assertEquals(s.hasModel(), p.hasModel(), type.id() + "/" + label);
                assertArrayEquals(s.getCriterionScores(), p.getCriterionScores(), 1e-12, type.id() + "/" + label);
            }
        }
    }

    @Test
    public void testClassWithoutModelStillRecognized() {
        ModelSelectionService service = new ModelSelectionService(config(false), MARKER_TRAINER, null);
        Map<String, SelectionResult> results = service.selectAll(dataset(), SelectorType.BIC);

        assertFalse(results.get("broken").hasModel());
        Map<String, SequenceModel> models = ModelSelectionService.modelMap(results);
        assertEquals(List.of("one", "broken", "two", "three"), List.copyOf(models.keySet()));
        assertNull(models.get("broken"));

        service.install(results);
        assertTrue(service.isReady());
        RecognitionResult recognition = service.recognize(List.of(
                ObservationBatch.of(TestSequences.constant(2.9, 3, 2)),
                ObservationBatch.of(TestSequences.constant(1.2, 3, 2))));

        assertEquals(List.of("three", "one"), recognition.getGuesses());
        assertEquals(Double.NEGATIVE_INFINITY, recognition.getProbabilities().get(0).get("broken"));
    }

    @Test
    public void testConfiguredSelectorUsed() {
        SelectionConfig config = config(false);
        config.selector = "DIC";
        Map<String, SelectionResult> results = new ModelSelectionService(config, MARKER_TRAINER, null)
                .selectAll(dataset());
        for (SelectionResult r : results.values()) {
            assertEquals("dic", r.getSelectorName());
        }

        config.selector = "unknown";
        Map<String, SelectionResult> fallback = new ModelSelectionService(config, MARKER_TRAINER, null)
                .selectAll(dataset());
        assertEquals("constant", fallback.get("one").getSelectorName());
        assertEquals(3, fallback.get("one").getSelectedStateCount().getAsInt());
    }

    @Test
    public void testRecognizeBeforeInstallHasNoGuesses() {
        ModelSelectionService service = new ModelSelectionService(config(false), MARKER_TRAINER, null);

        assertFalse(service.isReady());
        RecognitionResult recognition = service.recognize(List.of(ObservationBatch.of(TestSequences.constant(1.0, 3, 2))));
        assertEquals(Arrays.asList((String) null), recognition.getGuesses());
    }

    @Test
    public void testPersistsEveryClass(@TempDir Path dir) throws Exception {
        String dbPath = dir.resolve("selection.db").toString();
        SqliteInitializer.initialize(dbPath);
        SelectionResultDao dao = new SelectionResultDao(dbPath);
        ModelSelectionService service = new ModelSelectionService(config(false), MARKER_TRAINER, dao);

        Map<String, SelectionResult> results = service.selectAll(dataset(), SelectorType.CONSTANT);
        service.persist(results.values());

        assertEquals(4, dao.loadBySelector("constant").size());
        Optional<SelectionRecord> one = dao.load("one", "constant");
        assertTrue(one.isPresent());
        assertEquals(3, one.get().getSelectedStates());
        Optional<SelectionRecord> broken = dao.load("broken", "constant");
        assertTrue(broken.isPresent());
        assertNull(broken.get().getModelStates());

        service.clearSelections("constant");
        assertTrue(dao.loadBySelector("constant").isEmpty());
    }

    @Test
    public void testPersistWithoutStoreRejected() {
        ModelSelectionService service = new ModelSelectionService(config(false), MARKER_TRAINER, null);

        assertThrows(IllegalStateException.class, () -> service.clearSelections("bic"));
    }
}
