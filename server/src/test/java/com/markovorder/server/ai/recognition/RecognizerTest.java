package com.markovorder.server.ai.recognition;

import com.markovorder.server.ai.TestSequences;
import com.markovorder.server.ai.data.ObservationBatch;
import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.SequenceModel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RecognizerTest {

    /** Scores every item with a fixed value. */
    private static SequenceModel fixed(double logL) {
        return new SequenceModel() {
            @Override
            public double score(ObservationBatch batch) {
                return logL;
            }

            @Override
            public int getStateCount() {
                return 1;
            }

            @Override
            public int getFeatureCount() {
                return 1;
            }
        };
    }

    /** Scores an item by how close its first value is to {@code center}. */
    private static SequenceModel centeredAt(double center) {
        return new SequenceModel() {
            @Override
            public double score(ObservationBatch batch) {
                double diff = batch.getMatrix()[0][0] - center;
                return -diff * diff;
            }

            @Override
            public int getStateCount() {
                return 1;
            }

            @Override
            public int getFeatureCount() {
                return 1;
            }
        };
    }

    private static SequenceModel failing() {
        return new SequenceModel() {
            @Override
            public double score(ObservationBatch batch) throws ScoringException {
                throw new ScoringException(1, "cannot score");
            }

            @Override
            public int getStateCount() {
                return 1;
            }

            @Override
            public int getFeatureCount() {
                return 1;
            }
        };
    }

    private static ObservationBatch item(double value) {
        return ObservationBatch.of(TestSequences.constant(value, 3, 1));
    }

    @Test
    public void testTieGoesToFirstClassInMapOrder() {
        Map<String, SequenceModel> ab = new LinkedHashMap<>();
        ab.put("A", fixed(-10.0));
        ab.put("B", fixed(-10.0));
        Map<String, SequenceModel> ba = new LinkedHashMap<>();
        ba.put("B", fixed(-10.0));
        ba.put("A", fixed(-10.0));

        Recognizer recognizer = new Recognizer();
        assertEquals("A", recognizer.recognize(0, ab, item(0)).getBestGuess().orElseThrow());
        assertEquals("B", recognizer.recognize(0, ba, item(0)).getBestGuess().orElseThrow());
    }

    @Test
    public void testHighestLogLikelihoodWins() {
        Map<String, SequenceModel> models = new LinkedHashMap<>();
        models.put("A", fixed(-12.0));
        models.put("B", fixed(-3.5));
        models.put("C", fixed(-7.0));

        PredictionRecord record = new Recognizer().recognize(4, models, item(0));

        assertEquals(4, record.getIndex());
        assertEquals("B", record.getBestGuess().orElseThrow());
        assertEquals(List.of("A", "B", "C"), List.copyOf(record.getLogLikelihoods().keySet()));
        assertEquals(-3.5, record.getLogLikelihoods().get("B"), 1e-12);
    }

    @Test
    public void testFailedAndMissingModelsScoreNegativeInfinity() {
        Map<String, SequenceModel> models = new LinkedHashMap<>();
        models.put("A", failing());
        models.put("B", null);
        models.put("C", fixed(-1e6));

        PredictionRecord record = new Recognizer().recognize(0, models, item(0));

        assertEquals(Double.NEGATIVE_INFINITY, record.getLogLikelihoods().get("A"));
        assertEquals(Double.NEGATIVE_INFINITY, record.getLogLikelihoods().get("B"));
        assertEquals("C", record.getBestGuess().orElseThrow());
    }

    @Test
    public void testNoGuessWhenNothingScores() {
        Map<String, SequenceModel> models = new LinkedHashMap<>();
        models.put("A", failing());
        models.put("B", null);

        RecognitionResult result = new Recognizer().recognize(models, List.of(item(0), item(1)));

        assertEquals(Arrays.asList(null, null), result.getGuesses());
        assertEquals(0.0, result.accuracy(List.of("A", "B")), 1e-12);
    }

    @Test
    public void testResultsAlignWithItems() {
        Map<String, SequenceModel> models = new LinkedHashMap<>();
        models.put("low", centeredAt(0.0));
        models.put("mid", centeredAt(5.0));
        models.put("high", centeredAt(10.0));

        RecognitionResult result = new Recognizer().recognize(models,
                List.of(item(9.0), item(0.5), item(4.0), item(11.0)));

        assertEquals(4, result.size());
        assertEquals(List.of("high", "low", "mid", "high"), result.getGuesses());
        for (int i = 0; i < result.size(); i++) {
            assertEquals(i, result.getRecords().get(i).getIndex());
            assertEquals(3, result.getProbabilities().get(i).size());
        }
        assertEquals(-1.0, result.getProbabilities().get(0).get("high"), 1e-12);

        List<String> expected = List.of("high", "low", "low", "high");
        assertEquals(0.75, result.accuracy(expected), 1e-12);
        assertEquals(0.25, result.errorRate(expected), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> result.accuracy(List.of("high")));
    }
}
