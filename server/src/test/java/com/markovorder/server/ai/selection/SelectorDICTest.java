package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.TestSequences;
import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ScoringException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SelectorDICTest {

    private static final Map<Integer, Double> SELF = Map.of(2, -50.0, 3, -40.0, 4, -30.0);
    private static final Map<Integer, Double> CROSS_B = Map.of(2, -500.0, 3, -45.0, 4, -35.0);

    /**
     * Class A is marked 1.0, B 2.0, C 3.0. A model scores its own class from
     * SELF, B's data from CROSS_B and C's data at -1000.
     */
    private static double score(int n, double trainedOn, double scored) throws ScoringException {
        if (trainedOn == scored) {
            return SELF.get(n);
        }
        if (scored == 2.0) {
            return CROSS_B.get(n);
        }
        return -1000.0;
    }

    private static StubTrainer trainer() {
        return new StubTrainer((n, trainedOn, scored) -> score(n, StubTrainer.marker(trainedOn),
                StubTrainer.marker(scored)));
    }

    private static SequenceDataset.Builder twoClasses() {
        return SequenceDataset.builder()
                .add("A", TestSequences.constants(1.0, 3, 5, 2))
                .add("B", TestSequences.constants(2.0, 3, 5, 2));
    }

    private static SelectionConfig config() {
        return new SelectionConfig(2, 4, 3, 14L);
    }

    @Test
    void testPrefersDiscriminationOverSelfLikelihood() {
        SelectorDIC selector = new SelectorDIC(twoClasses().build(), "A", trainer(), config(),
                SelectionListener.NONE);

        SelectionResult result = selector.select();

        // self-likelihood alone would pick 4
        assertEquals(2, result.getSelectedStateCount().getAsInt());
        assertEquals(450.0, result.getCriterion(2), 1e-9);
        assertEquals(5.0, result.getCriterion(3), 1e-9);
        assertEquals(5.0, result.getCriterion(4), 1e-9);
    }

    @Test
    void testUnfittableOtherClassShrinksDivisor() {
        SequenceDataset threeClasses = twoClasses().add("C", TestSequences.constants(3.0, 3, 5, 2)).build();
        StubTrainer trainer = trainer().failingWhen((batch, n) -> StubTrainer.marker(batch) == 3.0);

        SelectionResult withC = new SelectorDIC(threeClasses, "A", trainer, config(), SelectionListener.NONE)
                .select();
        SelectionResult withoutC = new SelectorDIC(twoClasses().build(), "A", trainer(), config(),
                SelectionListener.NONE).select();

        assertArrayEquals(withoutC.getCriterionScores(), withC.getCriterionScores(), 1e-9);
        assertEquals(withoutC.getSelectedStateCount(), withC.getSelectedStateCount());
    }

    @Test
    void testUnscorableOtherClassShrinksDivisor() {
        SequenceDataset threeClasses = twoClasses().add("C", TestSequences.constants(3.0, 3, 5, 2)).build();
        StubTrainer trainer = new StubTrainer((n, trainedOn, scored) -> {
            if (StubTrainer.marker(scored) == 3.0) {
                throw new ScoringException(n, "stub");
            }
            return score(n, StubTrainer.marker(trainedOn), StubTrainer.marker(scored));
        });

        SelectionResult result = new SelectorDIC(threeClasses, "A", trainer, config(), SelectionListener.NONE)
                .select();

        assertEquals(450.0, result.getCriterion(2), 1e-9);
        assertEquals(2, result.getSelectedStateCount().getAsInt());
    }

    @Test
    void testAllOtherClassesCountedInMean() {
        SequenceDataset threeClasses = twoClasses().add("C", TestSequences.constants(3.0, 3, 5, 2)).build();

        SelectionResult result = new SelectorDIC(threeClasses, "A", trainer(), config(), SelectionListener.NONE)
                .select();

        // n=3: -40 - (-45 + -1000) / 2
        assertEquals(-40.0 + 1045.0 / 2, result.getCriterion(3), 1e-9);
    }

    @Test
    void testOwnFitFailureSkipsCandidate() {
        StubTrainer trainer = trainer().failingWhen((batch, n) -> n == 2 && StubTrainer.marker(batch) == 1.0);

        SelectionResult result = new SelectorDIC(twoClasses().build(), "A", trainer, config(),
                SelectionListener.NONE).select();

        assertTrue(Double.isNaN(result.getCriterion(2)));
        // 3 and 4 tie at 5.0, the smaller one wins
        assertEquals(3, result.getSelectedStateCount().getAsInt());
    }

    @Test
    void testSingleClassFallsBackToDefault() {
        SequenceDataset single = SequenceDataset.builder()
                .add("A", TestSequences.constants(1.0, 3, 5, 2))
                .build();

        SelectionResult result = new SelectorDIC(single, "A", trainer(), config(), SelectionListener.NONE)
                .select();

        assertTrue(result.getSelectedStateCount().isEmpty());
        assertTrue(result.isFallback());
        assertEquals(3, result.getModel().orElseThrow().getStateCount());
    }
}
