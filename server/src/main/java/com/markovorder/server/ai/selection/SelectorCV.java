package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.FeatureSequence;
import com.markovorder.server.ai.data.ObservationBatch;
import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Selects the state count with the highest mean held-out log-likelihood over
 * k folds of the class's sequences. Folds are capped at the number of
 * sequences; a class with fewer than two sequences cannot be cross-validated
 * and goes straight to the default state count.
 */
public class SelectorCV extends CriterionSelector {

    private static final Logger logger = LoggerFactory.getLogger(SelectorCV.class);

    public SelectorCV(SequenceDataset dataset, String classLabel, ModelTrainer trainer,
            SelectionConfig config, SelectionListener listener) {
        super(dataset, classLabel, trainer, config, listener);
    }

    @Override
    public String getName() {
        return SelectorType.CV.id();
    }

    int foldCount() {
        return Math.min(config.folds(), classData.getSequenceCount());
    }

    @Override
    public SelectionResult select() {
        if (foldCount() < 2) {
            logger.warn("{} has {} sequence(s), too few to cross-validate", getClassLabel(),
                    classData.getSequenceCount());
            return fallback(emptyCriteria());
        }
        return super.select();
    }

    @Override
    protected CandidateEvaluation evaluate(int stateCount) {
        List<FeatureSequence> sequences = classData.getSequences();
        double sum = 0.0;
        int scored = 0;
        for (KFoldSplitter.Fold fold : KFoldSplitter.split(sequences.size(), foldCount())) {
            ObservationBatch train = ObservationBatch.combine(fold.getTrainIndices(), sequences);
            ObservationBatch heldOut = ObservationBatch.combine(fold.getTestIndices(), sequences);

            CandidateFit fit = fit(getClassLabel(), train, stateCount);
            if (!fit.isSuccess()) {
                continue;
            }
            OptionalDouble logL = score(fit.getModel(), heldOut, stateCount);
            if (logL.isEmpty()) {
                continue;
            }
            sum += logL.getAsDouble();
            scored++;
        }
        if (scored == 0) {
            return CandidateEvaluation.skipped(stateCount, "no fold could be scored");
        }
        // winner is refit on the full class data
        return CandidateEvaluation.evaluated(stateCount, sum / scored, null);
    }

    @Override
    protected boolean isBetter(double candidate, double best) {
        return candidate > best;
    }
}
