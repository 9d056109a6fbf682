package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import com.markovorder.server.ai.hmm.SequenceModel;

import java.util.OptionalDouble;

/**
 * Selects the state count with the lowest Bayesian Information Criterion,
 * {@code BIC = -2 * logL + p * ln(N)}, where N is the number of frames and p
 * the free-parameter count of a diagonal Gaussian HMM.
 */
public class SelectorBIC extends CriterionSelector {

    public SelectorBIC(SequenceDataset dataset, String classLabel, ModelTrainer trainer,
            SelectionConfig config, SelectionListener listener) {
        super(dataset, classLabel, trainer, config, listener);
    }

    @Override
    public String getName() {
        return SelectorType.BIC.id();
    }

    /**
     * Transition degrees of freedom plus a mean and variance per state and
     * feature: {@code n^2 + 2 * d * n - 1}.
     */
    public static long parameterCount(int stateCount, int featureCount) {
        long n = stateCount;
        return n * n + 2L * featureCount * n - 1;
    }

    public static double bic(double logL, int stateCount, int featureCount, int frameCount) {
        return -2.0 * logL + parameterCount(stateCount, featureCount) * Math.log(frameCount);
    }

    @Override
    protected CandidateEvaluation evaluate(int stateCount) {
        CandidateFit fit = fitCandidate(stateCount);
        if (!fit.isSuccess()) {
            return CandidateEvaluation.skipped(stateCount, "fit failed");
        }
        SequenceModel model = fit.getModel();
        OptionalDouble logL = score(model, classData, stateCount);
        if (logL.isEmpty()) {
            return CandidateEvaluation.skipped(stateCount, "scoring failed");
        }
        double value = bic(logL.getAsDouble(), stateCount, model.getFeatureCount(), classData.getFrameCount());
        return CandidateEvaluation.evaluated(stateCount, value, model);
    }

    @Override
    protected boolean isBetter(double candidate, double best) {
        return candidate < best;
    }
}
