package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.ClassData;
import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import com.markovorder.server.ai.hmm.SequenceModel;

import java.util.OptionalDouble;

/**
 * Selects the state count with the highest Discriminative Information
 * Criterion: the class's own log-likelihood minus the mean log-likelihood of
 * the other classes' data under the same model.
 * <p>
 * An other class takes part in the mean for a candidate only if it can itself
 * be fitted at that state count and its data can be scored; classes that fail
 * either step shrink the divisor. A candidate with no comparable other class
 * is skipped.
 */
public class SelectorDIC extends CriterionSelector {

    public SelectorDIC(SequenceDataset dataset, String classLabel, ModelTrainer trainer,
            SelectionConfig config, SelectionListener listener) {
        super(dataset, classLabel, trainer, config, listener);
    }

    @Override
    public String getName() {
        return SelectorType.DIC.id();
    }

    @Override
    protected CandidateEvaluation evaluate(int stateCount) {
        CandidateFit own = fitCandidate(stateCount);
        if (!own.isSuccess()) {
            return CandidateEvaluation.skipped(stateCount, "fit failed");
        }
        SequenceModel model = own.getModel();
        OptionalDouble ownLogL = score(model, classData, stateCount);
        if (ownLogL.isEmpty()) {
            return CandidateEvaluation.skipped(stateCount, "scoring failed");
        }

        double antiSum = 0.0;
        int compared = 0;
        for (ClassData other : dataset.others(getClassLabel())) {
            CandidateFit otherFit = fit(other.getLabel(), other.getBatch(), stateCount);
            if (!otherFit.isSuccess()) {
                continue;
            }
            OptionalDouble anti = score(model, other, stateCount);
            if (anti.isEmpty()) {
                continue;
            }
            antiSum += anti.getAsDouble();
            compared++;
        }

        if (compared == 0) {
            return CandidateEvaluation.skipped(stateCount, "no other class could be compared");
        }
        double dic = ownLogL.getAsDouble() - antiSum / compared;
        return CandidateEvaluation.evaluated(stateCount, dic, model);
    }

    @Override
    protected boolean isBetter(double candidate, double best) {
        return candidate > best;
    }
}
