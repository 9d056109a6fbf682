package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import com.markovorder.server.ai.hmm.SequenceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sweeps every state count in the configured range, scores each with a
 * criterion and keeps the best one. Skipped candidates take no part in the
 * comparison; on equal criteria the smaller state count wins.
 */
public abstract class CriterionSelector extends ModelSelector {

    private static final Logger logger = LoggerFactory.getLogger(CriterionSelector.class);

    protected CriterionSelector(SequenceDataset dataset, String classLabel, ModelTrainer trainer,
            SelectionConfig config, SelectionListener listener) {
        super(dataset, classLabel, trainer, config, listener);
    }

    protected abstract CandidateEvaluation evaluate(int stateCount);

    /**
     * Strict comparison: true only if {@code candidate} beats {@code best}.
     */
    protected abstract boolean isBetter(double candidate, double best);

    @Override
    public SelectionResult select() {
        double[] criteria = emptyCriteria();
        List<CandidateEvaluation> evaluations = new ArrayList<>(criteria.length);

        for (int n = config.minStates(); n <= config.maxStates(); n++) {
            CandidateEvaluation e = evaluate(n);
            if (e.isEvaluated() && !Double.isFinite(e.getCriterion())) {
                e = CandidateEvaluation.skipped(n, "criterion is " + e.getCriterion());
            }
            if (e.isEvaluated()) {
                criteria[n - config.minStates()] = e.getCriterion();
            }
            logger.debug("{} {}: {}", getName(), getClassLabel(), e);
            evaluations.add(e);
        }

        CandidateEvaluation best = null;
        for (CandidateEvaluation e : evaluations) {
            if (!e.isEvaluated()) {
                continue;
            }
            if (best == null || isBetter(e.getCriterion(), best.getCriterion())) {
                best = e;
            }
        }

        if (best == null) {
            return fallback(criteria);
        }

        SequenceModel model = best.getModel();
        if (model == null) {
            CandidateFit refit = fitCandidate(best.getStateCount());
            if (!refit.isSuccess()) {
                return fallback(criteria);
            }
            model = refit.getModel();
        }
        logger.debug("{} selected {} states for {}", getName(), best.getStateCount(), getClassLabel());
        return SelectionResult.selected(getClassLabel(), getName(), best.getStateCount(), model, config.minStates(),
                criteria);
    }
}
