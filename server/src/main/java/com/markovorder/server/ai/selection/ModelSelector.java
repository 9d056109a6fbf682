package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.ClassData;
import com.markovorder.server.ai.data.ObservationBatch;
import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.SequenceModel;
import com.markovorder.server.ai.hmm.TrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Picks the hidden-state count for one class and returns the model trained at
 * it. Implementations absorb every fit and scoring failure: {@link #select()}
 * reports them through the {@link SelectionListener} and the result, never by
 * throwing.
 */
public abstract class ModelSelector {

    private static final Logger logger = LoggerFactory.getLogger(ModelSelector.class);

    protected final SequenceDataset dataset;
    protected final ClassData classData;
    protected final ModelTrainer trainer;
    protected final SelectionConfig config;
    protected final SelectionListener listener;

    protected ModelSelector(SequenceDataset dataset, String classLabel, ModelTrainer trainer,
            SelectionConfig config, SelectionListener listener) {
        config.validate();
        this.dataset = dataset;
        this.classData = dataset.get(classLabel);
        this.trainer = trainer;
        this.config = config;
        this.listener = listener != null ? listener : SelectionListener.NONE;
    }

    public abstract SelectionResult select();

    public abstract String getName();

    public String getClassLabel() {
        return classData.getLabel();
    }

    protected CandidateFit fitCandidate(int stateCount) {
        return fit(classData.getLabel(), classData.getBatch(), stateCount);
    }

    protected CandidateFit fit(String label, ObservationBatch batch, int stateCount) {
        try {
            SequenceModel model = trainer.fit(batch, stateCount, config.seed());
            return CandidateFit.success(stateCount, model);
        } catch (TrainingException e) {
            listener.onTrainingFailure(label, stateCount, e);
            return CandidateFit.failure(stateCount, e);
        }
    }

    protected OptionalDouble score(SequenceModel model, ClassData data, int stateCount) {
        try {
            return OptionalDouble.of(LikelihoodScoring.scoreUnder(model, data));
        } catch (ScoringException e) {
            listener.onScoringFailure(data.getLabel(), stateCount, e);
            return OptionalDouble.empty();
        }
    }

    protected OptionalDouble score(SequenceModel model, ObservationBatch batch, int stateCount) {
        try {
            double logL = model.score(batch);
            if (Double.isNaN(logL)) {
                throw new ScoringException(stateCount, "Score is NaN");
            }
            return OptionalDouble.of(logL);
        } catch (ScoringException e) {
            listener.onScoringFailure(classData.getLabel(), stateCount, e);
            return OptionalDouble.empty();
        }
    }

    /**
     * Trains at the default state count. The result carries no model if that
     * fit fails too.
     */
    protected SelectionResult fallback(double[] criterionScores) {
        int n = config.defaultStates();
        logger.warn("No usable candidate for {} with {}, falling back to {} states", classData.getLabel(),
                getName(), n);
        CandidateFit fit = fitCandidate(n);
        if (fit.isSuccess()) {
            return SelectionResult.fallback(classData.getLabel(), getName(), fit.getModel(), config.minStates(),
                    criterionScores);
        }
        logger.warn("Fallback fit at {} states failed for {}, class has no model: {}", n, classData.getLabel(),
                fit.getFailure().getMessage());
        return SelectionResult.noModel(classData.getLabel(), getName(), config.minStates(), criterionScores);
    }

    protected double[] emptyCriteria() {
        double[] criteria = new double[config.candidateCount()];
        Arrays.fill(criteria, Double.NaN);
        return criteria;
    }
}
