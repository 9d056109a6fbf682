package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.hmm.SequenceModel;
import com.markovorder.server.ai.hmm.TrainingException;

public final class CandidateFit {
    private final int stateCount;
    private final SequenceModel model;
    private final TrainingException failure;

    private CandidateFit(int stateCount, SequenceModel model, TrainingException failure) {
        this.stateCount = stateCount;
        this.model = model;
        this.failure = failure;
    }

    public static CandidateFit success(int stateCount, SequenceModel model) {
        return new CandidateFit(stateCount, model, null);
    }

    public static CandidateFit failure(int stateCount, TrainingException failure) {
        return new CandidateFit(stateCount, null, failure);
    }

    public boolean isSuccess() {
        return model != null;
    }

    public int getStateCount() {
        return stateCount;
    }

    public SequenceModel getModel() {
        if (model == null) {
            throw new IllegalStateException("No model for " + stateCount + " states", failure);
        }
        return model;
    }

    public TrainingException getFailure() {
        return failure;
    }
}
