package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.hmm.SequenceModel;

public final class CandidateEvaluation {
    private final int stateCount;
    private final double criterion;
    private final SequenceModel model;
    private final String skipReason;

    private CandidateEvaluation(int stateCount, double criterion, SequenceModel model, String skipReason) {
        this.stateCount = stateCount;
        this.criterion = criterion;
        this.model = model;
        this.skipReason = skipReason;
    }

    public static CandidateEvaluation evaluated(int stateCount, double criterion, SequenceModel model) {
        return new CandidateEvaluation(stateCount, criterion, model, null);
    }

    public static CandidateEvaluation skipped(int stateCount, String reason) {
        return new CandidateEvaluation(stateCount, Double.NaN, null, reason);
    }

    public boolean isEvaluated() {
        return skipReason == null;
    }

    public int getStateCount() {
        return stateCount;
    }

    public double getCriterion() {
        return criterion;
    }

    public SequenceModel getModel() {
        return model;
    }

    @Override
    public String toString() {
        return isEvaluated()
                ? "n=" + stateCount + " criterion=" + criterion
                : "n=" + stateCount + " skipped (" + skipReason + ")";
    }
}
