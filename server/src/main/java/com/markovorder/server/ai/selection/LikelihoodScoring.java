package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.ClassData;
import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.SequenceModel;

public final class LikelihoodScoring {

    private LikelihoodScoring() {
    }

    public static double scoreUnder(SequenceModel model, ClassData data) throws ScoringException {
        double logL = model.score(data.getBatch());
        if (Double.isNaN(logL)) {
            throw new ScoringException(model.getStateCount(), "Score for " + data.getLabel() + " is NaN");
        }
        return logL;
    }
}
