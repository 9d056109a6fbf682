package com.markovorder.server.ai.hmm;

import com.markovorder.server.ai.data.ObservationBatch;

public interface SequenceModel {
    /**
     * Total log-likelihood of every sequence in the batch.
     *
     * @throws ScoringException if the model cannot evaluate the batch
     */
    double score(ObservationBatch batch) throws ScoringException;

    int getStateCount();

    int getFeatureCount();
}
