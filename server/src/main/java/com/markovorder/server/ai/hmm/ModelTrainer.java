package com.markovorder.server.ai.hmm;

import com.markovorder.server.ai.data.ObservationBatch;

public interface ModelTrainer {
    SequenceModel fit(ObservationBatch batch, int stateCount, long seed) throws TrainingException;
}
