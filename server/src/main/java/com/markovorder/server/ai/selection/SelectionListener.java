package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.TrainingException;

public interface SelectionListener {

    SelectionListener NONE = new SelectionListener() {
    };

    default void onTrainingFailure(String classLabel, int stateCount, TrainingException e) {
    }

    default void onScoringFailure(String classLabel, int stateCount, ScoringException e) {
    }
}
