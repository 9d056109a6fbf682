package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.TrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSelectionListener implements SelectionListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSelectionListener.class);

    @Override
    public void onTrainingFailure(String classLabel, int stateCount, TrainingException e) {
        logger.debug("Fit failed for {} with {} states: {}", classLabel, stateCount, e.getMessage());
    }

    @Override
    public void onScoringFailure(String classLabel, int stateCount, ScoringException e) {
        logger.debug("Scoring failed for {} with {} states: {}", classLabel, stateCount, e.getMessage());
    }
}
