package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;

public class SelectorConstant extends ModelSelector {

    public SelectorConstant(SequenceDataset dataset, String classLabel, ModelTrainer trainer,
            SelectionConfig config, SelectionListener listener) {
        super(dataset, classLabel, trainer, config, listener);
    }

    @Override
    public String getName() {
        return SelectorType.CONSTANT.id();
    }

    @Override
    public SelectionResult select() {
        int n = config.defaultStates();
        CandidateFit fit = fitCandidate(n);
        if (!fit.isSuccess()) {
            return SelectionResult.noModel(getClassLabel(), getName(), n, new double[0]);
        }
        return SelectionResult.selected(getClassLabel(), getName(), n, fit.getModel(), n, new double[0]);
    }
}
