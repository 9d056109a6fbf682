package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.hmm.ModelTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SelectorFactory {

    private static final Logger logger = LoggerFactory.getLogger(SelectorFactory.class);

    public static ModelSelector create(SelectorType type, SequenceDataset dataset, String classLabel,
            ModelTrainer trainer, SelectionConfig config, SelectionListener listener) {
        switch (type) {
            case BIC:
                return new SelectorBIC(dataset, classLabel, trainer, config, listener);
            case DIC:
                return new SelectorDIC(dataset, classLabel, trainer, config, listener);
            case CV:
                return new SelectorCV(dataset, classLabel, trainer, config, listener);
            case CONSTANT:
            default:
                return new SelectorConstant(dataset, classLabel, trainer, config, listener);
        }
    }

    /**
     * Resolves {@code name} case-insensitively. Missing or unknown names fall
     * back to the constant selector.
     */
    public static SelectorType resolve(String name) {
        if (name == null || name.trim().isEmpty()) {
            logger.warn("Selector not specified, defaulting to '{}'", SelectorType.CONSTANT.id());
            return SelectorType.CONSTANT;
        }
        return SelectorType.fromId(name).orElseGet(() -> {
            logger.warn("Unknown selector '{}', defaulting to '{}'", name, SelectorType.CONSTANT.id());
            return SelectorType.CONSTANT;
        });
    }

    public static ModelSelector create(String name, SequenceDataset dataset, String classLabel,
            ModelTrainer trainer, SelectionConfig config, SelectionListener listener) {
        return create(resolve(name), dataset, classLabel, trainer, config, listener);
    }
}
