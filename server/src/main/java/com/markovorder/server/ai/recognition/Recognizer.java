package com.markovorder.server.ai.recognition;

import com.markovorder.server.ai.data.ObservationBatch;
import com.markovorder.server.ai.hmm.ScoringException;
import com.markovorder.server.ai.hmm.SequenceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Recognizer {

    private static final Logger logger = LoggerFactory.getLogger(Recognizer.class);

    /**
     * @param models class label to model in the order classes are compared; a
     *               null value stands for a class without a model
     * @param items  test items, each already concatenated into a batch
     */
    public RecognitionResult recognize(Map<String, SequenceModel> models, List<ObservationBatch> items) {
        logger.info("Recognizing {} items against {} class models", items.size(), models.size());
        List<PredictionRecord> records = new ArrayList<>(items.size());
        int unguessed = 0;
        for (int i = 0; i < items.size(); i++) {
            PredictionRecord record = recognize(i, models, items.get(i));
            if (record.getBestGuess().isEmpty()) {
                unguessed++;
            }
            records.add(record);
        }
        if (unguessed > 0) {
            logger.warn("{} of {} items could not be scored by any class", unguessed, items.size());
        }
        return new RecognitionResult(records);
    }

    public PredictionRecord recognize(int index, Map<String, SequenceModel> models, ObservationBatch item) {
        Map<String, Double> logL = new LinkedHashMap<>();
        double bestScore = Double.NEGATIVE_INFINITY;
        String bestGuess = null;

        for (Map.Entry<String, SequenceModel> e : models.entrySet()) {
            String label = e.getKey();
            SequenceModel model = e.getValue();
            if (model == null) {
                logL.put(label, Double.NEGATIVE_INFINITY);
                continue;
            }
            try {
                double score = model.score(item);
                if (Double.isNaN(score)) {
                    score = Double.NEGATIVE_INFINITY;
                }
                logL.put(label, score);
                // strict: an equal later score keeps the earlier class
                if (score > bestScore) {
                    bestScore = score;
                    bestGuess = label;
                }
            } catch (ScoringException ex) {
                logger.debug("Item {} could not be scored by {}: {}", index, label, ex.getMessage());
                logL.put(label, Double.NEGATIVE_INFINITY);
            }
        }

        logger.debug("Item {} guessed as {} (logL={})", index, bestGuess, bestScore);
        return new PredictionRecord(index, logL, bestGuess);
    }
}
