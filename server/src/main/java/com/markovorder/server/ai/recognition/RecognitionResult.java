package com.markovorder.server.ai.recognition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class RecognitionResult {
    private final List<PredictionRecord> records;

    public RecognitionResult(List<PredictionRecord> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<PredictionRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public List<Map<String, Double>> getProbabilities() {
        List<Map<String, Double>> probabilities = new ArrayList<>(records.size());
        for (PredictionRecord r : records) {
            probabilities.add(r.getLogLikelihoods());
        }
        return probabilities;
    }

    /**
     * One guess per item; null where no class could score the item.
     */
    public List<String> getGuesses() {
        List<String> guesses = new ArrayList<>(records.size());
        for (PredictionRecord r : records) {
            guesses.add(r.getBestGuess().orElse(null));
        }
        return guesses;
    }

    public double accuracy(List<String> expected) {
        if (expected.size() != records.size()) {
            throw new IllegalArgumentException(
                    "Expected " + records.size() + " labels, got " + expected.size());
        }
        if (records.isEmpty()) {
            return 0.0;
        }
        int correct = 0;
        for (int i = 0; i < records.size(); i++) {
            String guess = records.get(i).getBestGuess().orElse(null);
            if (guess != null && Objects.equals(guess, expected.get(i))) {
                correct++;
            }
        }
        return (double) correct / records.size();
    }

    public double errorRate(List<String> expected) {
        return 1.0 - accuracy(expected);
    }
}
