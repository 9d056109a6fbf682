package com.markovorder.server.ai.recognition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class PredictionRecord {
    private final int index;
    private final Map<String, Double> logLikelihoods;
    private final String bestGuess;

    public PredictionRecord(int index, Map<String, Double> logLikelihoods, String bestGuess) {
        this.index = index;
        this.logLikelihoods = Collections.unmodifiableMap(new LinkedHashMap<>(logLikelihoods));
        this.bestGuess = bestGuess;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Class label to log-likelihood, in model-map order. Negative infinity
     * marks a class that could not score the item.
     */
    public Map<String, Double> getLogLikelihoods() {
        return logLikelihoods;
    }

    public Optional<String> getBestGuess() {
        return Optional.ofNullable(bestGuess);
    }

    @Override
    public String toString() {
        return "PredictionRecord{index=" + index + ", guess=" + bestGuess + ", scores=" + logLikelihoods + '}';
    }
}
