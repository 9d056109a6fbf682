package com.markovorder.server.ai.hmm;

public class ScoringException extends Exception {
    private final int stateCount;

    public ScoringException(int stateCount, String message) {
        super(message);
        this.stateCount = stateCount;
    }

    public ScoringException(int stateCount, String message, Throwable cause) {
        super(message, cause);
        this.stateCount = stateCount;
    }

    public int getStateCount() {
        return stateCount;
    }
}
