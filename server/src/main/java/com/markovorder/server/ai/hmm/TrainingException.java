package com.markovorder.server.ai.hmm;

public class TrainingException extends Exception {
    private final int stateCount;

    public TrainingException(int stateCount, String message) {
        super(message);
        this.stateCount = stateCount;
    }

    public TrainingException(int stateCount, String message, Throwable cause) {
        super(message, cause);
        this.stateCount = stateCount;
    }

    public int getStateCount() {
        return stateCount;
    }
}
