package com.markovorder.server.ai.selection;

/**
 * Selection settings as read from {@code selection_config.json}. Unset fields
 * resolve to the defaults below.
 */
public class SelectionConfig {
    public static final int DEFAULT_MIN_STATES = 2;
    public static final int DEFAULT_MAX_STATES = 10;
    public static final int DEFAULT_STATES = 3;
    public static final long DEFAULT_SEED = 14L;
    public static final int DEFAULT_FOLDS = 3;

    public String selector;
    public Integer minStates;
    public Integer maxStates;
    public Integer defaultStates;
    public Long seed;
    public Integer folds;
    public Integer maxIterations;
    public Double tolerance;
    public Boolean parallel;
    public Boolean persistResults;

    public SelectionConfig() {
    }

    public SelectionConfig(int minStates, int maxStates, int defaultStates, long seed) {
        this.minStates = minStates;
        this.maxStates = maxStates;
        this.defaultStates = defaultStates;
        this.seed = seed;
    }

    public static SelectionConfig defaults() {
        return new SelectionConfig();
    }

    public int minStates() {
        return minStates != null ? minStates : DEFAULT_MIN_STATES;
    }

    public int maxStates() {
        return maxStates != null ? maxStates : DEFAULT_MAX_STATES;
    }

    public int defaultStates() {
        return defaultStates != null ? defaultStates : DEFAULT_STATES;
    }

    public long seed() {
        return seed != null ? seed : DEFAULT_SEED;
    }

    public int folds() {
        return folds != null ? folds : DEFAULT_FOLDS;
    }

    public boolean parallel() {
        return parallel != null && parallel;
    }

    public boolean persistResults() {
        return persistResults != null && persistResults;
    }

    public int candidateCount() {
        return maxStates() - minStates() + 1;
    }

    public void validate() {
        if (minStates() < 1) {
            throw new IllegalArgumentException("minStates must be at least 1, got " + minStates());
        }
        if (maxStates() < minStates()) {
            throw new IllegalArgumentException(
                    "maxStates (" + maxStates() + ") is below minStates (" + minStates() + ")");
        }
        if (defaultStates() < 1) {
            throw new IllegalArgumentException("defaultStates must be at least 1, got " + defaultStates());
        }
        if (folds() < 2) {
            throw new IllegalArgumentException("folds must be at least 2, got " + folds());
        }
    }

    @Override
    public String toString() {
        return "SelectionConfig{selector=" + selector + ", states=[" + minStates() + ".." + maxStates() + "]" +
                ", default=" + defaultStates() + ", seed=" + seed() + ", folds=" + folds() + '}';
    }
}
