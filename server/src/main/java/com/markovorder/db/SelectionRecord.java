package com.markovorder.db;

import com.markovorder.server.ai.selection.SelectionResult;

public class SelectionRecord {
    private final String classLabel;
    private final String selectorName;
    private final Integer selectedStates;
    private final Integer modelStates;
    private final boolean fallback;
    private final int firstCandidate;
    private final double[] criterionScores;
    private final long createdTs;

    public SelectionRecord(String classLabel, String selectorName, Integer selectedStates, Integer modelStates,
            boolean fallback, int firstCandidate, double[] criterionScores, long createdTs) {
        this.classLabel = classLabel;
        this.selectorName = selectorName;
        this.selectedStates = selectedStates;
        this.modelStates = modelStates;
        this.fallback = fallback;
        this.firstCandidate = firstCandidate;
        this.criterionScores = criterionScores;
        this.createdTs = createdTs;
    }

    public static SelectionRecord of(SelectionResult result) {
        Integer selected = result.getSelectedStateCount().isPresent()
                ? result.getSelectedStateCount().getAsInt()
                : null;
        Integer modelStates = result.getModel().map(m -> m.getStateCount()).orElse(null);
        return new SelectionRecord(result.getClassLabel(), result.getSelectorName(), selected, modelStates,
                result.isFallback(), result.getFirstCandidate(), result.getCriterionScores(),
                System.currentTimeMillis());
    }

    public String getClassLabel() {
        return classLabel;
    }

    public String getSelectorName() {
        return selectorName;
    }

    public Integer getSelectedStates() {
        return selectedStates;
    }

    public Integer getModelStates() {
        return modelStates;
    }

    public boolean isFallback() {
        return fallback;
    }

    public int getFirstCandidate() {
        return firstCandidate;
    }

    public double[] getCriterionScores() {
        return criterionScores;
    }

    public long getCreatedTs() {
        return createdTs;
    }
}
