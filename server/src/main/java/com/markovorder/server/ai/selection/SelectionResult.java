package com.markovorder.server.ai.selection;

import com.markovorder.server.ai.hmm.SequenceModel;

import java.util.Optional;
import java.util.OptionalInt;

public class SelectionResult {
    private final String classLabel;
    private final String selectorName;
    // null when no candidate survived
    private final Integer selectedStateCount;
    // null when even the fallback fit failed
    private final SequenceModel model;
    private final boolean fallback;
    private final int firstCandidate;
    // indexed by stateCount - firstCandidate, NaN for skipped candidates
    private final double[] criterionScores;

    private SelectionResult(String classLabel, String selectorName, Integer selectedStateCount, SequenceModel model,
            boolean fallback, int firstCandidate, double[] criterionScores) {
        this.classLabel = classLabel;
        this.selectorName = selectorName;
        this.selectedStateCount = selectedStateCount;
        this.model = model;
        this.fallback = fallback;
        this.firstCandidate = firstCandidate;
        this.criterionScores = criterionScores != null ? criterionScores : new double[0];
    }

    public static SelectionResult selected(String classLabel, String selectorName, int stateCount,
            SequenceModel model, int firstCandidate, double[] criterionScores) {
        return new SelectionResult(classLabel, selectorName, stateCount, model, false, firstCandidate,
                criterionScores);
    }

    public static SelectionResult fallback(String classLabel, String selectorName, SequenceModel model,
            int firstCandidate, double[] criterionScores) {
        return new SelectionResult(classLabel, selectorName, null, model, true, firstCandidate, criterionScores);
    }

    public static SelectionResult noModel(String classLabel, String selectorName, int firstCandidate,
            double[] criterionScores) {
        return new SelectionResult(classLabel, selectorName, null, null, false, firstCandidate, criterionScores);
    }

    public String getClassLabel() {
        return classLabel;
    }

    public String getSelectorName() {
        return selectorName;
    }

    public OptionalInt getSelectedStateCount() {
        return selectedStateCount != null ? OptionalInt.of(selectedStateCount) : OptionalInt.empty();
    }

    public Optional<SequenceModel> getModel() {
        return Optional.ofNullable(model);
    }

    public boolean hasModel() {
        return model != null;
    }

    public boolean isFallback() {
        return fallback;
    }

    public int getFirstCandidate() {
        return firstCandidate;
    }

    public double[] getCriterionScores() {
        return criterionScores.clone();
    }

    public double getCriterion(int stateCount) {
        int idx = stateCount - firstCandidate;
        if (idx < 0 || idx >= criterionScores.length) {
            return Double.NaN;
        }
        return criterionScores[idx];
    }

    @Override
    public String toString() {
        return "SelectionResult{" +
                "class='" + classLabel + '\'' +
                ", selector=" + selectorName +
                ", selected=" + (selectedStateCount != null ? selectedStateCount : "none") +
                ", modelStates=" + (model != null ? model.getStateCount() : "none") +
                ", fallback=" + fallback +
                '}';
    }
}
