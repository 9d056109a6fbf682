package com.markovorder.server.ai.data;

import java.util.Collections;
import java.util.List;

public class ClassData {
    private final String label;
    private final List<FeatureSequence> sequences;
    private final ObservationBatch batch;

    public ClassData(String label, List<FeatureSequence> sequences) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Class label is required");
        }
        if (sequences == null || sequences.isEmpty()) {
            throw new IllegalArgumentException("Class '" + label + "' has no sequences");
        }
        this.label = label;
        this.sequences = List.copyOf(sequences);
        int[] all = new int[sequences.size()];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        this.batch = ObservationBatch.combine(all, this.sequences);
    }

    public String getLabel() {
        return label;
    }

    public List<FeatureSequence> getSequences() {
        return Collections.unmodifiableList(sequences);
    }

    public int getSequenceCount() {
        return sequences.size();
    }

    public ObservationBatch getBatch() {
        return batch;
    }

    public int getFrameCount() {
        return batch.getFrameCount();
    }

    public int getFeatureCount() {
        return batch.getFeatureCount();
    }
}
