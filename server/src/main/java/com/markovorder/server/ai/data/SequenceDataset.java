package com.markovorder.server.ai.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only mapping from class label to its training data. Iteration follows
 * insertion order.
 */
public class SequenceDataset {
    private final Map<String, ClassData> classes;

    private SequenceDataset(Map<String, ClassData> classes) {
        this.classes = Collections.unmodifiableMap(classes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ClassData get(String label) {
        ClassData data = classes.get(label);
        if (data == null) {
            throw new IllegalArgumentException("Unknown class label: " + label);
        }
        return data;
    }

    public Set<String> labels() {
        return classes.keySet();
    }

    public List<ClassData> others(String label) {
        List<ClassData> result = new ArrayList<>(classes.size());
        for (ClassData data : classes.values()) {
            if (!data.getLabel().equals(label)) {
                result.add(data);
            }
        }
        return result;
    }

    public int size() {
        return classes.size();
    }

    public static class Builder {
        private final Map<String, ClassData> classes = new LinkedHashMap<>();

        public Builder add(ClassData data) {
            if (classes.putIfAbsent(data.getLabel(), data) != null) {
                throw new IllegalArgumentException("Duplicate class label: " + data.getLabel());
            }
            return this;
        }

        public Builder add(String label, List<FeatureSequence> sequences) {
            return add(new ClassData(label, sequences));
        }

        public SequenceDataset build() {
            return new SequenceDataset(new LinkedHashMap<>(classes));
        }
    }
}
