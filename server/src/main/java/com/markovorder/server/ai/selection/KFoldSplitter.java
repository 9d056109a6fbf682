package com.markovorder.server.ai.selection;

import java.util.ArrayList;
import java.util.List;

public final class KFoldSplitter {

    private KFoldSplitter() {
    }

    public static List<Fold> split(int count, int k) {
        if (k < 2) {
            throw new IllegalArgumentException("Need at least 2 folds, got " + k);
        }
        if (count < k) {
            throw new IllegalArgumentException("Cannot split " + count + " items into " + k + " folds");
        }
        List<Fold> folds = new ArrayList<>(k);
        int base = count / k;
        int extra = count % k;
        int start = 0;
        for (int f = 0; f < k; f++) {
            int size = base + (f < extra ? 1 : 0);
            int[] test = new int[size];
            int[] train = new int[count - size];
            int ti = 0;
            for (int i = 0; i < count; i++) {
                if (i >= start && i < start + size) {
                    test[i - start] = i;
                } else {
                    train[ti++] = i;
                }
            }
            folds.add(new Fold(train, test));
            start += size;
        }
        return folds;
    }

    public static final class Fold {
        private final int[] trainIndices;
        private final int[] testIndices;

        Fold(int[] trainIndices, int[] testIndices) {
            this.trainIndices = trainIndices;
            this.testIndices = testIndices;
        }

        public int[] getTrainIndices() {
            return trainIndices.clone();
        }

        public int[] getTestIndices() {
            return testIndices.clone();
        }
    }
}
