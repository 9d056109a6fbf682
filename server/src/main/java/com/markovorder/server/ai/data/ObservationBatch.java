package com.markovorder.server.ai.data;

import java.util.Arrays;
import java.util.List;

public class ObservationBatch {
    private final double[][] matrix;
    private final int[] lengths;

    public ObservationBatch(double[][] matrix, int[] lengths) {
        if (matrix == null || lengths == null) {
            throw new IllegalArgumentException("Matrix and lengths are required");
        }
        long total = 0;
        for (int len : lengths) {
            if (len <= 0) {
                throw new IllegalArgumentException("Sequence lengths must be positive: " + Arrays.toString(lengths));
            }
            total += len;
        }
        if (total != matrix.length) {
            throw new IllegalArgumentException(
                    "Sum of lengths (" + total + ") does not match matrix rows (" + matrix.length + ")");
        }
        this.matrix = matrix;
        this.lengths = lengths.clone();
    }

    public static ObservationBatch of(FeatureSequence sequence) {
        return combine(new int[] { 0 }, List.of(sequence));
    }

    /**
     * Concatenates the sequences at the given indices, in index order.
     */
    public static ObservationBatch combine(int[] indices, List<FeatureSequence> sequences) {
        int rows = 0;
        for (int idx : indices) {
            rows += sequences.get(idx).getFrameCount();
        }
        double[][] matrix = new double[rows][];
        int[] lengths = new int[indices.length];
        int row = 0;
        for (int i = 0; i < indices.length; i++) {
            FeatureSequence seq = sequences.get(indices[i]);
            lengths[i] = seq.getFrameCount();
            for (int t = 0; t < seq.getFrameCount(); t++) {
                matrix[row++] = seq.frameRef(t);
            }
        }
        return new ObservationBatch(matrix, lengths);
    }

    public double[][] getMatrix() {
        return matrix;
    }

    public int[] getLengths() {
        return lengths.clone();
    }

    public int getSequenceCount() {
        return lengths.length;
    }

    public int getLength(int sequence) {
        return lengths[sequence];
    }

    public int getFrameCount() {
        return matrix.length;
    }

    public int getFeatureCount() {
        return matrix.length == 0 ? 0 : matrix[0].length;
    }
}
