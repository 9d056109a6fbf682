package com.markovorder.server.ai.hmm;

import com.markovorder.server.ai.data.ObservationBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class GaussianHmmTrainer implements ModelTrainer {
    private static final Logger logger = LoggerFactory.getLogger(GaussianHmmTrainer.class);

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-2;
    public static final double DEFAULT_MIN_COVAR = 1e-3;
    private static final int KMEANS_PASSES = 10;

    private final int maxIterations;
    private final double tolerance;
    private final double minCovar;

    public GaussianHmmTrainer() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, DEFAULT_MIN_COVAR);
    }

    public GaussianHmmTrainer(int maxIterations, double tolerance, double minCovar) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        if (minCovar <= 0) {
            throw new IllegalArgumentException("minCovar must be positive");
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.minCovar = minCovar;
    }

    @Override
    public GaussianHmm fit(ObservationBatch batch, int stateCount, long seed) throws TrainingException {
        int n = stateCount;
        if (n < 1) {
            throw new TrainingException(n, "State count must be at least 1");
        }
        double[][] x = batch.getMatrix();
        if (x.length < n) {
            throw new TrainingException(n, "Need at least " + n + " frames, got " + x.length);
        }
        int d = batch.getFeatureCount();
        for (double[] frame : x) {
            if (frame.length != d) {
                throw new TrainingException(n, "Ragged feature matrix");
            }
            for (double v : frame) {
                if (!Double.isFinite(v)) {
                    throw new TrainingException(n, "Feature matrix contains non-finite values");
                }
            }
        }

        double[] startProbs = new double[n];
        Arrays.fill(startProbs, 1.0 / n);
        double[][] transProbs = new double[n][n];
        for (double[] row : transProbs) {
            Arrays.fill(row, 1.0 / n);
        }
        double[][] means = initialMeans(x, n, seed);
        double[][] variances = new double[n][];
        double[] globalVar = featureVariance(x);
        for (int i = 0; i < n; i++) {
            variances[i] = globalVar.clone();
        }

        GaussianHmm model = new GaussianHmm(startProbs, transProbs, means, variances);
        double prevLogL = Double.NEGATIVE_INFINITY;
        int iter = 0;
        boolean converged = false;
        for (; iter < maxIterations; iter++) {
            Statistics stats = expectation(model, batch);
            if (!Double.isFinite(stats.logL)) {
                throw new TrainingException(n, "Log-likelihood became non-finite at iteration " + iter);
            }
            if (iter > 0 && Math.abs(stats.logL - prevLogL) < tolerance) {
                converged = true;
                break;
            }
            prevLogL = stats.logL;
            model = maximization(model, stats);
        }

        if (converged) {
            logger.debug("Fitted {} states on {} frames in {} iterations, logL={}", n, x.length, iter, prevLogL);
        } else {
            logger.debug("Stopped after {} iterations without converging ({} states, logL={})", maxIterations, n,
                    prevLogL);
        }
        return model;
    }

    /**
     * Picks {@code n} distinct frames as seeds and refines them with a few
     * k-means passes.
     */
    private double[][] initialMeans(double[][] x, int n, long seed) throws TrainingException {
        List<Integer> order = new ArrayList<>(x.length);
        for (int t = 0; t < x.length; t++) {
            order.add(t);
        }
        Collections.shuffle(order, new Random(seed));

        double[][] centers = new double[n][];
        int found = 0;
        for (int idx : order) {
            if (found == n) {
                break;
            }
            boolean duplicate = false;
            for (int k = 0; k < found; k++) {
                if (Arrays.equals(centers[k], x[idx])) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                centers[found++] = x[idx].clone();
            }
        }
        if (found < n) {
            throw new TrainingException(n, "Only " + found + " distinct frames for " + n + " states");
        }

        int d = x[0].length;
        int[] assignment = new int[x.length];
        for (int pass = 0; pass < KMEANS_PASSES; pass++) {
            boolean changed = false;
            for (int t = 0; t < x.length; t++) {
                int best = nearest(centers, x[t]);
                if (pass == 0 || best != assignment[t]) {
                    changed = true;
                    assignment[t] = best;
                }
            }
            if (!changed) {
                break;
            }
            double[][] sums = new double[n][d];
            int[] counts = new int[n];
            for (int t = 0; t < x.length; t++) {
                counts[assignment[t]]++;
                for (int f = 0; f < d; f++) {
                    sums[assignment[t]][f] += x[t][f];
                }
            }
            for (int k = 0; k < n; k++) {
                // an empty cluster keeps its previous center
                if (counts[k] > 0) {
                    for (int f = 0; f < d; f++) {
                        centers[k][f] = sums[k][f] / counts[k];
                    }
                }
            }
        }
        return centers;
    }

    private static int nearest(double[][] centers, double[] frame) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int k = 0; k < centers.length; k++) {
            double dist = 0.0;
            for (int f = 0; f < frame.length; f++) {
                double diff = frame[f] - centers[k][f];
                dist += diff * diff;
            }
            if (dist < bestDist) {
                bestDist = dist;
                best = k;
            }
        }
        return best;
    }

    private double[] featureVariance(double[][] x) {
        int d = x[0].length;
        double[] mean = new double[d];
        for (double[] frame : x) {
            for (int f = 0; f < d; f++) {
                mean[f] += frame[f];
            }
        }
        for (int f = 0; f < d; f++) {
            mean[f] /= x.length;
        }
        double[] var = new double[d];
        for (double[] frame : x) {
            for (int f = 0; f < d; f++) {
                double diff = frame[f] - mean[f];
                var[f] += diff * diff;
            }
        }
        for (int f = 0; f < d; f++) {
            var[f] = var[f] / x.length + minCovar;
        }
        return var;
    }

    private static class Statistics {
        double logL;
        double[] start;
        double[][] trans;
        double[] occupancy;
        double[][] sumX;
        double[][] sumX2;

        Statistics(int n, int d) {
            start = new double[n];
            trans = new double[n][n];
            occupancy = new double[n];
            sumX = new double[n][d];
            sumX2 = new double[n][d];
        }
    }

    private Statistics expectation(GaussianHmm model, ObservationBatch batch) {
        int n = model.getStateCount();
        int d = model.getFeatureCount();
        double[][] x = batch.getMatrix();
        Statistics stats = new Statistics(n, d);

        int offset = 0;
        for (int s = 0; s < batch.getSequenceCount(); s++) {
            int len = batch.getLength(s);
            double[][] b = new double[len][n];
            double[] shift = new double[len];
            double[][] alpha = new double[len][n];
            double[][] beta = new double[len][n];
            double[] scale = new double[len];

            model.scaledEmissions(x, offset, len, b, shift);
            double seqLogL = model.forward(b, shift, len, alpha, scale);
            if (seqLogL == Double.NEGATIVE_INFINITY) {
                stats.logL = Double.NEGATIVE_INFINITY;
                return stats;
            }
            stats.logL += seqLogL;
            model.backward(b, scale, len, beta);

            for (int t = 0; t < len; t++) {
                double[] frame = x[offset + t];
                for (int i = 0; i < n; i++) {
                    double gamma = alpha[t][i] * beta[t][i];
                    if (t == 0) {
                        stats.start[i] += gamma;
                    }
                    stats.occupancy[i] += gamma;
                    for (int f = 0; f < d; f++) {
                        stats.sumX[i][f] += gamma * frame[f];
                        stats.sumX2[i][f] += gamma * frame[f] * frame[f];
                    }
                    if (t < len - 1) {
                        for (int j = 0; j < n; j++) {
                            stats.trans[i][j] += alpha[t][i] * model.getTransProb(i, j) * b[t + 1][j]
                                    * beta[t + 1][j] / scale[t + 1];
                        }
                    }
                }
            }
            offset += len;
        }
        return stats;
    }

    private GaussianHmm maximization(GaussianHmm previous, Statistics stats) throws TrainingException {
        int n = previous.getStateCount();
        int d = previous.getFeatureCount();

        double[] startProbs = normalize(stats.start);
        if (startProbs == null) {
            throw new TrainingException(n, "Start distribution has no mass");
        }

        double[][] transProbs = new double[n][];
        for (int i = 0; i < n; i++) {
            transProbs[i] = normalize(stats.trans[i]);
            if (transProbs[i] == null) {
                // state only seen at sequence ends: keep its outgoing row
                transProbs[i] = new double[n];
                for (int j = 0; j < n; j++) {
                    transProbs[i][j] = previous.getTransProb(i, j);
                }
            }
        }

        double[][] means = new double[n][d];
        double[][] variances = new double[n][d];
        for (int i = 0; i < n; i++) {
            double occ = stats.occupancy[i];
            if (!(occ > 0.0) || !Double.isFinite(occ)) {
                throw new TrainingException(n, "State " + i + " lost all posterior mass");
            }
            for (int f = 0; f < d; f++) {
                double mu = stats.sumX[i][f] / occ;
                double var = stats.sumX2[i][f] / occ - mu * mu;
                means[i][f] = mu;
                variances[i][f] = Math.max(var, 0.0) + minCovar;
            }
        }
        return new GaussianHmm(startProbs, transProbs, means, variances);
    }

    private static double[] normalize(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        if (!(sum > 0.0) || !Double.isFinite(sum)) {
            return null;
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] / sum;
        }
        return out;
    }
}
