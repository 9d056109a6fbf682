package com.markovorder.server.ai.hmm;

import com.markovorder.server.ai.data.ObservationBatch;

/**
 * Hidden Markov model with one diagonal-covariance Gaussian emission per state.
 * Instances are produced by {@link GaussianHmmTrainer} and are immutable.
 */
public class GaussianHmm implements SequenceModel {
    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    // [state]
    private final double[] startProbs;
    // [fromState][toState]
    private final double[][] transProbs;
    // [state][feature]
    private final double[][] means;
    private final double[][] variances;

    GaussianHmm(double[] startProbs, double[][] transProbs, double[][] means, double[][] variances) {
        this.startProbs = startProbs;
        this.transProbs = transProbs;
        this.means = means;
        this.variances = variances;
    }

    @Override
    public int getStateCount() {
        return startProbs.length;
    }

    @Override
    public int getFeatureCount() {
        return means[0].length;
    }

    public double getStartProb(int state) {
        return startProbs[state];
    }

    public double getTransProb(int from, int to) {
        return transProbs[from][to];
    }

    public double[] getMean(int state) {
        return means[state].clone();
    }

    public double[] getVariance(int state) {
        return variances[state].clone();
    }

    @Override
    public double score(ObservationBatch batch) throws ScoringException {
        int n = getStateCount();
        if (batch.getFrameCount() == 0) {
            throw new ScoringException(n, "Cannot score an empty batch");
        }
        double[][] x = batch.getMatrix();
        int d = getFeatureCount();
        for (double[] frame : x) {
            if (frame.length != d) {
                throw new ScoringException(n, "Frame has " + frame.length + " features, model expects " + d);
            }
        }

        double total = 0.0;
        int offset = 0;
        for (int s = 0; s < batch.getSequenceCount(); s++) {
            int len = batch.getLength(s);
            total += forward(x, offset, len, null, null);
            offset += len;
        }
        if (!Double.isFinite(total)) {
            throw new ScoringException(n, "Log-likelihood is not finite: " + total);
        }
        return total;
    }

    double logEmission(int state, double[] frame) {
        double[] mu = means[state];
        double[] var = variances[state];
        double acc = 0.0;
        for (int f = 0; f < mu.length; f++) {
            double diff = frame[f] - mu[f];
            acc += LOG_2PI + Math.log(var[f]) + diff * diff / var[f];
        }
        return -0.5 * acc;
    }

    /**
     * Fills {@code b[t][i]} with emission densities shifted by the per-frame
     * maximum log density, which is returned in {@code shift[t]}.
     */
    void scaledEmissions(double[][] x, int offset, int len, double[][] b, double[] shift) {
        int n = getStateCount();
        for (int t = 0; t < len; t++) {
            double[] frame = x[offset + t];
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                b[t][i] = logEmission(i, frame);
                if (b[t][i] > max) {
                    max = b[t][i];
                }
            }
            for (int i = 0; i < n; i++) {
                b[t][i] = Math.exp(b[t][i] - max);
            }
            shift[t] = max;
        }
    }

    /**
     * Scaled forward pass over one sequence. When {@code alpha} and {@code scale}
     * are given they receive the normalized forward variables and the per-frame
     * normalizers for a following backward pass.
     *
     * @return log-likelihood of the sequence, negative infinity if it has zero
     *         probability
     */
    double forward(double[][] x, int offset, int len, double[][] alpha, double[] scale) {
        int n = getStateCount();
        double[][] b = new double[len][n];
        double[] shift = new double[len];
        scaledEmissions(x, offset, len, b, shift);
        return forward(b, shift, len, alpha == null ? new double[len][n] : alpha,
                scale == null ? new double[len] : scale);
    }

    double forward(double[][] b, double[] shift, int len, double[][] alpha, double[] scale) {
        int n = getStateCount();
        double logL = 0.0;
        for (int t = 0; t < len; t++) {
            double c = 0.0;
            for (int j = 0; j < n; j++) {
                double prior;
                if (t == 0) {
                    prior = startProbs[j];
                } else {
                    prior = 0.0;
                    for (int i = 0; i < n; i++) {
                        prior += alpha[t - 1][i] * transProbs[i][j];
                    }
                }
                alpha[t][j] = prior * b[t][j];
                c += alpha[t][j];
            }
            if (!(c > 0.0)) {
                return Double.NEGATIVE_INFINITY;
            }
            for (int j = 0; j < n; j++) {
                alpha[t][j] /= c;
            }
            scale[t] = c;
            logL += Math.log(c) + shift[t];
        }
        return logL;
    }

    void backward(double[][] b, double[] scale, int len, double[][] beta) {
        int n = getStateCount();
        for (int i = 0; i < n; i++) {
            beta[len - 1][i] = 1.0;
        }
        for (int t = len - 2; t >= 0; t--) {
            for (int i = 0; i < n; i++) {
                double acc = 0.0;
                for (int j = 0; j < n; j++) {
                    acc += transProbs[i][j] * b[t + 1][j] * beta[t + 1][j];
                }
                beta[t][i] = acc / scale[t + 1];
            }
        }
    }
}
