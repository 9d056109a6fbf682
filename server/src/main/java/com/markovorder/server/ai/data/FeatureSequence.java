package com.markovorder.server.ai.data;

public class FeatureSequence {
    // frames[t][f] is feature f of frame t
    private final double[][] frames;

    public FeatureSequence(double[][] frames) {
        if (frames == null || frames.length == 0) {
            throw new IllegalArgumentException("Sequence must contain at least one frame");
        }
        if (frames[0] == null) {
            throw new IllegalArgumentException("Frame 0 is null");
        }
        int width = frames[0].length;
        if (width == 0) {
            throw new IllegalArgumentException("Frames must have at least one feature");
        }
        double[][] copy = new double[frames.length][];
        for (int t = 0; t < frames.length; t++) {
            if (frames[t] == null) {
                throw new IllegalArgumentException("Frame " + t + " is null");
            }
            if (frames[t].length != width) {
                throw new IllegalArgumentException(
                        "Frame " + t + " has " + frames[t].length + " features, expected " + width);
            }
            copy[t] = frames[t].clone();
        }
        this.frames = copy;
    }

    public int getFrameCount() {
        return frames.length;
    }

    public int getFeatureCount() {
        return frames[0].length;
    }

    public double[] getFrame(int t) {
        return frames[t].clone();
    }

    double[] frameRef(int t) {
        return frames[t];
    }
}
