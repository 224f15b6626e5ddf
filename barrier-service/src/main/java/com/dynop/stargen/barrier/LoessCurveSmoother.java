package com.dynop.stargen.barrier;

import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;

import java.util.logging.Logger;

/**
 * Locally weighted regression followed by an isotonic pass, so the expected genetic distance never
 * decreases with geographic distance.
 */
public final class LoessCurveSmoother implements CurveSmoother {

    private static final Logger LOGGER = Logger.getLogger(LoessCurveSmoother.class.getName());

    static final int MIN_POINTS_PER_WINDOW = 3;

    private final double bandwidth;
    private final int robustnessIterations;

    /**
     * @param bandwidth            Fraction of knots in each local window, in {@code (0, 1]}
     * @param robustnessIterations Reweighting passes against outliers
     */
    public LoessCurveSmoother(double bandwidth, int robustnessIterations) {
        if (!(bandwidth > 0 && bandwidth <= 1)) {
            throw new IllegalArgumentException("bandwidth must be in (0, 1], got " + bandwidth);
        }
        if (robustnessIterations < 0) {
            throw new IllegalArgumentException("robustnessIterations must be >= 0, got " + robustnessIterations);
        }
        this.bandwidth = bandwidth;
        this.robustnessIterations = robustnessIterations;
    }

    @Override
    public FittedCurve fit(double[] x, double[] y, double[] weights) {
        double effective = effectiveBandwidth(bandwidth, x.length);
        if (effective != bandwidth) {
            LOGGER.fine(() -> String.format("Bandwidth raised from %.3f to %.3f for %d knots", bandwidth, effective, x.length));
        }
        double[] smoothed = new LoessInterpolator(effective, robustnessIterations).smooth(x, y, weights);
        if (robustnessIterations > 0 && containsNaN(smoothed)) {
            // robustness weights can zero out a whole window when the residuals are all near zero
            LOGGER.fine("Robust fit left undefined knots, filling them from a plain fit");
            double[] plain = new LoessInterpolator(effective, 0).smooth(x, y, weights);
            for (int i = 0; i < smoothed.length; i++) {
                if (Double.isNaN(smoothed[i])) {
                    smoothed[i] = plain[i];
                }
            }
        }
        for (int i = 0; i < smoothed.length; i++) {
            if (Double.isNaN(smoothed[i])) {
                smoothed[i] = y[i];
            }
        }
        return new FittedCurve(x, monotone(smoothed, weights));
    }

    private static boolean containsNaN(double[] values) {
        for (double v : values) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Widen the window until it holds at least {@link #MIN_POINTS_PER_WINDOW} knots.
     */
    static double effectiveBandwidth(double bandwidth, int knotCount) {
        double minimum = Math.min(1.0, (MIN_POINTS_PER_WINDOW + 1e-9) / knotCount);
        return Math.max(bandwidth, minimum);
    }

    /**
     * Weighted pool-adjacent-violators: the closest non-decreasing sequence in weighted least squares.
     */
    static double[] monotone(double[] values, double[] weights) {
        int n = values.length;
        double[] blockValue = new double[n];
        double[] blockWeight = new double[n];
        int[] blockSize = new int[n];
        int blocks = 0;
        for (int i = 0; i < n; i++) {
            blockValue[blocks] = values[i];
            blockWeight[blocks] = weights[i];
            blockSize[blocks] = 1;
            blocks++;
            while (blocks > 1 && blockValue[blocks - 2] > blockValue[blocks - 1]) {
                double w = blockWeight[blocks - 2] + blockWeight[blocks - 1];
                blockValue[blocks - 2] = (blockValue[blocks - 2] * blockWeight[blocks - 2]
                        + blockValue[blocks - 1] * blockWeight[blocks - 1]) / w;
                blockWeight[blocks - 2] = w;
                blockSize[blocks - 2] += blockSize[blocks - 1];
                blocks--;
            }
        }

        double[] result = new double[n];
        int position = 0;
        for (int b = 0; b < blocks; b++) {
            for (int k = 0; k < blockSize[b]; k++) {
                result[position++] = blockValue[b];
            }
        }
        return result;
    }

    public double getBandwidth() {
        return bandwidth;
    }

    public int getRobustnessIterations() {
        return robustnessIterations;
    }
}
