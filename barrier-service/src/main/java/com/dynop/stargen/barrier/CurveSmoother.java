package com.dynop.stargen.barrier;

/**
 * Fits the expected genetic distance as a function of geographic distance.
 */
public interface CurveSmoother {

    /**
     * @param x       Knot positions, strictly increasing, at least two
     * @param y       Observed value per knot
     * @param weights Positive weight per knot
     * @return Curve defined on {@code [x[0], x[n-1]]}
     */
    FittedCurve fit(double[] x, double[] y, double[] weights);
}
