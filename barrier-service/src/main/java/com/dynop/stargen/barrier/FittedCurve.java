package com.dynop.stargen.barrier;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Piecewise linear curve through fitted knots. Undefined (NaN) outside the knot range.
 */
public final class FittedCurve {

    private final double[] knots;
    private final double[] values;
    private final PolynomialSplineFunction function;

    public FittedCurve(double[] knots, double[] values) {
        if (knots.length != values.length) {
            throw new IllegalArgumentException("knots and values differ in length: " + knots.length + " vs " + values.length);
        }
        if (knots.length < 2) {
            throw new IllegalArgumentException("a curve needs at least two knots, got " + knots.length);
        }
        this.knots = knots.clone();
        this.values = values.clone();
        this.function = new LinearInterpolator().interpolate(this.knots, this.values);
    }

    /**
     * @return Interpolated value, or NaN when {@code x} lies outside the knots
     */
    public double value(double x) {
        if (!function.isValidPoint(x)) {
            return Double.NaN;
        }
        return function.value(x);
    }

    public double[] getKnots() {
        return knots.clone();
    }

    public double[] getValues() {
        return values.clone();
    }
}
