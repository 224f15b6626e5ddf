package com.dynop.stargen.barrier;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FittedCurveTest {

    @Test
    void interpolatesLinearlyBetweenKnots() {
        FittedCurve curve = new FittedCurve(new double[]{0, 10, 20}, new double[]{1, 2, 4});

        assertEquals(1.5, curve.value(5), 1e-12);
        assertEquals(3.0, curve.value(15), 1e-12);
        assertEquals(4.0, curve.value(20), 1e-12);
    }

    @Test
    void isUndefinedOutsideTheKnots() {
        FittedCurve curve = new FittedCurve(new double[]{0, 10}, new double[]{1, 2});

        assertTrue(Double.isNaN(curve.value(-0.1)));
        assertTrue(Double.isNaN(curve.value(10.5)));
    }

    @Test
    void needsTwoKnots() {
        assertThrows(IllegalArgumentException.class, () -> new FittedCurve(new double[]{1}, new double[]{1}));
        assertThrows(IllegalArgumentException.class, () -> new FittedCurve(new double[]{1, 2}, new double[]{1}));
    }
}
