package com.dynop.stargen.sample;

import java.util.List;

/**
 * Symmetric NxN genetic distance matrix keyed by sample row index.
 * 
 * <p>Values are copied into a flat row-major array on construction and never change afterwards.
 * The triangle inequality is not checked and must not be relied upon.
 */
public final class DistanceMatrix {

    static final double SYMMETRY_TOLERANCE = 1e-9;

    /**
     * Largest sample count whose flat {@code n * n} array still fits in an int index.
     */
    static final int MAX_SAMPLES = 46_340;
    private static final long MAX_ENTRIES = (long) MAX_SAMPLES * MAX_SAMPLES;

    private final int size;
    private final double[] values;

    private DistanceMatrix(int size, double[] values) {
        this.size = size;
        this.values = values;
    }

    /**
     * Copies and validates a square matrix.
     * 
     * @param rows Matrix rows; every row must have {@code rows.length} entries
     * @return the validated matrix
     * @throws InputInconsistencyException if the matrix is not square, not symmetric, has a non-zero
     *                                     diagonal or contains negative or non-finite values
     */
    public static DistanceMatrix of(double[][] rows) {
        int n = rows.length;
        if ((long) n * n > MAX_ENTRIES) {
            throw new InputInconsistencyException("MATRIX_TOO_LARGE",
                    String.format("%dx%d distance matrix exceeds the limit of %d samples", n, n, MAX_SAMPLES));
        }
        double[] flat = new double[n * n];
        for (int i = 0; i < n; i++) {
            if (rows[i] == null || rows[i].length != n) {
                throw new InputInconsistencyException("MATRIX_DIMENSION_MISMATCH",
                        "row " + i + " has " + (rows[i] == null ? 0 : rows[i].length) + " columns, expected " + n,
                        List.of(i));
            }
            System.arraycopy(rows[i], 0, flat, i * n, n);
        }

        for (int i = 0; i < n; i++) {
            double diagonal = flat[i * n + i];
            if (Math.abs(diagonal) > SYMMETRY_TOLERANCE) {
                throw new InputInconsistencyException("NONZERO_DIAGONAL",
                        "distance of a sample to itself is " + diagonal, List.of(i));
            }
            for (int j = 0; j < n; j++) {
                double value = flat[i * n + j];
                if (!Double.isFinite(value) || value < 0) {
                    throw new InputInconsistencyException("NEGATIVE_DISTANCE",
                            "distance must be a finite non-negative number but was " + value, List.of(i, j));
                }
                if (j > i && Math.abs(value - flat[j * n + i]) > SYMMETRY_TOLERANCE) {
                    throw new InputInconsistencyException("ASYMMETRIC_MATRIX",
                            String.format("d(i,j)=%s differs from d(j,i)=%s", value, flat[j * n + i]),
                            List.of(i, j));
                }
            }
        }
        return new DistanceMatrix(n, flat);
    }

    /**
     * @return Number of rows (and columns)
     */
    public int size() {
        return size;
    }

    /**
     * @throws IndexOutOfBoundsException if an index is outside {@code [0, size)}
     */
    public double distance(int i, int j) {
        if (i < 0 || i >= size || j < 0 || j >= size) {
            throw new IndexOutOfBoundsException("(" + i + ", " + j + ") outside matrix of size " + size);
        }
        return values[i * size + j];
    }
}
