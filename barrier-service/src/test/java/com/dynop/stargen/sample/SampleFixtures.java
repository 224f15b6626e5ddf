package com.dynop.stargen.sample;

import java.util.ArrayList;
import java.util.List;

/**
 * Small in-memory sample tables shared by tests.
 */
public final class SampleFixtures {

    private SampleFixtures() {
    }

    /**
     * @param points {@code {lat, lon, age}} per sample; ids are {@code s0, s1, ...}
     */
    public static List<Sample> samples(double[]... points) {
        List<Sample> samples = new ArrayList<>(points.length);
        for (int i = 0; i < points.length; i++) {
            samples.add(new Sample("s" + i, points[i][0], points[i][1], (long) points[i][2]));
        }
        return samples;
    }

    /**
     * Matrix with {@code value} everywhere except the zero diagonal.
     */
    public static double[][] uniformMatrix(int n, double value) {
        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                rows[i][j] = i == j ? 0 : value;
            }
        }
        return rows;
    }

    public static SampleStore uniformStore(double value, double[]... points) {
        return new SampleStore(samples(points), DistanceMatrix.of(uniformMatrix(points.length, value)));
    }
}
