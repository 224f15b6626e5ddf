package com.dynop.stargen.barrier;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Scores the edges of one time bin against a curve of expected genetic distance.
 * 
 * <p>The scaled distance of an edge is its genetic distance divided by the curve at its geographic
 * distance. Wherever the curve is zero or undefined the scaled distance is 1.0, and a bin with
 * fewer than two distinct geographic distances is not fitted at all.
 */
public final class BarrierScorer {

    private static final Logger LOGGER = Logger.getLogger(BarrierScorer.class.getName());

    static final double NEUTRAL_SCALE = 1.0;

    private final CurveSmoother smoother;
    private final double barrierThreshold;
    private final double corridorThreshold;

    /**
     * @param smoother          Curve fitting strategy
     * @param barrierThreshold  Scaled distance at or above which an edge is a barrier, {@code > 1}
     * @param corridorThreshold Scaled distance at or below which an edge is a corridor, in {@code (0, 1)}
     */
    public BarrierScorer(CurveSmoother smoother, double barrierThreshold, double corridorThreshold) {
        this.smoother = Objects.requireNonNull(smoother, "smoother");
        if (!(barrierThreshold > 1)) {
            throw new IllegalArgumentException("barrierThreshold must be > 1, got " + barrierThreshold);
        }
        if (!(corridorThreshold > 0 && corridorThreshold < 1)) {
            throw new IllegalArgumentException("corridorThreshold must be in (0, 1), got " + corridorThreshold);
        }
        this.barrierThreshold = barrierThreshold;
        this.corridorThreshold = corridorThreshold;
    }

    /**
     * Result of scoring one bin.
     *
     * @param edges Scored edges in input order
     * @param curve Fitted curve, null when the bin had too few distinct distances
     */
    public record Scoring(List<EdgeMetrics> edges, @Nullable FittedCurve curve) {
        public Scoring {
            edges = List.copyOf(edges);
        }

        public boolean fitted() {
            return curve != null;
        }
    }

    public Scoring score(List<EdgeMetrics> edges) {
        FittedCurve curve = fit(edges);
        List<EdgeMetrics> scored = new ArrayList<>(edges.size());
        for (EdgeMetrics m : edges) {
            double scaled = curve == null ? NEUTRAL_SCALE : scaledDistance(m, curve);
            scored.add(m.withScore(scaled, classify(scaled)));
        }
        return new Scoring(scored, curve);
    }

    public EdgeClassification classify(double scaled) {
        if (scaled >= barrierThreshold) {
            return EdgeClassification.BARRIER;
        }
        if (scaled <= corridorThreshold) {
            return EdgeClassification.CORRIDOR;
        }
        return EdgeClassification.NORMAL;
    }

    @Nullable
    private FittedCurve fit(List<EdgeMetrics> edges) {
        // merge equal distances into one weighted knot, LOESS needs strictly increasing x
        TreeMap<Double, double[]> knots = new TreeMap<>();
        for (EdgeMetrics m : edges) {
            double[] sumAndCount = knots.computeIfAbsent(m.getGeoDistanceKm(), k -> new double[2]);
            sumAndCount[0] += m.getGeneticDistance();
            sumAndCount[1] += 1;
        }
        if (knots.size() < 2) {
            LOGGER.fine(() -> "Skipping curve fit: " + knots.size() + " distinct distances over " + edges.size() + " edges");
            return null;
        }

        double[] x = new double[knots.size()];
        double[] y = new double[knots.size()];
        double[] w = new double[knots.size()];
        int i = 0;
        for (Map.Entry<Double, double[]> entry : knots.entrySet()) {
            x[i] = entry.getKey();
            y[i] = entry.getValue()[0] / entry.getValue()[1];
            w[i] = entry.getValue()[1];
            i++;
        }
        return smoother.fit(x, y, w);
    }

    private static double scaledDistance(EdgeMetrics m, FittedCurve curve) {
        double expected = curve.value(m.getGeoDistanceKm());
        if (!(expected > 0) || Double.isInfinite(expected)) {
            return NEUTRAL_SCALE;
        }
        double scaled = m.getGeneticDistance() / expected;
        return Double.isFinite(scaled) ? scaled : NEUTRAL_SCALE;
    }

    /**
     * Cells with at least one edge whose edges are all barriers.
     * 
     * @return Cell ids in ascending order
     */
    public static List<String> isolatedCells(List<EdgeMetrics> scored) {
        Map<String, Boolean> allBarriers = new HashMap<>();
        for (EdgeMetrics m : scored) {
            boolean barrier = m.getClassification() == EdgeClassification.BARRIER;
            allBarriers.merge(m.getEdge().getCellA().getCellId(), barrier, Boolean::logicalAnd);
            allBarriers.merge(m.getEdge().getCellB().getCellId(), barrier, Boolean::logicalAnd);
        }
        TreeSet<String> isolated = new TreeSet<>();
        allBarriers.forEach((cellId, barrier) -> {
            if (barrier) {
                isolated.add(cellId);
            }
        });
        return new ArrayList<>(isolated);
    }

    public double getBarrierThreshold() {
        return barrierThreshold;
    }

    public double getCorridorThreshold() {
        return corridorThreshold;
    }
}
