package com.dynop.stargen.barrier;

import com.dynop.stargen.graph.NeighborEdge;
import com.dynop.stargen.grid.HexCell;
import com.dynop.stargen.sample.InputInconsistencyException;
import com.dynop.stargen.sample.SampleStore;
import com.graphhopper.util.DistanceCalc;
import com.graphhopper.util.DistanceCalcEarth;
import com.graphhopper.util.shapes.GHPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns neighbor edges into geographic and genetic distances between cells.
 */
public final class DistanceAggregator {

    private final DistanceCalc distanceCalc;

    public DistanceAggregator() {
        this(DistanceCalcEarth.DIST_EARTH);
    }

    DistanceAggregator(DistanceCalc distanceCalc) {
        this.distanceCalc = distanceCalc;
    }

    /**
     * Measure every edge of one bin.
     * 
     * @param edges Edges of a single time bin
     * @param store Sample table the cell members index into
     * @return One metrics entry per edge, in input order, with the per-bin normalized distance set
     * @throws InputInconsistencyException if a cell is empty or references an unknown sample
     */
    public List<EdgeMetrics> aggregate(List<NeighborEdge> edges, SampleStore store) {
        List<EdgeMetrics> metrics = new ArrayList<>(edges.size());
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (NeighborEdge edge : edges) {
            double genetic = geneticDistance(edge, store);
            min = Math.min(min, genetic);
            max = Math.max(max, genetic);
            metrics.add(new EdgeMetrics(edge, geoDistanceKm(edge), genetic));
        }

        double range = max - min;
        List<EdgeMetrics> normalized = new ArrayList<>(metrics.size());
        for (EdgeMetrics m : metrics) {
            double value = range > 0 ? (m.getGeneticDistance() - min) / range : 0.0;
            normalized.add(m.withNormalizedGeneticDistance(value));
        }
        return normalized;
    }

    public double geoDistanceKm(NeighborEdge edge) {
        GHPoint a = edge.getCellA().getCentroid();
        GHPoint b = edge.getCellB().getCentroid();
        return distanceCalc.calcDist(a.getLat(), a.getLon(), b.getLat(), b.getLon()) / 1000.0;
    }

    /**
     * Mean of {@code d(i, j)} over every member {@code i} of cell A and {@code j} of cell B.
     */
    public double geneticDistance(NeighborEdge edge, SampleStore store) {
        HexCell a = edge.getCellA();
        HexCell b = edge.getCellB();
        requireMembers(a, store);
        requireMembers(b, store);

        double sum = 0;
        for (int i : a.getMemberIndices()) {
            for (int j : b.getMemberIndices()) {
                sum += store.distance(i, j);
            }
        }
        return sum / ((double) a.getMemberIndices().size() * b.getMemberIndices().size());
    }

    private static void requireMembers(HexCell cell, SampleStore store) {
        if (cell.getMemberIndices().isEmpty()) {
            throw new InputInconsistencyException("EMPTY_CELL", "cell " + cell.getCellId() + " has no members");
        }
        List<Integer> unknown = new ArrayList<>();
        for (int index : cell.getMemberIndices()) {
            if (index < 0 || index >= store.size()) {
                unknown.add(index);
            }
        }
        if (!unknown.isEmpty()) {
            throw new InputInconsistencyException("UNKNOWN_SAMPLE_INDEX",
                    "cell " + cell.getCellId() + " references samples outside the table of " + store.size(), unknown);
        }
    }
}
