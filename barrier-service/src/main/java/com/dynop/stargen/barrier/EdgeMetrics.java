package com.dynop.stargen.barrier;

import com.dynop.stargen.graph.NeighborEdge;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Distances of one neighbor edge plus its score once the bin has been fitted.
 * 
 * <p>Immutable; {@link #withScore} and {@link #withNormalizedGeneticDistance} return copies.
 */
public final class EdgeMetrics {

    private final NeighborEdge edge;
    private final double geoDistanceKm;
    private final double geneticDistance;
    private final double normalizedGeneticDistance;
    private final double scaledDistance;
    @Nullable
    private final EdgeClassification classification;

    public EdgeMetrics(NeighborEdge edge, double geoDistanceKm, double geneticDistance) {
        this(edge, geoDistanceKm, geneticDistance, 0.0, Double.NaN, null);
    }

    private EdgeMetrics(NeighborEdge edge, double geoDistanceKm, double geneticDistance,
                        double normalizedGeneticDistance, double scaledDistance,
                        @Nullable EdgeClassification classification) {
        this.edge = Objects.requireNonNull(edge, "edge");
        this.geoDistanceKm = geoDistanceKm;
        this.geneticDistance = geneticDistance;
        this.normalizedGeneticDistance = normalizedGeneticDistance;
        this.scaledDistance = scaledDistance;
        this.classification = classification;
    }

    public EdgeMetrics withNormalizedGeneticDistance(double normalized) {
        return new EdgeMetrics(edge, geoDistanceKm, geneticDistance, normalized, scaledDistance, classification);
    }

    public EdgeMetrics withScore(double scaled, EdgeClassification classification) {
        return new EdgeMetrics(edge, geoDistanceKm, geneticDistance, normalizedGeneticDistance, scaled,
                Objects.requireNonNull(classification, "classification"));
    }

    public NeighborEdge getEdge() {
        return edge;
    }

    /**
     * @return Great-circle distance between the two cell centers in kilometres
     */
    public double getGeoDistanceKm() {
        return geoDistanceKm;
    }

    /**
     * @return Mean genetic distance over all cross pairs of member samples
     */
    public double getGeneticDistance() {
        return geneticDistance;
    }

    /**
     * @return Genetic distance min-max normalized over the edges of the same bin
     */
    public double getNormalizedGeneticDistance() {
        return normalizedGeneticDistance;
    }

    /**
     * @return Genetic distance divided by the fitted expectation, NaN until scored
     */
    public double getScaledDistance() {
        return scaledDistance;
    }

    @Nullable
    public EdgeClassification getClassification() {
        return classification;
    }

    @Override
    public String toString() {
        return String.format("EdgeMetrics{%s, geo=%.3f km, genetic=%.6f, scaled=%.4f, %s}",
                edge, geoDistanceKm, geneticDistance, scaledDistance, classification);
    }
}
