package com.dynop.stargen.pipeline;

import com.dynop.stargen.grid.BinningMode;
import com.dynop.stargen.grid.HexIndexer;

import java.util.Objects;

/**
 * Immutable parameters of one barrier computation.
 * 
 * <p>All values are validated on construction, so an instance that exists is always runnable.
 *
 * @see BarrierPipeline#run
 */
public final class PipelineRequest {

    static final int MAX_BIN_COUNT = 10_000;

    private final int binCount;
    private final int hexResolution;
    private final double lowessBandwidth;
    private final double barrierThreshold;
    private final double corridorThreshold;
    private final BinningMode binningMode;
    private final int robustnessIterations;
    private final int neighborhoodRings;

    /**
     * @param binCount             Number of time bins, {@code >= 1}
     * @param hexResolution        H3 resolution, {@code [0, 15]}
     * @param lowessBandwidth      Fraction of points in each local fit, {@code (0, 1]}
     * @param barrierThreshold     Scaled distance marking a barrier, {@code > 1}
     * @param corridorThreshold    Scaled distance marking a corridor, {@code (0, 1)}
     * @param binningMode          How ages are split into bins
     * @param robustnessIterations Outlier reweighting passes of the fit, {@code >= 0}
     * @param neighborhoodRings    Maximum edge length in cell spacings, 0 for unlimited
     * @throws IllegalArgumentException if any value is outside its domain
     */
    public PipelineRequest(int binCount, int hexResolution, double lowessBandwidth, double barrierThreshold,
                           double corridorThreshold, BinningMode binningMode, int robustnessIterations,
                           int neighborhoodRings) {
        if (binCount < 1 || binCount > MAX_BIN_COUNT) {
            throw new IllegalArgumentException("bin_count must be between 1 and " + MAX_BIN_COUNT + ", got " + binCount);
        }
        if (hexResolution < HexIndexer.MIN_RESOLUTION || hexResolution > HexIndexer.MAX_RESOLUTION) {
            throw new IllegalArgumentException("hex_resolution must be between " + HexIndexer.MIN_RESOLUTION
                    + " and " + HexIndexer.MAX_RESOLUTION + ", got " + hexResolution);
        }
        if (!(lowessBandwidth > 0 && lowessBandwidth <= 1)) {
            throw new IllegalArgumentException("lowess_bandwidth must be in (0, 1], got " + lowessBandwidth);
        }
        if (!(barrierThreshold > 1) || Double.isInfinite(barrierThreshold)) {
            throw new IllegalArgumentException("barrier_threshold must be a finite value > 1, got " + barrierThreshold);
        }
        if (!(corridorThreshold > 0 && corridorThreshold < 1)) {
            throw new IllegalArgumentException("corridor_threshold must be in (0, 1), got " + corridorThreshold);
        }
        if (robustnessIterations < 0) {
            throw new IllegalArgumentException("robustness_iterations must be >= 0, got " + robustnessIterations);
        }
        if (neighborhoodRings < 0) {
            throw new IllegalArgumentException("neighborhood_rings must be >= 0, got " + neighborhoodRings);
        }
        this.binCount = binCount;
        this.hexResolution = hexResolution;
        this.lowessBandwidth = lowessBandwidth;
        this.barrierThreshold = barrierThreshold;
        this.corridorThreshold = corridorThreshold;
        this.binningMode = Objects.requireNonNull(binningMode, "binningMode");
        this.robustnessIterations = robustnessIterations;
        this.neighborhoodRings = neighborhoodRings;
    }

    public int getBinCount() {
        return binCount;
    }

    public int getHexResolution() {
        return hexResolution;
    }

    public double getLowessBandwidth() {
        return lowessBandwidth;
    }

    public double getBarrierThreshold() {
        return barrierThreshold;
    }

    public double getCorridorThreshold() {
        return corridorThreshold;
    }

    public BinningMode getBinningMode() {
        return binningMode;
    }

    public int getRobustnessIterations() {
        return robustnessIterations;
    }

    /**
     * @return Maximum edge length in cell spacings, 0 when edges are not limited
     */
    public int getNeighborhoodRings() {
        return neighborhoodRings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineRequest that = (PipelineRequest) o;
        return binCount == that.binCount
                && hexResolution == that.hexResolution
                && Double.compare(lowessBandwidth, that.lowessBandwidth) == 0
                && Double.compare(barrierThreshold, that.barrierThreshold) == 0
                && Double.compare(corridorThreshold, that.corridorThreshold) == 0
                && binningMode == that.binningMode
                && robustnessIterations == that.robustnessIterations
                && neighborhoodRings == that.neighborhoodRings;
    }

    @Override
    public int hashCode() {
        return Objects.hash(binCount, hexResolution, lowessBandwidth, barrierThreshold, corridorThreshold,
                binningMode, robustnessIterations, neighborhoodRings);
    }

    @Override
    public String toString() {
        return "PipelineRequest{bins=" + binCount + ", resolution=" + hexResolution + ", bandwidth=" + lowessBandwidth
                + ", barrier=" + barrierThreshold + ", corridor=" + corridorThreshold + ", binning=" + binningMode
                + ", robustness=" + robustnessIterations + ", rings=" + neighborhoodRings + "}";
    }
}
