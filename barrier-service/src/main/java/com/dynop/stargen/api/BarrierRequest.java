package com.dynop.stargen.api;

import com.dynop.stargen.grid.BinningMode;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Request payload for the barrier endpoint.
 * 
 * <p>Every field is optional; missing fields take the server defaults from the {@code stargen.defaults}
 * configuration section. Domain checks happen in {@link #toPipelineRequest}.
 */
public final class BarrierRequest {

    @Nullable
    private final Integer binCount;
    @Nullable
    private final Integer hexResolution;
    @Nullable
    private final Double lowessBandwidth;
    @Nullable
    private final Double barrierThreshold;
    @Nullable
    private final Double corridorThreshold;
    @Nullable
    private final BinningMode binning;
    @Nullable
    private final Integer robustnessIterations;
    @Nullable
    private final Integer neighborhoodRings;

    @JsonCreator
    public BarrierRequest(
            @JsonProperty("bin_count") @Nullable Integer binCount,
            @JsonProperty("hex_resolution") @Nullable Integer hexResolution,
            @JsonProperty("lowess_bandwidth") @Nullable Double lowessBandwidth,
            @JsonProperty("barrier_threshold") @Nullable Double barrierThreshold,
            @JsonProperty("corridor_threshold") @Nullable Double corridorThreshold,
            @JsonProperty("binning") @Nullable String binning,
            @JsonProperty("robustness_iterations") @Nullable Integer robustnessIterations,
            @JsonProperty("neighborhood_rings") @Nullable Integer neighborhoodRings) {
        this.binCount = binCount;
        this.hexResolution = hexResolution;
        this.lowessBandwidth = lowessBandwidth;
        this.barrierThreshold = barrierThreshold;
        this.corridorThreshold = corridorThreshold;
        this.binning = binning == null ? null : BinningMode.parse(binning);
        this.robustnessIterations = robustnessIterations;
        this.neighborhoodRings = neighborhoodRings;
    }

    /**
     * Shortcut for the two parameters a caller changes most often.
     */
    public BarrierRequest(@Nullable Integer binCount, @Nullable Integer hexResolution) {
        this(binCount, hexResolution, null, null, null, null, null, null);
    }

    /**
     * Fill unset fields from {@code defaults} and validate the combination.
     * 
     * @throws IllegalArgumentException if a value is outside its domain
     */
    public PipelineRequest toPipelineRequest(PipelineRequest defaults) {
        return new PipelineRequest(
                binCount != null ? binCount : defaults.getBinCount(),
                hexResolution != null ? hexResolution : defaults.getHexResolution(),
                lowessBandwidth != null ? lowessBandwidth : defaults.getLowessBandwidth(),
                barrierThreshold != null ? barrierThreshold : defaults.getBarrierThreshold(),
                corridorThreshold != null ? corridorThreshold : defaults.getCorridorThreshold(),
                binning != null ? binning : defaults.getBinningMode(),
                robustnessIterations != null ? robustnessIterations : defaults.getRobustnessIterations(),
                neighborhoodRings != null ? neighborhoodRings : defaults.getNeighborhoodRings());
    }

    @Nullable
    @JsonProperty("bin_count")
    public Integer getBinCount() {
        return binCount;
    }

    @Nullable
    @JsonProperty("hex_resolution")
    public Integer getHexResolution() {
        return hexResolution;
    }

    @Nullable
    @JsonProperty("lowess_bandwidth")
    public Double getLowessBandwidth() {
        return lowessBandwidth;
    }

    @Nullable
    @JsonProperty("barrier_threshold")
    public Double getBarrierThreshold() {
        return barrierThreshold;
    }

    @Nullable
    @JsonProperty("corridor_threshold")
    public Double getCorridorThreshold() {
        return corridorThreshold;
    }

    @Nullable
    @JsonProperty("binning")
    public BinningMode getBinning() {
        return binning;
    }

    @Nullable
    @JsonProperty("robustness_iterations")
    public Integer getRobustnessIterations() {
        return robustnessIterations;
    }

    @Nullable
    @JsonProperty("neighborhood_rings")
    public Integer getNeighborhoodRings() {
        return neighborhoodRings;
    }
}
