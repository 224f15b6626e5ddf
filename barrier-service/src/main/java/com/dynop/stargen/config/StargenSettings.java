package com.dynop.stargen.config;

import com.dynop.stargen.grid.BinningMode;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code stargen:} section of the server configuration.
 * 
 * <pre>
 * stargen:
 *   samples_file: data/samples.tsv
 *   distance_matrix_file: data/distances.tsv
 *   executor_pool_size: 4
 *   defaults:
 *     bin_count: 14
 *     hex_resolution: 3
 * </pre>
 */
public class StargenSettings {

    @Nullable
    private String samplesFile;
    @Nullable
    private String distanceMatrixFile;
    private int executorPoolSize;
    private Defaults defaults = new Defaults();

    @Nullable
    @JsonProperty("samples_file")
    public String getSamplesFile() {
        return samplesFile;
    }

    @JsonProperty("samples_file")
    public void setSamplesFile(@Nullable String samplesFile) {
        this.samplesFile = samplesFile;
    }

    @Nullable
    @JsonProperty("distance_matrix_file")
    public String getDistanceMatrixFile() {
        return distanceMatrixFile;
    }

    @JsonProperty("distance_matrix_file")
    public void setDistanceMatrixFile(@Nullable String distanceMatrixFile) {
        this.distanceMatrixFile = distanceMatrixFile;
    }

    /**
     * @return Worker threads for per-bin tasks; 0 or less means one per available processor
     */
    @JsonProperty("executor_pool_size")
    public int getExecutorPoolSize() {
        return executorPoolSize;
    }

    @JsonProperty("executor_pool_size")
    public void setExecutorPoolSize(int executorPoolSize) {
        this.executorPoolSize = executorPoolSize;
    }

    @JsonProperty("defaults")
    public Defaults getDefaults() {
        return defaults;
    }

    @JsonProperty("defaults")
    public void setDefaults(Defaults defaults) {
        this.defaults = defaults == null ? new Defaults() : defaults;
    }

    /**
     * Parameter values used for every field a request leaves out.
     */
    public static class Defaults {

        @JsonProperty("bin_count")
        private int binCount = 14;
        @JsonProperty("hex_resolution")
        private int hexResolution = 3;
        @JsonProperty("lowess_bandwidth")
        private double lowessBandwidth = 0.66;
        @JsonProperty("barrier_threshold")
        private double barrierThreshold = 1.5;
        @JsonProperty("corridor_threshold")
        private double corridorThreshold = 0.5;
        @JsonProperty("binning")
        private String binning = "equal_width";
        @JsonProperty("robustness_iterations")
        private int robustnessIterations = 3;
        @JsonProperty("neighborhood_rings")
        private int neighborhoodRings = 0;

        /**
         * @throws IllegalArgumentException if a configured default is outside its domain
         */
        public PipelineRequest toPipelineRequest() {
            return new PipelineRequest(binCount, hexResolution, lowessBandwidth, barrierThreshold,
                    corridorThreshold, BinningMode.parse(binning), robustnessIterations, neighborhoodRings);
        }
    }
}
