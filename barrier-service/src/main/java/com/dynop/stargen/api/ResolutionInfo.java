package com.dynop.stargen.api;

import com.dynop.stargen.grid.HexGridInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the resolution table shown next to the resolution control.
 */
public record ResolutionInfo(
        @JsonProperty("resolution") int resolution,
        @JsonProperty("cell_count") long cellCount,
        @JsonProperty("average_area_km2") double averageAreaKm2,
        @JsonProperty("average_edge_length_km") double averageEdgeLengthKm) {

    static ResolutionInfo from(HexGridInfo info) {
        return new ResolutionInfo(info.resolution(), info.cellCount(), info.averageAreaKm2(), info.averageEdgeLengthKm());
    }
}
