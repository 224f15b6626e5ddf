package com.dynop.stargen.grid;

/**
 * Statistics of the H3 grid at one resolution, used to help pick a resolution.
 * 
 * @param resolution          H3 resolution
 * @param cellCount           Number of cells covering the globe
 * @param averageAreaKm2      Average cell area in km²
 * @param averageEdgeLengthKm Average cell edge length in km
 */
public record HexGridInfo(int resolution, long cellCount, double averageAreaKm2, double averageEdgeLengthKm) {
}
