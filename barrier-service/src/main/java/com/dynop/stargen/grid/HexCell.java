package com.dynop.stargen.grid;

import com.graphhopper.util.shapes.GHPoint;

import java.util.List;
import java.util.Objects;

/**
 * An occupied H3 cell within one time bin.
 * 
 * <p>The centroid is the canonical center of the cell, not the mean of its members, so distances
 * between cells depend on the resolution only.
 */
public final class HexCell {

    private final String cellId;
    private final int binIndex;
    private final GHPoint centroid;
    private final List<Integer> memberIndices;
    private final List<GHPoint> boundary;

    /**
     * @param cellId        H3 address
     * @param binIndex      Time bin the members belong to
     * @param centroid      Cell center
     * @param memberIndices Sample row indices, ascending
     * @param boundary      Cell boundary vertices for drawing
     */
    public HexCell(String cellId, int binIndex, GHPoint centroid, List<Integer> memberIndices, List<GHPoint> boundary) {
        this.cellId = Objects.requireNonNull(cellId, "cellId");
        this.binIndex = binIndex;
        this.centroid = Objects.requireNonNull(centroid, "centroid");
        this.memberIndices = List.copyOf(memberIndices);
        this.boundary = List.copyOf(boundary);
    }

    public String getCellId() {
        return cellId;
    }

    public int getBinIndex() {
        return binIndex;
    }

    public GHPoint getCentroid() {
        return centroid;
    }

    public List<Integer> getMemberIndices() {
        return memberIndices;
    }

    public List<GHPoint> getBoundary() {
        return boundary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HexCell hexCell = (HexCell) o;
        return binIndex == hexCell.binIndex && cellId.equals(hexCell.cellId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellId, binIndex);
    }

    @Override
    public String toString() {
        return String.format("HexCell{cellId='%s', bin=%d, center=(%.4f, %.4f), members=%d}",
                cellId, binIndex, centroid.getLat(), centroid.getLon(), memberIndices.size());
    }
}
