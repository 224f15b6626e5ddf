package com.dynop.stargen.graph;

import com.dynop.stargen.grid.HexCell;

import java.util.Objects;

/**
 * Unordered pair of adjacent cells within one time bin.
 * 
 * <p>Stored canonically: {@code cellA} always has the smaller cell id, so {@code (a, b)} and
 * {@code (b, a)} produce equal edges.
 */
public final class NeighborEdge {

    private final HexCell cellA;
    private final HexCell cellB;

    private NeighborEdge(HexCell cellA, HexCell cellB) {
        this.cellA = cellA;
        this.cellB = cellB;
    }

    /**
     * @throws IllegalArgumentException for a self edge or cells from different bins
     */
    public static NeighborEdge of(HexCell first, HexCell second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.getBinIndex() != second.getBinIndex()) {
            throw new IllegalArgumentException("Edge endpoints belong to different time bins: " + first + ", " + second);
        }
        int order = first.getCellId().compareTo(second.getCellId());
        if (order == 0) {
            throw new IllegalArgumentException("Self edge on cell " + first.getCellId());
        }
        return order < 0 ? new NeighborEdge(first, second) : new NeighborEdge(second, first);
    }

    public HexCell getCellA() {
        return cellA;
    }

    public HexCell getCellB() {
        return cellB;
    }

    /**
     * @return true if the cell is one of the endpoints
     */
    public boolean touches(String cellId) {
        return cellA.getCellId().equals(cellId) || cellB.getCellId().equals(cellId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NeighborEdge that = (NeighborEdge) o;
        return cellA.equals(that.cellA) && cellB.equals(that.cellB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellA, cellB);
    }

    @Override
    public String toString() {
        return cellA.getCellId() + "-" + cellB.getCellId();
    }
}
