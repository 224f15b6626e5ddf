package com.dynop.stargen.grid;

import com.dynop.stargen.sample.Sample;
import com.dynop.stargen.sample.SampleStore;
import com.graphhopper.util.shapes.GHPoint;
import com.uber.h3core.AreaUnit;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import com.uber.h3core.util.LatLng;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Maps samples onto the H3 hexagonal grid and groups them into occupied cells per time bin.
 * 
 * <p>Cell assignment is a pure function of latitude, longitude and resolution.
 */
public final class HexIndexer {

    private static final Logger LOGGER = Logger.getLogger(HexIndexer.class.getName());

    public static final int MIN_RESOLUTION = 0;
    public static final int MAX_RESOLUTION = 15;

    private final H3Core h3;

    public HexIndexer(H3Core h3) {
        this.h3 = Objects.requireNonNull(h3, "h3");
    }

    /**
     * @return H3 address of the cell containing the point
     * @throws IllegalArgumentException if the resolution is outside {@code [0, 15]}
     */
    public String cellOf(double lat, double lon, int resolution) {
        requireResolution(resolution);
        return h3.latLngToCellAddress(lat, lon, resolution);
    }

    /**
     * Build the occupied cells of every time bin.
     * 
     * @param store      Sample table
     * @param binning    Bin assignment of every sample
     * @param resolution H3 resolution
     * @return One list per bin (same order as {@link TimeBinning#getBins()}), each sorted by cell id
     */
    public List<List<HexCell>> index(SampleStore store, TimeBinning binning, int resolution) {
        requireResolution(resolution);

        List<Map<String, List<Integer>>> membersByBin = new ArrayList<>(binning.binCount());
        for (int k = 0; k < binning.binCount(); k++) {
            membersByBin.add(new TreeMap<>());
        }
        for (int i = 0; i < store.size(); i++) {
            Sample sample = store.getSample(i);
            String cellId = h3.latLngToCellAddress(sample.getLat(), sample.getLon(), resolution);
            membersByBin.get(binning.binOf(i)).computeIfAbsent(cellId, k -> new ArrayList<>()).add(i);
        }

        List<List<HexCell>> cellsByBin = new ArrayList<>(binning.binCount());
        int total = 0;
        for (int k = 0; k < membersByBin.size(); k++) {
            List<HexCell> cells = new ArrayList<>(membersByBin.get(k).size());
            for (Map.Entry<String, List<Integer>> entry : membersByBin.get(k).entrySet()) {
                cells.add(createCell(entry.getKey(), k, entry.getValue()));
            }
            total += cells.size();
            cellsByBin.add(cells);
        }

        int finalTotal = total;
        LOGGER.fine(() -> String.format("Indexed %d samples into %d occupied cells at resolution %d",
                store.size(), finalTotal, resolution));
        return cellsByBin;
    }

    private HexCell createCell(String cellId, int binIndex, List<Integer> members) {
        LatLng center = h3.cellToLatLng(cellId);
        List<GHPoint> boundary = new ArrayList<>();
        for (LatLng vertex : h3.cellToBoundary(cellId)) {
            boundary.add(new GHPoint(vertex.lat, vertex.lng));
        }
        return new HexCell(cellId, binIndex, new GHPoint(center.lat, center.lng), members, boundary);
    }

    /**
     * Typical distance between the centers of two adjacent cells ({@code √3 × edge length}).
     */
    public double cellSpacingKm(int resolution) {
        requireResolution(resolution);
        return Math.sqrt(3) * h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.km);
    }

    /**
     * @return Grid statistics for the resolution
     */
    public HexGridInfo describe(int resolution) {
        requireResolution(resolution);
        return new HexGridInfo(
                resolution,
                h3.getNumCells(resolution),
                h3.getHexagonAreaAvg(resolution, AreaUnit.km2),
                h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.km));
    }

    private static void requireResolution(int resolution) {
        if (resolution < MIN_RESOLUTION || resolution > MAX_RESOLUTION) {
            throw new IllegalArgumentException("hex resolution must be within [" + MIN_RESOLUTION + ", "
                    + MAX_RESOLUTION + "] but was " + resolution);
        }
    }
}
