package com.dynop.stargen.graph;

import com.dynop.stargen.grid.HexCell;
import com.graphhopper.util.shapes.GHPoint;

import java.util.List;

/**
 * Hand-made cells with arbitrary ids, so graph tests do not depend on the H3 grid.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static HexCell cell(String id, double lat, double lon, Integer... members) {
        return new HexCell(id, 0, new GHPoint(lat, lon), List.of(members), List.of());
    }

    public static HexCell cell(String id, double lat, double lon) {
        return cell(id, lat, lon, 0);
    }
}
