package com.dynop.stargen.graph;

import com.dynop.stargen.grid.HexCell;
import com.graphhopper.util.shapes.GHPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dynop.stargen.graph.GraphFixtures.cell;
import static org.junit.jupiter.api.Assertions.*;

class NeighborEdgeTest {

    @Test
    void storesCellsInCanonicalOrder() {
        HexCell a = cell("831f8dfffffffff", 0, 0);
        HexCell b = cell("831f9afffffffff", 1, 1);

        NeighborEdge forward = NeighborEdge.of(a, b);
        NeighborEdge backward = NeighborEdge.of(b, a);

        assertEquals(forward, backward);
        assertEquals(forward.hashCode(), backward.hashCode());
        assertSame(a, backward.getCellA());
        assertTrue(forward.touches("831f9afffffffff"));
        assertFalse(forward.touches("831f00fffffffff"));
    }

    @Test
    void rejectsSelfEdge() {
        HexCell a = cell("a", 0, 0);

        assertThrows(IllegalArgumentException.class, () -> NeighborEdge.of(a, cell("a", 0, 0)));
    }

    @Test
    void rejectsCellsFromDifferentBins() {
        HexCell a = cell("a", 0, 0);
        HexCell b = new HexCell("b", 1, new GHPoint(1, 1), List.of(0), List.of());

        assertThrows(IllegalArgumentException.class, () -> NeighborEdge.of(a, b));
    }
}
