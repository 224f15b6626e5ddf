package com.dynop.stargen.barrier;

import com.dynop.stargen.graph.NeighborEdge;
import com.dynop.stargen.grid.HexCell;
import com.dynop.stargen.sample.DistanceMatrix;
import com.dynop.stargen.sample.InputInconsistencyException;
import com.dynop.stargen.sample.SampleFixtures;
import com.dynop.stargen.sample.SampleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dynop.stargen.graph.GraphFixtures.cell;
import static org.junit.jupiter.api.Assertions.*;

class DistanceAggregatorTest {

    private final DistanceAggregator aggregator = new DistanceAggregator();
    private SampleStore store;

    @BeforeEach
    void setUp() {
        double[][] rows = {
                {0.0, 0.1, 0.2, 0.4, 0.9},
                {0.1, 0.0, 0.6, 0.8, 0.9},
                {0.2, 0.6, 0.0, 0.3, 0.9},
                {0.4, 0.8, 0.3, 0.0, 0.9},
                {0.9, 0.9, 0.9, 0.9, 0.0}
        };
        store = new SampleStore(SampleFixtures.samples(
                new double[]{0, 0, 100}, new double[]{0, 0, 100}, new double[]{0, 1, 100},
                new double[]{0, 1, 100}, new double[]{5, 5, 100}), DistanceMatrix.of(rows));
    }

    @Test
    void geneticDistanceIsTheMeanOverAllCrossPairs() {
        HexCell a = cell("a", 0, 0, 0, 1);
        HexCell b = cell("b", 0, 1, 2, 3);

        double distance = aggregator.geneticDistance(NeighborEdge.of(a, b), store);

        assertEquals((0.2 + 0.4 + 0.6 + 0.8) / 4, distance, 1e-15);
    }

    @Test
    void swappingCellsGivesIdenticalResult() {
        HexCell a = cell("a", 0, 0, 0, 1);
        HexCell b = cell("b", 0, 1, 2, 3, 4);

        double forward = aggregator.geneticDistance(NeighborEdge.of(a, b), store);
        double backward = aggregator.geneticDistance(NeighborEdge.of(b, a), store);

        assertEquals(forward, backward, 0.0);
    }

    @Test
    void geoDistanceIsGreatCircleBetweenCentroids() {
        NeighborEdge edge = NeighborEdge.of(cell("a", 0, 0), cell("b", 0, 1));

        assertEquals(6371.0 * Math.toRadians(1), aggregator.geoDistanceKm(edge), 1e-6);
    }

    @Test
    void emptyCellIsAnInputInconsistency() {
        HexCell occupied = cell("a", 0, 0);
        HexCell empty = new HexCell("b", 0, occupied.getCentroid(), List.of(), List.of());

        InputInconsistencyException ex = assertThrows(InputInconsistencyException.class,
                () -> aggregator.aggregate(List.of(NeighborEdge.of(occupied, empty)), store));

        assertEquals("EMPTY_CELL", ex.getErrorCode());
    }

    @Test
    void unknownMemberIsReportedWithItsIndex() {
        NeighborEdge edge = NeighborEdge.of(cell("a", 0, 0, 0), cell("b", 0, 1, 2, 9));

        InputInconsistencyException ex = assertThrows(InputInconsistencyException.class,
                () -> aggregator.aggregate(List.of(edge), store));

        assertEquals("UNKNOWN_SAMPLE_INDEX", ex.getErrorCode());
        assertEquals(List.of(9), ex.getIndices());
    }

    @Test
    void normalizesGeneticDistanceWithinTheBin() {
        HexCell a = cell("a", 0, 0, 0);
        HexCell b = cell("b", 0, 1, 2);
        HexCell c = cell("c", 0, 2, 3);
        HexCell d = cell("d", 5, 5, 4);

        List<EdgeMetrics> metrics = aggregator.aggregate(List.of(
                NeighborEdge.of(a, b), NeighborEdge.of(b, c), NeighborEdge.of(a, c), NeighborEdge.of(c, d)), store);

        assertEquals(4, metrics.size());
        assertEquals((0.2 - 0.2) / 0.7, metrics.get(0).getNormalizedGeneticDistance(), 1e-12);
        assertEquals((0.3 - 0.2) / 0.7, metrics.get(1).getNormalizedGeneticDistance(), 1e-12);
        assertEquals((0.4 - 0.2) / 0.7, metrics.get(2).getNormalizedGeneticDistance(), 1e-12);
        assertEquals(1.0, metrics.get(3).getNormalizedGeneticDistance(), 1e-12);
        assertNull(metrics.get(0).getClassification());
        assertTrue(Double.isNaN(metrics.get(0).getScaledDistance()));
    }

    @Test
    void equalDistancesNormalizeToZero() {
        SampleStore uniform = SampleFixtures.uniformStore(0.7,
                new double[]{0, 0, 1}, new double[]{0, 1, 1}, new double[]{1, 0, 1});
        HexCell a = cell("a", 0, 0, 0);
        HexCell b = cell("b", 0, 1, 1);
        HexCell c = cell("c", 1, 0, 2);

        List<EdgeMetrics> metrics = aggregator.aggregate(List.of(NeighborEdge.of(a, b), NeighborEdge.of(a, c)), uniform);

        assertEquals(0.0, metrics.get(0).getNormalizedGeneticDistance());
        assertEquals(0.0, metrics.get(1).getNormalizedGeneticDistance());
    }

    @Test
    void noEdgesGiveNoMetrics() {
        assertTrue(aggregator.aggregate(List.of(), store).isEmpty());
    }
}
