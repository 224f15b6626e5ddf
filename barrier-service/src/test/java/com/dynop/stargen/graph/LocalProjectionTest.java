package com.dynop.stargen.graph;

import com.graphhopper.util.shapes.GHPoint;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalProjectionTest {

    @Test
    void preservesDistanceFromTheCenter() {
        LocalProjection projection = LocalProjection.centeredOn(List.of(new GHPoint(0, -10), new GHPoint(0, 10)));

        Coordinate east = projection.project(new GHPoint(0, 10));
        Coordinate north = projection.project(new GHPoint(10, 0));

        double expected = LocalProjection.EARTH_RADIUS_KM * Math.toRadians(10);
        assertEquals(expected, east.x, 1e-6);
        assertEquals(0, east.y, 1e-9);
        assertEquals(0, north.x, 1e-9);
        assertEquals(expected, north.y, 1e-6);
    }

    @Test
    void keepsPointsAcrossTheAntimeridianClose() {
        LocalProjection projection = LocalProjection.centeredOn(List.of(new GHPoint(0, 179), new GHPoint(0, -179)));

        Coordinate west = projection.project(new GHPoint(0, 179));
        Coordinate east = projection.project(new GHPoint(0, -179));

        assertEquals(2 * LocalProjection.EARTH_RADIUS_KM * Math.toRadians(1), west.distance(east), 1e-6);
    }

    @Test
    void centerProjectsToOrigin() {
        LocalProjection projection = LocalProjection.centeredOn(List.of(new GHPoint(45, 45)));

        Coordinate origin = projection.project(new GHPoint(45, 45));

        assertEquals(0, origin.x, 1e-9);
        assertEquals(0, origin.y, 1e-9);
    }
}
