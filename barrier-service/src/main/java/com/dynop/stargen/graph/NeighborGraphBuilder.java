package com.dynop.stargen.graph;

import com.dynop.stargen.grid.HexCell;
import com.graphhopper.util.DistanceCalcEarth;
import com.graphhopper.util.shapes.GHPoint;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Derives the neighbor graph of one time bin from the Delaunay triangulation of its cell centroids.
 * 
 * <p>Inputs with fewer than three cells, or with all centroids on a line, never reach the
 * triangulation and get a dedicated {@link NeighborGraph} variant instead.
 */
public final class NeighborGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(NeighborGraphBuilder.class.getName());

    static final double COLLINEAR_TOLERANCE = 1e-9;

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final double maxEdgeLengthKm;

    /**
     * @param maxEdgeLengthKm Edges between centroids farther apart than this are dropped;
     *                        {@link Double#POSITIVE_INFINITY} keeps every edge
     */
    public NeighborGraphBuilder(double maxEdgeLengthKm) {
        if (!(maxEdgeLengthKm > 0)) {
            throw new IllegalArgumentException("maxEdgeLengthKm must be positive, got " + maxEdgeLengthKm);
        }
        this.maxEdgeLengthKm = maxEdgeLengthKm;
    }

    public static NeighborGraphBuilder unlimited() {
        return new NeighborGraphBuilder(Double.POSITIVE_INFINITY);
    }

    public double getMaxEdgeLengthKm() {
        return maxEdgeLengthKm;
    }

    /**
     * @param cells Occupied cells of one bin, unique by cell id
     */
    public NeighborGraph build(List<HexCell> cells) {
        switch (cells.size()) {
            case 0:
                return new NeighborGraph.NoPoints();
            case 1:
                return new NeighborGraph.SinglePoint(cells.get(0));
            case 2:
                return new NeighborGraph.TwoPoints(cells, limit(List.of(NeighborEdge.of(cells.get(0), cells.get(1)))));
            default:
                break;
        }

        List<GHPoint> centroids = new ArrayList<>(cells.size());
        for (HexCell cell : cells) {
            centroids.add(cell.getCentroid());
        }
        LocalProjection projection = LocalProjection.centeredOn(centroids);
        List<Coordinate> projected = new ArrayList<>(cells.size());
        for (GHPoint centroid : centroids) {
            projected.add(projection.project(centroid));
        }

        if (isCollinear(projected)) {
            return new NeighborGraph.CollinearChain(cells, limit(chain(cells, projected)));
        }

        try {
            return new NeighborGraph.Triangulated(cells, limit(triangulate(cells, projected)));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Triangulation failed for " + cells.size()
                    + " cells, falling back to a chain: " + e.getMessage(), e);
            return new NeighborGraph.CollinearChain(cells, limit(chain(cells, projected)));
        }
    }

    /**
     * True when every point lies on the line through the first point and the point farthest from
     * it, within a tolerance relative to that line's squared length.
     */
    static boolean isCollinear(List<Coordinate> points) {
        Coordinate origin = points.get(0);
        Coordinate far = farthestFrom(origin, points);
        double dx = far.x - origin.x;
        double dy = far.y - origin.y;
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared == 0) {
            return true;
        }
        for (Coordinate p : points) {
            double cross = dx * (p.y - origin.y) - dy * (p.x - origin.x);
            if (Math.abs(cross) > COLLINEAR_TOLERANCE * lengthSquared) {
                return false;
            }
        }
        return true;
    }

    private static Coordinate farthestFrom(Coordinate origin, List<Coordinate> points) {
        Coordinate far = origin;
        double best = 0;
        for (Coordinate p : points) {
            double ddx = p.x - origin.x;
            double ddy = p.y - origin.y;
            double d = ddx * ddx + ddy * ddy;
            if (d > best) {
                best = d;
                far = p;
            }
        }
        return far;
    }

    /**
     * Connect consecutive cells ordered along the line from the first point to the farthest one.
     */
    private static List<NeighborEdge> chain(List<HexCell> cells, List<Coordinate> projected) {
        Coordinate origin = projected.get(0);
        Coordinate far = farthestFrom(origin, projected);
        double dx = far.x - origin.x;
        double dy = far.y - origin.y;

        List<Integer> order = new ArrayList<>(cells.size());
        double[] position = new double[cells.size()];
        for (int i = 0; i < cells.size(); i++) {
            Coordinate p = projected.get(i);
            position[i] = dx * (p.x - origin.x) + dy * (p.y - origin.y);
            order.add(i);
        }
        order.sort(Comparator.<Integer>comparingDouble(i -> position[i])
                .thenComparing(i -> cells.get(i).getCellId()));

        List<NeighborEdge> edges = new ArrayList<>(cells.size() - 1);
        for (int k = 1; k < order.size(); k++) {
            edges.add(NeighborEdge.of(cells.get(order.get(k - 1)), cells.get(order.get(k))));
        }
        return edges;
    }

    private static List<NeighborEdge> triangulate(List<HexCell> cells, List<Coordinate> projected) {
        Map<Coordinate, Integer> cellByCoordinate = new HashMap<>();
        for (int i = 0; i < projected.size(); i++) {
            cellByCoordinate.putIfAbsent(projected.get(i), i);
        }

        DelaunayTriangulationBuilder builder = new DelaunayTriangulationBuilder();
        builder.setSites(projected);
        Geometry lines = builder.getEdges(GEOMETRY_FACTORY);

        Set<NeighborEdge> edges = new LinkedHashSet<>();
        for (int g = 0; g < lines.getNumGeometries(); g++) {
            Coordinate[] ends = lines.getGeometryN(g).getCoordinates();
            Integer a = cellByCoordinate.get(ends[0]);
            Integer b = cellByCoordinate.get(ends[ends.length - 1]);
            if (a == null || b == null) {
                LOGGER.fine(() -> "Skipping triangulation edge with unknown vertex " + ends[0] + " - " + ends[ends.length - 1]);
                continue;
            }
            if (a.equals(b)) {
                continue;
            }
            edges.add(NeighborEdge.of(cells.get(a), cells.get(b)));
        }
        List<NeighborEdge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparing((NeighborEdge e) -> e.getCellA().getCellId())
                .thenComparing(e -> e.getCellB().getCellId()));
        return sorted;
    }

    private List<NeighborEdge> limit(List<NeighborEdge> edges) {
        if (Double.isInfinite(maxEdgeLengthKm)) {
            return edges;
        }
        List<NeighborEdge> kept = new ArrayList<>(edges.size());
        for (NeighborEdge edge : edges) {
            if (centroidDistanceKm(edge) <= maxEdgeLengthKm) {
                kept.add(edge);
            }
        }
        if (kept.size() < edges.size()) {
            LOGGER.fine(() -> (edges.size() - kept.size()) + " edges longer than " + maxEdgeLengthKm + " km dropped");
        }
        return kept;
    }

    static double centroidDistanceKm(NeighborEdge edge) {
        GHPoint a = edge.getCellA().getCentroid();
        GHPoint b = edge.getCellB().getCentroid();
        return DistanceCalcEarth.DIST_EARTH.calcDist(a.getLat(), a.getLon(), b.getLat(), b.getLon()) / 1000.0;
    }
}
