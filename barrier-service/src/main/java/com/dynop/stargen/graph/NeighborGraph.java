package com.dynop.stargen.graph;

import com.dynop.stargen.grid.HexCell;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Neighbor graph over the occupied cells of one time bin.
 * 
 * <p>Each variant records how the edges were obtained, so degenerate inputs never have to be pushed
 * through a general triangulation.
 */
public sealed interface NeighborGraph {

    enum Shape {
        NO_POINTS,
        SINGLE_POINT,
        TWO_POINTS,
        COLLINEAR_CHAIN,
        TRIANGULATED
    }

    Shape shape();

    List<HexCell> cells();

    /**
     * @return Edges without duplicates or self edges
     */
    List<NeighborEdge> edges();

    /**
     * Count connected components; every cell without edges is its own component.
     */
    default int componentCount() {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (HexCell cell : cells()) {
            adjacency.put(cell.getCellId(), new ArrayList<>());
        }
        for (NeighborEdge edge : edges()) {
            adjacency.get(edge.getCellA().getCellId()).add(edge.getCellB().getCellId());
            adjacency.get(edge.getCellB().getCellId()).add(edge.getCellA().getCellId());
        }

        Set<String> visited = new HashSet<>();
        int components = 0;
        for (HexCell cell : cells()) {
            if (!visited.add(cell.getCellId())) {
                continue;
            }
            components++;
            Deque<String> queue = new ArrayDeque<>();
            queue.add(cell.getCellId());
            while (!queue.isEmpty()) {
                for (String neighbor : adjacency.get(queue.poll())) {
                    if (visited.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
        }
        return components;
    }

    record NoPoints() implements NeighborGraph {
        @Override
        public Shape shape() {
            return Shape.NO_POINTS;
        }

        @Override
        public List<HexCell> cells() {
            return List.of();
        }

        @Override
        public List<NeighborEdge> edges() {
            return List.of();
        }
    }

    record SinglePoint(HexCell cell) implements NeighborGraph {
        @Override
        public Shape shape() {
            return Shape.SINGLE_POINT;
        }

        @Override
        public List<HexCell> cells() {
            return List.of(cell);
        }

        @Override
        public List<NeighborEdge> edges() {
            return List.of();
        }
    }

    /**
     * Two cells joined by one edge, unless the edge exceeded the neighborhood limit.
     */
    record TwoPoints(List<HexCell> cells, List<NeighborEdge> edges) implements NeighborGraph {
        public TwoPoints {
            cells = List.copyOf(cells);
            edges = List.copyOf(edges);
        }

        @Override
        public Shape shape() {
            return Shape.TWO_POINTS;
        }
    }

    /**
     * Centroids on a line, connected to their successors along it.
     */
    record CollinearChain(List<HexCell> cells, List<NeighborEdge> edges) implements NeighborGraph {
        public CollinearChain {
            cells = List.copyOf(cells);
            edges = List.copyOf(edges);
        }

        @Override
        public Shape shape() {
            return Shape.COLLINEAR_CHAIN;
        }
    }

    /**
     * Edges of the Delaunay triangulation of the projected centroids.
     */
    record Triangulated(List<HexCell> cells, List<NeighborEdge> edges) implements NeighborGraph {
        public Triangulated {
            cells = List.copyOf(cells);
            edges = List.copyOf(edges);
        }

        @Override
        public Shape shape() {
            return Shape.TRIANGULATED;
        }
    }
}
