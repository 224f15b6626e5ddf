package com.dynop.stargen.api;

import com.dynop.stargen.barrier.EdgeClassification;
import com.dynop.stargen.barrier.EdgeMetrics;
import com.dynop.stargen.graph.NeighborGraph;
import com.dynop.stargen.grid.HexCell;
import com.dynop.stargen.pipeline.BinResult;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.dynop.stargen.pipeline.PipelineResult;
import com.dynop.stargen.sample.SampleStore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.graphhopper.util.shapes.GHPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable DTO handed to the rendering layer: per time bin, the occupied cells to draw and the
 * classified edges between them.
 */
public final class BarrierResponse {

    private final Parameters parameters;
    private final List<Bin> bins;

    public BarrierResponse(Parameters parameters, List<Bin> bins) {
        this.parameters = parameters;
        this.bins = Collections.unmodifiableList(bins);
    }

    public static BarrierResponse from(PipelineResult result, SampleStore store) {
        List<Bin> bins = new ArrayList<>(result.bins().size());
        for (BinResult bin : result.bins()) {
            bins.add(Bin.from(bin, store));
        }
        return new BarrierResponse(Parameters.from(result.request()), bins);
    }

    @JsonProperty("parameters")
    public Parameters getParameters() {
        return parameters;
    }

    @JsonProperty("bins")
    public List<Bin> getBins() {
        return bins;
    }

    /**
     * @return Total number of edges over all bins
     */
    public int edgeCount() {
        return bins.stream().mapToInt(b -> b.getEdges().size()).sum();
    }

    /**
     * Effective parameters after defaults were applied.
     */
    public record Parameters(
            @JsonProperty("bin_count") int binCount,
            @JsonProperty("hex_resolution") int hexResolution,
            @JsonProperty("lowess_bandwidth") double lowessBandwidth,
            @JsonProperty("barrier_threshold") double barrierThreshold,
            @JsonProperty("corridor_threshold") double corridorThreshold,
            @JsonProperty("binning") String binning,
            @JsonProperty("robustness_iterations") int robustnessIterations,
            @JsonProperty("neighborhood_rings") int neighborhoodRings) {

        static Parameters from(PipelineRequest request) {
            return new Parameters(request.getBinCount(), request.getHexResolution(), request.getLowessBandwidth(),
                    request.getBarrierThreshold(), request.getCorridorThreshold(),
                    request.getBinningMode().name().toLowerCase(), request.getRobustnessIterations(),
                    request.getNeighborhoodRings());
        }
    }

    public static final class Bin {
        private final int index;
        private final String label;
        private final double ageMin;
        private final double ageMax;
        private final int sampleCount;
        private final NeighborGraph.Shape graphShape;
        private final boolean fitted;
        private final int components;
        private final List<String> isolatedCells;
        private final List<Cell> cells;
        private final List<Edge> edges;

        public Bin(int index, String label, double ageMin, double ageMax, int sampleCount,
                   NeighborGraph.Shape graphShape, boolean fitted, int components, List<String> isolatedCells,
                   List<Cell> cells, List<Edge> edges) {
            this.index = index;
            this.label = label;
            this.ageMin = ageMin;
            this.ageMax = ageMax;
            this.sampleCount = sampleCount;
            this.graphShape = graphShape;
            this.fitted = fitted;
            this.components = components;
            this.isolatedCells = Collections.unmodifiableList(isolatedCells);
            this.cells = Collections.unmodifiableList(cells);
            this.edges = Collections.unmodifiableList(edges);
        }

        static Bin from(BinResult result, SampleStore store) {
            List<Cell> cells = new ArrayList<>(result.cells().size());
            for (HexCell cell : result.cells()) {
                cells.add(Cell.from(cell, store));
            }
            List<Edge> edges = new ArrayList<>(result.edges().size());
            for (EdgeMetrics metrics : result.edges()) {
                edges.add(Edge.from(metrics));
            }
            return new Bin(result.bin().getIndex(), result.bin().getLabel(), result.bin().getAgeMin(),
                    result.bin().getAgeMax(), result.bin().getMemberIndices().size(), result.graphShape(),
                    result.fitted(), result.componentCount(), result.isolatedCellIds(), cells, edges);
        }

        @JsonProperty("index")
        public int getIndex() {
            return index;
        }

        /**
         * @return Calendar range, e.g. {@code "3050 BC - 2050 BC"}
         */
        @JsonProperty("label")
        public String getLabel() {
            return label;
        }

        @JsonProperty("age_min")
        public double getAgeMin() {
            return ageMin;
        }

        @JsonProperty("age_max")
        public double getAgeMax() {
            return ageMax;
        }

        @JsonProperty("sample_count")
        public int getSampleCount() {
            return sampleCount;
        }

        @JsonProperty("graph_shape")
        public NeighborGraph.Shape getGraphShape() {
            return graphShape;
        }

        /**
         * @return false when the bin had too few distinct distances for a curve
         */
        @JsonProperty("fitted")
        public boolean isFitted() {
            return fitted;
        }

        @JsonProperty("components")
        public int getComponents() {
            return components;
        }

        @JsonProperty("isolated_cells")
        public List<String> getIsolatedCells() {
            return isolatedCells;
        }

        @JsonProperty("cells")
        public List<Cell> getCells() {
            return cells;
        }

        @JsonProperty("edges")
        public List<Edge> getEdges() {
            return edges;
        }
    }

    /**
     * @param cellId    H3 address
     * @param lat       Cell center latitude
     * @param lon       Cell center longitude
     * @param sampleIds Ids of the member samples
     * @param boundary  Boundary vertices as {@code [lat, lon]} pairs
     */
    public record Cell(
            @JsonProperty("cell_id") String cellId,
            @JsonProperty("lat") double lat,
            @JsonProperty("lon") double lon,
            @JsonProperty("sample_ids") List<String> sampleIds,
            @JsonProperty("boundary") List<double[]> boundary) {

        static Cell from(HexCell cell, SampleStore store) {
            List<String> ids = new ArrayList<>(cell.getMemberIndices().size());
            for (int index : cell.getMemberIndices()) {
                ids.add(store.getSample(index).getId());
            }
            List<double[]> boundary = new ArrayList<>(cell.getBoundary().size());
            for (GHPoint vertex : cell.getBoundary()) {
                boundary.add(new double[]{vertex.getLat(), vertex.getLon()});
            }
            return new Cell(cell.getCellId(), cell.getCentroid().getLat(), cell.getCentroid().getLon(),
                    List.copyOf(ids), Collections.unmodifiableList(boundary));
        }
    }

    public record Edge(
            @JsonProperty("cell_a") String cellA,
            @JsonProperty("cell_b") String cellB,
            @JsonProperty("geo_distance_km") double geoDistanceKm,
            @JsonProperty("genetic_distance") double geneticDistance,
            @JsonProperty("normalized_genetic_distance") double normalizedGeneticDistance,
            @JsonProperty("scaled_distance") double scaledDistance,
            @JsonProperty("classification") EdgeClassification classification) {

        static Edge from(EdgeMetrics metrics) {
            return new Edge(metrics.getEdge().getCellA().getCellId(), metrics.getEdge().getCellB().getCellId(),
                    metrics.getGeoDistanceKm(), metrics.getGeneticDistance(),
                    metrics.getNormalizedGeneticDistance(), metrics.getScaledDistance(), metrics.getClassification());
        }
    }
}
