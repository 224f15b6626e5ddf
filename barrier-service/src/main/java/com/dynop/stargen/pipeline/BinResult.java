package com.dynop.stargen.pipeline;

import com.dynop.stargen.barrier.EdgeMetrics;
import com.dynop.stargen.graph.NeighborGraph;
import com.dynop.stargen.grid.HexCell;
import com.dynop.stargen.grid.TimeBin;

import java.util.List;

/**
 * Everything computed for one time bin.
 *
 * @param bin             The time bin
 * @param cells           Occupied cells, sorted by cell id
 * @param graphShape      Which neighbor graph variant produced the edges
 * @param edges           Scored edges
 * @param fitted          Whether a curve was fitted; false means every edge is neutral
 * @param componentCount  Connected components of the neighbor graph
 * @param isolatedCellIds Cells whose edges are all barriers
 */
public record BinResult(TimeBin bin,
                        List<HexCell> cells,
                        NeighborGraph.Shape graphShape,
                        List<EdgeMetrics> edges,
                        boolean fitted,
                        int componentCount,
                        List<String> isolatedCellIds) {

    public BinResult {
        cells = List.copyOf(cells);
        edges = List.copyOf(edges);
        isolatedCellIds = List.copyOf(isolatedCellIds);
    }
}
