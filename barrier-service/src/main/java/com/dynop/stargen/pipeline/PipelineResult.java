package com.dynop.stargen.pipeline;

import java.util.List;

/**
 * Complete output of one computation, one entry per time bin in bin order.
 */
public record PipelineResult(PipelineRequest request, List<BinResult> bins) {

    public PipelineResult {
        bins = List.copyOf(bins);
    }

    public int edgeCount() {
        return bins.stream().mapToInt(b -> b.edges().size()).sum();
    }
}
