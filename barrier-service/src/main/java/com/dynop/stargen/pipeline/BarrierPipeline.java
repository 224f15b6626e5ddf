package com.dynop.stargen.pipeline;

import com.dynop.stargen.barrier.BarrierScorer;
import com.dynop.stargen.barrier.DistanceAggregator;
import com.dynop.stargen.barrier.EdgeMetrics;
import com.dynop.stargen.barrier.LoessCurveSmoother;
import com.dynop.stargen.graph.NeighborGraph;
import com.dynop.stargen.graph.NeighborGraphBuilder;
import com.dynop.stargen.grid.HexCell;
import com.dynop.stargen.grid.HexIndexer;
import com.dynop.stargen.grid.TimeBin;
import com.dynop.stargen.grid.TimeBinner;
import com.dynop.stargen.grid.TimeBinning;
import com.dynop.stargen.sample.SampleStore;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs binning, indexing, graph construction, aggregation and scoring for one request.
 * 
 * <p>Binning and indexing happen once; the remaining stages run as one task per time bin. Tasks
 * share nothing but the read-only {@link SampleStore}, so running them on the executor or one after
 * another gives the same result.
 */
public final class BarrierPipeline {

    private static final Logger LOGGER = Logger.getLogger(BarrierPipeline.class.getName());

    private final SampleStore store;
    private final HexIndexer indexer;
    private final TimeBinner binner;
    private final DistanceAggregator aggregator;
    @Nullable
    private final ExecutorService executorService;

    /**
     * @param store           Loaded samples and distances
     * @param indexer         H3 indexer
     * @param executorService Pool for per-bin tasks, or null to run bins on the calling thread
     */
    public BarrierPipeline(SampleStore store, HexIndexer indexer, @Nullable ExecutorService executorService) {
        this.store = Objects.requireNonNull(store, "store");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.binner = new TimeBinner();
        this.aggregator = new DistanceAggregator();
        this.executorService = executorService;
    }

    public PipelineResult run(PipelineRequest request) throws InterruptedException {
        return run(request, () -> false);
    }

    /**
     * @param request    Validated parameters
     * @param superseded Checked between stages; once it returns true the run is abandoned
     * @return Result with one entry per bin
     * @throws ComputationSupersededException if {@code superseded} fired
     * @throws com.dynop.stargen.sample.InputInconsistencyException if the inputs contradict each other
     * @throws InterruptedException if the calling thread was interrupted while waiting for bin tasks
     */
    public PipelineResult run(PipelineRequest request, BooleanSupplier superseded) throws InterruptedException {
        long start = System.nanoTime();
        TimeBinning binning = binner.bin(store, request.getBinCount(), request.getBinningMode());
        checkSuperseded(superseded);
        List<List<HexCell>> cellsByBin = indexer.index(store, binning, request.getHexResolution());
        checkSuperseded(superseded);

        NeighborGraphBuilder graphBuilder = request.getNeighborhoodRings() > 0
                ? new NeighborGraphBuilder(request.getNeighborhoodRings() * indexer.cellSpacingKm(request.getHexResolution()))
                : NeighborGraphBuilder.unlimited();
        BarrierScorer scorer = new BarrierScorer(
                new LoessCurveSmoother(request.getLowessBandwidth(), request.getRobustnessIterations()),
                request.getBarrierThreshold(), request.getCorridorThreshold());

        List<Callable<BinResult>> tasks = new ArrayList<>(binning.binCount());
        for (TimeBin bin : binning.getBins()) {
            List<HexCell> cells = cellsByBin.get(bin.getIndex());
            tasks.add(() -> computeBin(bin, cells, graphBuilder, scorer, superseded));
        }

        List<BinResult> bins = executorService == null ? runSequentially(tasks) : runOnExecutor(tasks);
        PipelineResult result = new PipelineResult(request, bins);
        LOGGER.fine(() -> String.format("Computed %d bins with %d edges in %d ms for %s", bins.size(),
                result.edgeCount(), (System.nanoTime() - start) / 1_000_000, request));
        return result;
    }

    private BinResult computeBin(TimeBin bin, List<HexCell> cells, NeighborGraphBuilder graphBuilder,
                                 BarrierScorer scorer, BooleanSupplier superseded) {
        NeighborGraph graph = graphBuilder.build(cells);
        checkSuperseded(superseded);
        List<EdgeMetrics> measured = aggregator.aggregate(graph.edges(), store);
        checkSuperseded(superseded);
        BarrierScorer.Scoring scoring = scorer.score(measured);

        LOGGER.fine(() -> String.format("Bin %d (%s): %d cells, %s, %d edges, fitted=%s", bin.getIndex(),
                bin.getLabel(), cells.size(), graph.shape(), measured.size(), scoring.fitted()));
        return new BinResult(bin, cells, graph.shape(), scoring.edges(), scoring.fitted(),
                graph.componentCount(), BarrierScorer.isolatedCells(scoring.edges()));
    }

    private static List<BinResult> runSequentially(List<Callable<BinResult>> tasks) {
        List<BinResult> results = new ArrayList<>(tasks.size());
        for (Callable<BinResult> task : tasks) {
            try {
                results.add(task.call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Bin computation failed: " + e.getMessage(), e);
            }
        }
        return results;
    }

    private List<BinResult> runOnExecutor(List<Callable<BinResult>> tasks) throws InterruptedException {
        List<Future<BinResult>> futures = executorService.invokeAll(tasks);
        List<BinResult> results = new ArrayList<>(futures.size());
        for (Future<BinResult> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                LOGGER.log(Level.WARNING, "Bin task failed", cause);
                throw new IllegalStateException("Bin computation failed: " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    private static void checkSuperseded(BooleanSupplier superseded) {
        if (superseded.getAsBoolean()) {
            throw new ComputationSupersededException("Computation abandoned, a newer request has started");
        }
    }
}
