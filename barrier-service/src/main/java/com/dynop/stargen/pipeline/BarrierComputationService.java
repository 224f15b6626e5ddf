package com.dynop.stargen.pipeline;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs pipeline requests and publishes the newest result for readers.
 * 
 * <p>Concurrent callers are allowed. A request that is overtaken by a newer one stops at its next
 * stage boundary and fails with {@link ComputationSupersededException}; it never replaces the
 * published result.
 */
public final class BarrierComputationService {

    private static final Logger LOGGER = Logger.getLogger(BarrierComputationService.class.getName());

    private final BarrierPipeline pipeline;
    private final ResultSlot slot;

    public BarrierComputationService(BarrierPipeline pipeline) {
        this(pipeline, new ResultSlot());
    }

    BarrierComputationService(BarrierPipeline pipeline, ResultSlot slot) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.slot = Objects.requireNonNull(slot, "slot");
    }

    /**
     * Compute and publish.
     * 
     * @throws ComputationSupersededException if a newer request started first
     * @throws InterruptedException if interrupted while waiting for bin tasks
     */
    public PipelineResult compute(PipelineRequest request) throws InterruptedException {
        long generation = slot.begin();
        PipelineResult result = pipeline.run(request, () -> !slot.isLatest(generation));
        if (!slot.publish(generation, result)) {
            throw new ComputationSupersededException("Computation " + generation + " finished after a newer request started");
        }
        LOGGER.fine(() -> "Published computation " + generation + ": " + request);
        return result;
    }

    /**
     * @return The most recently published result, if any
     */
    public Optional<PipelineResult> current() {
        return slot.current();
    }
}
