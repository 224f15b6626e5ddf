package com.dynop.stargen.pipeline;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the latest published result. Any number of readers, one successful writer per generation.
 * 
 * <p>Each computation takes a generation from {@link #begin()}. Only the most recently started
 * generation may publish, so a slow older computation can never overwrite a newer result.
 */
public final class ResultSlot {

    private final AtomicLong latestGeneration = new AtomicLong();
    @Nullable
    private volatile PipelineResult current;

    /**
     * @return Generation number of the computation that is starting
     */
    public long begin() {
        return latestGeneration.incrementAndGet();
    }

    /**
     * @return true while no newer computation has started
     */
    public boolean isLatest(long generation) {
        return latestGeneration.get() == generation;
    }

    /**
     * @return true if the result was stored, false if the generation is no longer the latest
     */
    public synchronized boolean publish(long generation, PipelineResult result) {
        if (!isLatest(generation)) {
            return false;
        }
        current = result;
        return true;
    }

    public Optional<PipelineResult> current() {
        return Optional.ofNullable(current);
    }
}
