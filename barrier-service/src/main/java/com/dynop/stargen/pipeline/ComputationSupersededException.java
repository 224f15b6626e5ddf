package com.dynop.stargen.pipeline;

/**
 * Thrown when a newer computation started before this one could publish its result.
 */
public class ComputationSupersededException extends RuntimeException {

    public ComputationSupersededException(String message) {
        super(message);
    }
}
