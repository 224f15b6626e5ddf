package com.dynop.stargen.barrier;

/**
 * Outcome of comparing an edge's genetic distance with the distance expected at its geographic
 * separation.
 */
public enum EdgeClassification {
    NORMAL,
    /** Genetic distance well above the fitted curve. */
    BARRIER,
    /** Genetic distance well below the fitted curve. */
    CORRIDOR
}
