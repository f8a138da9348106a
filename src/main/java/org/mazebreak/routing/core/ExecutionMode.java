package org.mazebreak.routing.core;

/**
 * How the solver schedules its independent stages.
 */
public enum ExecutionMode {
    /** Both frontier runs and all wall probes on the calling thread. */
    SEQUENTIAL,
    /** Frontier runs as two pool tasks, wall probes as a parallel stream in the same pool. */
    PARALLEL
}
