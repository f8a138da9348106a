package org.mazebreak.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * One solve call.
 */
@Value
@Builder
public class SolveRequest {
    /** Tile matrix, 0 = floor, 1 = wall. Copied by the solver. */
    int[][] maze;
    /** Optional override of {@link SolverConfig#getExecutionMode()}. */
    ExecutionMode executionMode;
    /** Optional override of {@link SolverConfig#getDirectPathPolicy()}. */
    DirectPathPolicy directPathPolicy;
}
