package org.mazebreak.routing.core;

import lombok.Builder;
import lombok.Value;
import org.mazebreak.core.grid.Position;

/**
 * Result of a successful solve.
 *
 * <p>When {@code breachUsed=false}, {@code breachPosition} is null.</p>
 */
@Value
@Builder
public class SolveResponse {
    /** 1-based step count from top-left to bottom-right (both corners counted). */
    int steps;
    /** Whether the answer routes through a converted wall tile. */
    boolean breachUsed;
    /** Converted wall tile, row-major first among equally short answers. */
    Position breachPosition;
    /** Number of wall tiles probed. */
    int wallTilesEvaluated;
    /** Tiles reached from the top-left corner, corner included. */
    int startReachable;
    /** Tiles reached from the bottom-right corner, corner included. */
    int endReachable;
    /** Scheduling actually used. */
    ExecutionMode executionMode;
    /** Direct-path policy actually applied. */
    DirectPathPolicy directPathPolicy;
}
