package org.mazebreak.routing.core;

import lombok.Getter;

/**
 * Raised when no single wall breach connects the two corners.
 *
 * <p>This is an expected outcome for some mazes; callers decide how to present it.</p>
 */
@Getter
public final class NoSolutionException extends SolverException {
    public static final String REASON_NO_BREACH_SOLUTION = "NO_BREACH_SOLUTION";

    /** Number of wall tiles probed before giving up. */
    private final int wallTilesEvaluated;

    public NoSolutionException(int wallTilesEvaluated, String message) {
        super(REASON_NO_BREACH_SOLUTION, message);
        this.wallTilesEvaluated = wallTilesEvaluated;
    }
}
