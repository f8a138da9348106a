package org.mazebreak.routing.core;

/**
 * Public solve contract.
 *
 * <p>Implementations validate input deterministically and throw reason-coded runtime
 * exceptions for contract failures.</p>
 */
public interface MazeSolverService {
    /**
     * Shortest 1-based corner-to-corner step count with one wall converted.
     *
     * @param maze tile matrix, 0 = floor, 1 = wall.
     * @return step count.
     * @throws org.mazebreak.core.grid.InvalidMazeException when the maze is malformed.
     * @throws NoSolutionException when no single breach connects the corners.
     */
    int solve(int[][] maze);

    /**
     * Executes one solve request with per-call overrides.
     *
     * @param request solve request.
     * @return detailed solve response.
     */
    SolveResponse solve(SolveRequest request);
}
