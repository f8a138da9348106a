package org.mazebreak.routing.core;

import lombok.Builder;
import org.mazebreak.core.grid.Grid;
import org.mazebreak.core.grid.Position;
import org.mazebreak.routing.breach.BreachCandidate;
import org.mazebreak.routing.breach.BreachEvaluator;
import org.mazebreak.routing.search.DistanceMap;
import org.mazebreak.routing.search.FrontierEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

/**
 * Main solve entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Check the grid budget against the declared shape, then validate the maze into a {@link Grid}.</li>
 * <li>Short-circuit the single floor tile maze (1 step, no breach).</li>
 * <li>Run the {@link FrontierEngine} from the top-left and bottom-right corners.</li>
 * <li>Probe every wall tile with the {@link BreachEvaluator} and keep the best candidate.</li>
 * <li>Optionally let the floor-only route compete, per {@link DirectPathPolicy}.</li>
 * </ul>
 *
 * <p>The solver keeps no per-call state. A fork-join pool is created on the first
 * {@link ExecutionMode#PARALLEL} call and released by {@link #close()}.</p>
 */
public final class BreachSolver implements MazeSolverService, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BreachSolver.class);

    private static final int SINGLE_TILE_STEPS = 1;

    private final SolverConfig config;
    private final SolverBudget budget;
    private final Object poolLock = new Object();
    private ForkJoinPool pool;
    private boolean closed;

    /**
     * Creates a solver configured from system properties.
     */
    public BreachSolver() {
        this(null);
    }

    /**
     * Creates a solver with explicit configuration.
     *
     * @param config solver defaults; {@code null} loads {@link SolverConfig#defaults()}.
     */
    @Builder
    public BreachSolver(SolverConfig config) {
        this.config = config == null ? SolverConfig.defaults() : config;
        this.budget = SolverBudget.of(this.config.getMaxGridCells());
    }

    @Override
    public int solve(int[][] maze) {
        return solve(SolveRequest.builder().maze(maze).build()).getSteps();
    }

    @Override
    public SolveResponse solve(SolveRequest request) {
        if (request == null) {
            throw new SolverException(SolverException.REASON_SOLVE_REQUEST_REQUIRED, "solve request must be non-null");
        }
        int[][] maze = request.getMaze();
        try {
            budget.checkGridCells(declaredCellCount(maze));
        } catch (SolverBudget.BudgetExceededException ex) {
            throw new SolverException(
                    SolverException.REASON_GRID_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
        Grid grid = Grid.of(maze);

        ExecutionMode mode = request.getExecutionMode() != null ? request.getExecutionMode() : config.getExecutionMode();
        DirectPathPolicy policy = request.getDirectPathPolicy() != null
                ? request.getDirectPathPolicy()
                : config.getDirectPathPolicy();

        if (grid.cellCount() == 1 && grid.isFloor(grid.topLeft())) {
            LOG.debug("single floor tile maze, start equals end");
            return SolveResponse.builder()
                    .steps(SINGLE_TILE_STEPS)
                    .breachUsed(false)
                    .wallTilesEvaluated(0)
                    .startReachable(1)
                    .endReachable(1)
                    .executionMode(mode)
                    .directPathPolicy(policy)
                    .build();
        }

        Position start = grid.topLeft();
        Position end = grid.bottomRight();
        FrontierEngine engine = new FrontierEngine(grid);
        BreachEvaluator evaluator = new BreachEvaluator(grid);

        DistanceMap startMap;
        DistanceMap endMap;
        BreachCandidate best;
        if (mode == ExecutionMode.PARALLEL) {
            ForkJoinPool executor = pool();
            ForkJoinTask<DistanceMap> fromStart = executor.submit(() -> engine.distancesFrom(start));
            ForkJoinTask<DistanceMap> fromEnd = executor.submit(() -> engine.distancesFrom(end));
            startMap = await(fromStart, "frontier search from " + start);
            endMap = await(fromEnd, "frontier search from " + end);
            best = evaluateParallel(executor, evaluator, startMap, endMap);
        } else {
            startMap = engine.distancesFrom(start);
            endMap = engine.distancesFrom(end);
            best = evaluator.bestBreach(startMap, endMap).orElse(null);
        }
        LOG.debug("{}: reached {} tiles from {} and {} tiles from {}",
                grid, startMap.size(), start, endMap.size(), end);

        OptionalInt direct = directSteps(grid, policy, startMap, end);
        SolveResponse.SolveResponseBuilder response = SolveResponse.builder()
                .wallTilesEvaluated(grid.wallCount())
                .startReachable(startMap.size())
                .endReachable(endMap.size())
                .executionMode(mode)
                .directPathPolicy(policy);

        if (direct.isPresent() && (best == null || direct.getAsInt() <= best.totalSteps())) {
            LOG.debug("floor-only route of {} steps selected", direct.getAsInt());
            return response.steps(direct.getAsInt()).breachUsed(false).build();
        }
        if (best == null) {
            LOG.debug("{}: no single breach among {} wall tiles connects {} and {}",
                    grid, grid.wallCount(), start, end);
            throw new NoSolutionException(
                    grid.wallCount(),
                    "no single wall breach connects " + start + " and " + end
                            + " (" + grid.wallCount() + " wall tiles evaluated)"
            );
        }
        LOG.debug("breach at {} selected with {} steps", best.position(), best.totalSteps());
        return response
                .steps(best.totalSteps())
                .breachUsed(true)
                .breachPosition(best.position())
                .build();
    }

    /**
     * Releases the parallel worker pool, if one was created. Further parallel solves fail.
     */
    @Override
    public void close() {
        synchronized (poolLock) {
            closed = true;
            if (pool != null) {
                pool.shutdown();
                pool = null;
            }
        }
    }

    /**
     * Effective solver-wide configuration.
     */
    public SolverConfig config() {
        return config;
    }

    /**
     * Cell count implied by the first row, read before the maze is copied. Shapes that
     * {@link Grid#of(int[][])} will reject count as zero and fail there instead.
     */
    private static long declaredCellCount(int[][] maze) {
        if (maze == null || maze.length == 0 || maze[0] == null) {
            return 0L;
        }
        return (long) maze.length * maze[0].length;
    }

    private static OptionalInt directSteps(Grid grid, DirectPathPolicy policy, DistanceMap startMap, Position end) {
        if (policy != DirectPathPolicy.ALLOW_DIRECT) {
            return OptionalInt.empty();
        }
        if (!grid.isFloor(startMap.origin()) || !grid.isFloor(end)) {
            return OptionalInt.empty();
        }
        return startMap.stepsAt(end);
    }

    private BreachCandidate evaluateParallel(
            ForkJoinPool executor,
            BreachEvaluator evaluator,
            DistanceMap startMap,
            DistanceMap endMap
    ) {
        // parallelStream work stays inside the submitting pool, not the common pool
        Callable<BreachCandidate> probe = () -> evaluator.wallCells()
                .parallel()
                .mapToObj(cell -> evaluator.candidateAt(startMap, endMap, cell))
                .filter(Objects::nonNull)
                .min(BreachCandidate.BEST_FIRST)
                .orElse(null);
        return await(executor.submit(probe), "wall tile evaluation");
    }

    private static <T> T await(ForkJoinTask<T> task, String stage) {
        try {
            return task.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SolverException(SolverException.REASON_EXECUTION_INTERRUPTED, stage + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SolverException(SolverException.REASON_EXECUTION_FAILED, stage + " failed", cause);
        }
    }

    private ForkJoinPool pool() {
        synchronized (poolLock) {
            if (closed) {
                throw new SolverException(SolverException.REASON_EXECUTION_FAILED, "solver is closed");
            }
            if (pool == null) {
                pool = new ForkJoinPool(config.effectiveParallelism());
                LOG.debug("created solver pool with parallelism {}", pool.getParallelism());
            }
            return pool;
        }
    }
}
