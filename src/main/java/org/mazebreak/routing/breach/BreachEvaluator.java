package org.mazebreak.routing.breach;

import org.mazebreak.core.grid.Direction;
import org.mazebreak.core.grid.Grid;
import org.mazebreak.core.grid.Position;
import org.mazebreak.routing.search.DistanceMap;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Joins two distance maps through a single converted wall tile.
 *
 * <p>For a wall tile the best route through it enters from the floor neighbour closest to
 * the start and leaves through the floor neighbour closest to the end. With 1-based maps the
 * total is {@code minStart + minEnd + 1}, the extra step being the wall tile itself.</p>
 *
 * <p>Stateless apart from the grid; every tile is evaluated independently, so calls may run
 * concurrently against the same completed maps.</p>
 */
public final class BreachEvaluator {
    private final Grid grid;

    public BreachEvaluator(Grid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    /**
     * Best 1-based route length through {@code wallTile}.
     *
     * @param startMap distances from the start corner.
     * @param endMap distances from the end corner.
     * @param wallTile wall position to convert.
     * @return total steps, or empty when the tile touches no reached floor on either side.
     * @throws IllegalArgumentException when {@code wallTile} is not an in-bounds wall.
     */
    public OptionalInt bestBreachDistance(DistanceMap startMap, DistanceMap endMap, Position wallTile) {
        Objects.requireNonNull(wallTile, "wallTile");
        if (!grid.isWall(wallTile)) {
            throw new IllegalArgumentException("position " + wallTile + " is not a wall tile");
        }
        checkMaps(startMap, endMap);
        int total = evaluateCell(startMap, endMap, grid.cellIndex(wallTile));
        return total == DistanceMap.UNREACHED ? OptionalInt.empty() : OptionalInt.of(total);
    }

    /**
     * Scans every wall tile in row-major order and returns the best candidate.
     *
     * <p>Ties on total steps keep the earliest tile in row-major order.</p>
     */
    public Optional<BreachCandidate> bestBreach(DistanceMap startMap, DistanceMap endMap) {
        checkMaps(startMap, endMap);
        BreachCandidate best = null;
        for (int cell = 0; cell < grid.cellCount(); cell++) {
            best = BreachCandidate.better(best, candidateAt(startMap, endMap, cell));
        }
        return Optional.ofNullable(best);
    }

    /**
     * Row-major stream of wall cell indexes, for callers that fan evaluation out.
     */
    public IntStream wallCells() {
        return IntStream.range(0, grid.cellCount()).filter(grid::isWallCell);
    }

    /**
     * Evaluates one cell; returns null for floor cells and for walls without a finite route.
     */
    public BreachCandidate candidateAt(DistanceMap startMap, DistanceMap endMap, int cellIndex) {
        if (!grid.isWallCell(cellIndex)) {
            return null;
        }
        int total = evaluateCell(startMap, endMap, cellIndex);
        if (total == DistanceMap.UNREACHED) {
            return null;
        }
        return new BreachCandidate(grid.positionOf(cellIndex), cellIndex, total);
    }

    private int evaluateCell(DistanceMap startMap, DistanceMap endMap, int wallCell) {
        int minStart = DistanceMap.UNREACHED;
        int minEnd = DistanceMap.UNREACHED;
        for (Direction direction : Direction.ordered()) {
            int neighbor = grid.neighborIndex(wallCell, direction);
            if (neighbor == Grid.NO_CELL || !grid.isFloorCell(neighbor)) {
                continue;
            }
            minStart = minPresent(minStart, startMap.stepsAtCell(neighbor));
            minEnd = minPresent(minEnd, endMap.stepsAtCell(neighbor));
        }
        if (minStart == DistanceMap.UNREACHED || minEnd == DistanceMap.UNREACHED) {
            return DistanceMap.UNREACHED;
        }
        return minStart + minEnd + 1;
    }

    private static int minPresent(int current, int candidate) {
        if (candidate == DistanceMap.UNREACHED) {
            return current;
        }
        if (current == DistanceMap.UNREACHED) {
            return candidate;
        }
        return Math.min(current, candidate);
    }

    private void checkMaps(DistanceMap startMap, DistanceMap endMap) {
        Objects.requireNonNull(startMap, "startMap");
        Objects.requireNonNull(endMap, "endMap");
        if (startMap.grid() != grid || endMap.grid() != grid) {
            throw new IllegalArgumentException("distance maps must be computed over the evaluator's grid");
        }
    }

    public Grid grid() {
        return grid;
    }
}
