package org.mazebreak.routing.search;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.mazebreak.core.grid.Direction;
import org.mazebreak.core.grid.Grid;
import org.mazebreak.core.grid.Position;

import java.util.List;
import java.util.Objects;

/**
 * Level-order breadth-first expansion over floor tiles.
 *
 * <p>Each run starts its origin at step 1 and advances one ring per step, trying moves in
 * {@link Direction#ordered()} order. The origin itself need not be a floor tile; every other
 * reached tile is. A tile keeps the step count of its first visit.</p>
 *
 * <p>Instances hold only the immutable grid and are safe to share across threads; every
 * call allocates its own frontier state.</p>
 */
public final class FrontierEngine {
    static final int ORIGIN_STEPS = 1;

    private final Grid grid;

    public FrontierEngine(Grid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    /**
     * Computes 1-based step counts from {@code origin} to every reachable floor tile.
     *
     * @param origin in-bounds start position.
     * @return completed distance map.
     * @throws IllegalArgumentException when the origin lies outside the grid.
     */
    public DistanceMap distancesFrom(Position origin) {
        Objects.requireNonNull(origin, "origin");
        if (!grid.inBounds(origin)) {
            throw new IllegalArgumentException("origin " + origin + " outside " + grid.height() + "x" + grid.width() + " grid");
        }

        List<Direction> directions = Direction.ordered();
        VisitedSet visited = new VisitedSet(grid.cellCount());
        Int2IntOpenHashMap stepsByCell = new Int2IntOpenHashMap();
        IntArrayList current = new IntArrayList();
        IntArrayList next = new IntArrayList();

        int originCell = grid.cellIndex(origin);
        visited.markVisited(originCell);
        stepsByCell.put(originCell, ORIGIN_STEPS);
        current.add(originCell);

        int steps = ORIGIN_STEPS;
        while (!current.isEmpty()) {
            int nextSteps = steps + 1;
            for (int i = 0; i < current.size(); i++) {
                int cell = current.getInt(i);
                for (Direction direction : directions) {
                    int neighbor = grid.neighborIndex(cell, direction);
                    if (neighbor == Grid.NO_CELL || !grid.isFloorCell(neighbor)) {
                        continue;
                    }
                    if (!visited.markVisited(neighbor)) {
                        continue;
                    }
                    stepsByCell.put(neighbor, nextSteps);
                    next.add(neighbor);
                }
            }
            if (next.isEmpty()) {
                break;
            }
            IntArrayList swap = current;
            current = next;
            next = swap;
            next.clear();
            steps = nextSteps;
        }

        return new DistanceMap(grid, origin, stepsByCell, steps);
    }

    public Grid grid() {
        return grid;
    }
}
