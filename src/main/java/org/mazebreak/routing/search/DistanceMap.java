package org.mazebreak.routing.search;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.mazebreak.core.grid.Grid;
import org.mazebreak.core.grid.Position;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Read-only step counts from one origin to every floor tile it can reach.
 *
 * <p>Step counts are 1-based: the origin itself maps to 1 and each move adds 1. A missing
 * entry means the tile was not reached; there is no numeric "infinity" stand-in.</p>
 */
public final class DistanceMap {
    /** Internal lookup miss marker; never a valid step count. */
    public static final int UNREACHED = 0;

    private final Grid grid;
    private final Position origin;
    private final Int2IntOpenHashMap stepsByCell;
    private final int maxSteps;

    DistanceMap(Grid grid, Position origin, Int2IntOpenHashMap stepsByCell, int maxSteps) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.stepsByCell = Objects.requireNonNull(stepsByCell, "stepsByCell");
        this.stepsByCell.defaultReturnValue(UNREACHED);
        this.stepsByCell.trim();
        this.maxSteps = maxSteps;
    }

    public Position origin() {
        return origin;
    }

    /**
     * Grid this map was computed over.
     */
    public Grid grid() {
        return grid;
    }

    public boolean contains(Position position) {
        return grid.inBounds(position) && stepsByCell.containsKey(grid.cellIndex(position));
    }

    /**
     * Step count to {@code position}, empty when unreached or out of bounds.
     */
    public OptionalInt stepsAt(Position position) {
        if (!grid.inBounds(position)) {
            return OptionalInt.empty();
        }
        int steps = stepsByCell.get(grid.cellIndex(position));
        return steps == UNREACHED ? OptionalInt.empty() : OptionalInt.of(steps);
    }

    /**
     * Raw cell lookup for hot loops.
     *
     * @return step count, or {@link #UNREACHED} when absent.
     */
    public int stepsAtCell(int cellIndex) {
        return stepsByCell.get(cellIndex);
    }

    /**
     * Number of reached tiles, origin included.
     */
    public int size() {
        return stepsByCell.size();
    }

    /**
     * Largest step count in the map (the number of expansion rings).
     */
    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Visits every entry as (cell index, step count). Iteration order is unspecified.
     */
    public void forEachCell(CellStepsConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer");
        for (Int2IntMap.Entry entry : stepsByCell.int2IntEntrySet()) {
            consumer.accept(entry.getIntKey(), entry.getIntValue());
        }
    }

    /**
     * Primitive callback for {@link #forEachCell(CellStepsConsumer)}.
     */
    @FunctionalInterface
    public interface CellStepsConsumer {
        void accept(int cellIndex, int steps);
    }
}
