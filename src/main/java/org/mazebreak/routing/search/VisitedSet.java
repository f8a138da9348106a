package org.mazebreak.routing.search;

import java.util.BitSet;

/**
 * Tracks visited grid cells so the first visit to a cell wins during expansion.
 *
 * <p>Wraps a {@link BitSet} sized to the grid; indexes outside {@code 0..capacity-1}
 * are rejected rather than silently growing the set.</p>
 *
 * <p>Not thread-safe; each frontier run owns its own instance.</p>
 */
final class VisitedSet {
    private final BitSet visited;
    private final int capacity;

    /**
     * @param capacity number of addressable cell indexes.
     */
    VisitedSet(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.visited = new BitSet(capacity);
    }

    /**
     * Marks a cell as visited.
     *
     * @return true if the cell was not visited before this call.
     */
    boolean markVisited(int cellIndex) {
        checkIndex(cellIndex);
        if (visited.get(cellIndex)) {
            return false;
        }
        visited.set(cellIndex);
        return true;
    }

    boolean isVisited(int cellIndex) {
        checkIndex(cellIndex);
        return visited.get(cellIndex);
    }

    /**
     * Number of visited cells.
     */
    int count() {
        return visited.cardinality();
    }

    private void checkIndex(int cellIndex) {
        if (cellIndex < 0 || cellIndex >= capacity) {
            throw new IllegalArgumentException("cellIndex " + cellIndex + " out of bounds (max: " + (capacity - 1) + ")");
        }
    }
}
