package org.mazebreak.core.grid;

import java.util.List;

/**
 * The four orthogonal moves, in expansion order.
 */
public enum Direction {
    UP(-1, 0),
    LEFT(0, -1),
    RIGHT(0, 1),
    DOWN(1, 0);

    private static final List<Direction> ORDERED = List.of(values());

    private final int rowDelta;
    private final int colDelta;

    Direction(int rowDelta, int colDelta) {
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
    }

    public int rowDelta() {
        return rowDelta;
    }

    public int colDelta() {
        return colDelta;
    }

    /**
     * All directions in expansion order, as an unmodifiable shared list.
     */
    public static List<Direction> ordered() {
        return ORDERED;
    }
}
