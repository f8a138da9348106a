package org.mazebreak.core.grid;

/**
 * Grid coordinate. Equality is by row and column only.
 *
 * @param row zero-based row index.
 * @param col zero-based column index.
 */
public record Position(int row, int col) {

    /**
     * Returns the adjacent position one move away; may lie outside any grid.
     */
    public Position move(Direction direction) {
        return new Position(row + direction.rowDelta(), col + direction.colDelta());
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
