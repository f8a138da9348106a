package org.mazebreak.core.grid;

import java.util.Objects;

/**
 * Immutable rectangular maze of {@link Tile#FLOOR} and {@link Tile#WALL} cells.
 *
 * <p>Cells are stored row-major in a flat array. Most callers use {@link Position};
 * the search layer works on dense cell indexes ({@code row * width + col}) to stay
 * allocation-free in its inner loops.</p>
 */
public final class Grid {
    public static final int NO_CELL = -1;

    private final int height;
    private final int width;
    private final boolean[] walls;
    private final int wallCount;

    private Grid(int height, int width, boolean[] walls, int wallCount) {
        this.height = height;
        this.width = width;
        this.walls = walls;
        this.wallCount = wallCount;
    }

    /**
     * Builds a grid from raw tile values (0 = floor, 1 = wall).
     *
     * <p>The input is copied; later changes to {@code maze} are not observed.</p>
     *
     * @param maze rectangular, non-empty tile matrix.
     * @return validated grid.
     * @throws InvalidMazeException when the matrix is empty, ragged or holds values other than 0/1.
     */
    public static Grid of(int[][] maze) {
        if (maze == null || maze.length == 0) {
            throw new InvalidMazeException(InvalidMazeException.REASON_MAZE_EMPTY, "maze must have at least one row");
        }
        if (maze[0] == null || maze[0].length == 0) {
            throw new InvalidMazeException(InvalidMazeException.REASON_MAZE_EMPTY, "maze must have at least one column");
        }

        int height = maze.length;
        int width = maze[0].length;
        boolean[] walls = new boolean[Math.multiplyExact(height, width)];
        int wallCount = 0;

        for (int row = 0; row < height; row++) {
            int[] line = maze[row];
            if (line == null) {
                throw new InvalidMazeException(InvalidMazeException.REASON_MAZE_EMPTY, "row " + row + " is null");
            }
            if (line.length != width) {
                throw new InvalidMazeException(
                        InvalidMazeException.REASON_MAZE_RAGGED,
                        "row " + row + " has " + line.length + " columns, expected " + width
                );
            }
            for (int col = 0; col < width; col++) {
                Tile tile = Tile.fromCode(line[col]);
                if (tile == null) {
                    throw new InvalidMazeException(
                            InvalidMazeException.REASON_MAZE_INVALID_TILE,
                            "tile at (" + row + "," + col + ") must be 0 or 1, got " + line[col]
                    );
                }
                if (tile == Tile.WALL) {
                    walls[row * width + col] = true;
                    wallCount++;
                }
            }
        }
        return new Grid(height, width, walls, wallCount);
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    /**
     * Total number of cells ({@code height * width}).
     */
    public int cellCount() {
        return walls.length;
    }

    /**
     * Number of wall cells.
     */
    public int wallCount() {
        return wallCount;
    }

    public boolean inBounds(Position position) {
        Objects.requireNonNull(position, "position");
        return inBounds(position.row(), position.col());
    }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    /**
     * Returns whether the position is an in-bounds floor tile.
     */
    public boolean isFloor(Position position) {
        return inBounds(position) && !walls[cellIndex(position)];
    }

    /**
     * Returns whether the position is an in-bounds wall tile.
     */
    public boolean isWall(Position position) {
        return inBounds(position) && walls[cellIndex(position)];
    }

    /**
     * Returns the tile at an in-bounds position.
     *
     * @throws IndexOutOfBoundsException when the position lies outside the grid.
     */
    public Tile tileAt(Position position) {
        if (!inBounds(position)) {
            throw new IndexOutOfBoundsException("position " + position + " outside " + height + "x" + width + " grid");
        }
        return walls[cellIndex(position)] ? Tile.WALL : Tile.FLOOR;
    }

    public boolean isFloorCell(int cellIndex) {
        return !walls[cellIndex];
    }

    public boolean isWallCell(int cellIndex) {
        return walls[cellIndex];
    }

    /**
     * Row-major index of an in-bounds position.
     */
    public int cellIndex(Position position) {
        return position.row() * width + position.col();
    }

    public Position positionOf(int cellIndex) {
        if (cellIndex < 0 || cellIndex >= walls.length) {
            throw new IndexOutOfBoundsException("cell index " + cellIndex + " out of bounds (max: " + (walls.length - 1) + ")");
        }
        return new Position(cellIndex / width, cellIndex % width);
    }

    /**
     * Index of the cell one move from {@code cellIndex}, or {@link #NO_CELL} when that
     * move leaves the grid.
     */
    public int neighborIndex(int cellIndex, Direction direction) {
        int row = cellIndex / width + direction.rowDelta();
        int col = cellIndex % width + direction.colDelta();
        if (!inBounds(row, col)) {
            return NO_CELL;
        }
        return row * width + col;
    }

    public Position topLeft() {
        return new Position(0, 0);
    }

    public Position bottomRight() {
        return new Position(height - 1, width - 1);
    }

    @Override
    public String toString() {
        return "Grid{" + height + "x" + width + ", walls=" + wallCount + "}";
    }
}
