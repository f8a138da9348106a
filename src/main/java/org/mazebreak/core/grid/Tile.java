package org.mazebreak.core.grid;

/**
 * State of one maze cell.
 */
public enum Tile {
    FLOOR(0),
    WALL(1);

    private final int code;

    Tile(int code) {
        this.code = code;
    }

    /**
     * Raw input value for this tile (0 = floor, 1 = wall).
     */
    public int code() {
        return code;
    }

    /**
     * Decodes a raw input value.
     *
     * @param code raw tile value.
     * @return matching tile, or {@code null} when the value is neither 0 nor 1.
     */
    static Tile fromCode(int code) {
        return switch (code) {
            case 0 -> FLOOR;
            case 1 -> WALL;
            default -> null;
        };
    }
}
