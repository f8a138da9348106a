package org.mazebreak.core.grid;

import org.mazebreak.core.ReasonCodedException;

/**
 * Thrown when caller-supplied maze input cannot be turned into a {@link Grid}.
 */
public final class InvalidMazeException extends ReasonCodedException {
    public static final String REASON_MAZE_EMPTY = "MAZE_EMPTY";
    public static final String REASON_MAZE_RAGGED = "MAZE_RAGGED";
    public static final String REASON_MAZE_INVALID_TILE = "MAZE_INVALID_TILE";
    public static final String REASON_MAZE_UNPARSEABLE = "MAZE_UNPARSEABLE";

    public InvalidMazeException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
