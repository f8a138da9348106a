package org.mazebreak.core;

import org.mazebreak.core.grid.InvalidMazeException;
import org.mazebreak.routing.core.NoSolutionException;
import org.mazebreak.routing.core.SolverException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Reason-Coded Exception Tests")
class ReasonCodedExceptionTest {

    @Test
    @DisplayName("Message carries the reason code prefix")
    void testMessagePrefix() {
        InvalidMazeException ex = new InvalidMazeException(InvalidMazeException.REASON_MAZE_RAGGED, "row 1 too short");
        assertEquals("[MAZE_RAGGED] row 1 too short", ex.getMessage());
        assertEquals(InvalidMazeException.REASON_MAZE_RAGGED, ex.getReasonCode());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Cause is retained")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        SolverException ex = new SolverException(SolverException.REASON_EXECUTION_FAILED, "stage failed", cause);
        assertSame(cause, ex.getCause());
        assertEquals("[EXECUTION_FAILED] stage failed", ex.getMessage());
    }

    @Test
    @DisplayName("Blank or missing codes and messages are rejected")
    void testContractChecks() {
        assertThrows(IllegalArgumentException.class, () -> new SolverException(" ", "message"));
        assertThrows(NullPointerException.class, () -> new SolverException(null, "message"));
        assertThrows(NullPointerException.class, () -> new InvalidMazeException("CODE", null));
    }

    @Test
    @DisplayName("All solver failures share one base type")
    void testHierarchy() {
        assertInstanceOf(ReasonCodedException.class, new InvalidMazeException("CODE", "m"));
        assertInstanceOf(ReasonCodedException.class, new SolverException("CODE", "m"));
        assertInstanceOf(SolverException.class, new NoSolutionException(0, "m"));
    }
}
