package org.mazebreak.routing.core;

import org.mazebreak.core.ReasonCodedException;

/**
 * Solver contract and execution failures.
 */
public class SolverException extends ReasonCodedException {
    public static final String REASON_SOLVE_REQUEST_REQUIRED = "SOLVE_REQUEST_REQUIRED";
    public static final String REASON_GRID_BUDGET_EXCEEDED = "GRID_BUDGET_EXCEEDED";
    public static final String REASON_EXECUTION_INTERRUPTED = "EXECUTION_INTERRUPTED";
    public static final String REASON_EXECUTION_FAILED = "EXECUTION_FAILED";

    public SolverException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public SolverException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
