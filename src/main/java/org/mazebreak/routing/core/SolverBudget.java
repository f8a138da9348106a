package org.mazebreak.routing.core;

/**
 * Per-solve bound on grid size, checked before any search starts.
 */
final class SolverBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_GRID_CELLS_EXCEEDED = "BUDGET_GRID_CELLS_EXCEEDED";

    private final int maxGridCells;

    private SolverBudget(int maxGridCells) {
        this.maxGridCells = normalizeBound(maxGridCells);
    }

    /**
     * Creates a budget; non-positive bounds mean unbounded.
     */
    static SolverBudget of(int maxGridCells) {
        return new SolverBudget(maxGridCells);
    }

    int maxGridCells() {
        return maxGridCells;
    }

    /**
     * Validates grid cell count against the configured bound.
     */
    void checkGridCells(long cellCount) {
        if (cellCount > maxGridCells) {
            throw new BudgetExceededException(
                    REASON_GRID_CELLS_EXCEEDED,
                    "grid cell budget exceeded: " + cellCount + " > " + maxGridCells
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        String reasonCode() {
            return reasonCode;
        }
    }
}
