package org.mazebreak.routing.breach;

import org.mazebreak.core.grid.Position;

import java.util.Comparator;

/**
 * Finite result of probing one wall tile.
 *
 * @param position converted wall tile.
 * @param cellIndex row-major index of {@code position}, used for deterministic ordering.
 * @param totalSteps 1-based step count of the best route through the tile.
 */
public record BreachCandidate(Position position, int cellIndex, int totalSteps) {

    /**
     * Orders by total steps, then by row-major tile order.
     */
    public static final Comparator<BreachCandidate> BEST_FIRST =
            Comparator.comparingInt(BreachCandidate::totalSteps)
                    .thenComparingInt(BreachCandidate::cellIndex);

    /**
     * Returns the better of two candidates under {@link #BEST_FIRST}; either may be null.
     */
    public static BreachCandidate better(BreachCandidate lhs, BreachCandidate rhs) {
        if (lhs == null) {
            return rhs;
        }
        if (rhs == null) {
            return lhs;
        }
        return BEST_FIRST.compare(lhs, rhs) <= 0 ? lhs : rhs;
    }
}
