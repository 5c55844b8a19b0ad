package org.gridmaze.heuristic;

import org.gridmaze.grid.Position;

/**
 * Remaining-cost estimate between two grid coordinates.
 *
 * <p>Implementations must be pure: no side effects and the same result for the same pair.
 * Estimates are expected to be finite and non-negative; planners clamp anything else to
 * zero before it reaches the frontier.</p>
 */
@FunctionalInterface
public interface Heuristic {

    /**
     * Estimates the cost of reaching {@code to} from {@code from}.
     *
     * @param from position being scored.
     * @param to goal position.
     * @return non-negative estimate.
     */
    double estimate(Position from, Position to);
}
