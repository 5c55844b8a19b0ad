package org.gridmaze.heuristic;

import lombok.experimental.UtilityClass;
import org.gridmaze.grid.Position;

/**
 * Stock coordinate heuristics for 4-directional unit-cost grids.
 *
 * <p>Both distances are lower bounds on the number of moves between two cells, so they are
 * admissible and consistent on grids with symmetric walls. Directed walls can only make real
 * paths longer; the estimates are used unchanged either way.</p>
 */
@UtilityClass
public class Heuristics {

    /** {@code |dr| + |dc|}. Integer valued. */
    public static final Heuristic MANHATTAN = Heuristics::manhattan;

    /** {@code sqrt(dr^2 + dc^2)}. */
    public static final Heuristic EUCLIDEAN = Heuristics::euclidean;

    /** Constant zero; turns A* into uniform-cost search. */
    public static final Heuristic ZERO = (from, to) -> 0.0d;

    public static int manhattan(Position a, Position b) {
        return Math.abs(a.row() - b.row()) + Math.abs(a.col() - b.col());
    }

    public static double euclidean(Position a, Position b) {
        int dr = a.row() - b.row();
        int dc = a.col() - b.col();
        return Math.sqrt((double) dr * dr + (double) dc * dc);
    }
}
