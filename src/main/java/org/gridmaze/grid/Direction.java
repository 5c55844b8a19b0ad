package org.gridmaze.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Compass moves available from a grid cell.
 *
 * <p>Declaration order is the neighbor enumeration order used by {@link GridGraph}
 * and therefore the tie-break order of every planner.</p>
 */
@Getter
@Accessors(fluent = true)
public enum Direction {
    NORTH(-1, 0),
    SOUTH(1, 0),
    EAST(0, 1),
    WEST(0, -1);

    private final int rowDelta;
    private final int colDelta;

    Direction(int rowDelta, int colDelta) {
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
    }
}
