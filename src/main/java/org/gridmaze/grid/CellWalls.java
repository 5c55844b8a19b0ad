package org.gridmaze.grid;

import java.util.Objects;

/**
 * Directional permissions of one maze cell.
 *
 * <p>Each flag describes only moves <em>leaving</em> this cell: {@code true} means the move
 * in that direction is blocked. The flags of two adjacent cells are independent, so an open
 * east flag on one cell says nothing about the west flag of its neighbor.</p>
 *
 * @param northBlocked whether moving north from this cell is forbidden.
 * @param southBlocked whether moving south from this cell is forbidden.
 * @param eastBlocked whether moving east from this cell is forbidden.
 * @param westBlocked whether moving west from this cell is forbidden.
 * @param label display-only label.
 */
public record CellWalls(
        boolean northBlocked,
        boolean southBlocked,
        boolean eastBlocked,
        boolean westBlocked,
        char label
) {
    /** Label used when the source encoding carries none. */
    public static final char DEFAULT_LABEL = '.';

    private static final CellWalls OPEN = new CellWalls(false, false, false, false, DEFAULT_LABEL);
    private static final CellWalls CLOSED = new CellWalls(true, true, true, true, DEFAULT_LABEL);

    /**
     * @return cell with every direction traversable.
     */
    public static CellWalls open() {
        return OPEN;
    }

    /**
     * @return cell with every direction blocked.
     */
    public static CellWalls closed() {
        return CLOSED;
    }

    /**
     * Creates an unlabeled cell from explicit blocked flags (N, S, E, W).
     */
    public static CellWalls of(boolean northBlocked, boolean southBlocked, boolean eastBlocked, boolean westBlocked) {
        return new CellWalls(northBlocked, southBlocked, eastBlocked, westBlocked, DEFAULT_LABEL);
    }

    /**
     * Creates an unlabeled cell that is open except for the listed directions.
     */
    public static CellWalls blocking(Direction... blocked) {
        Objects.requireNonNull(blocked, "blocked");
        boolean n = false;
        boolean s = false;
        boolean e = false;
        boolean w = false;
        for (Direction direction : blocked) {
            switch (Objects.requireNonNull(direction, "direction")) {
                case NORTH -> n = true;
                case SOUTH -> s = true;
                case EAST -> e = true;
                case WEST -> w = true;
            }
        }
        return of(n, s, e, w);
    }

    /**
     * @return copy of these walls carrying {@code newLabel}.
     */
    public CellWalls withLabel(char newLabel) {
        return new CellWalls(northBlocked, southBlocked, eastBlocked, westBlocked, newLabel);
    }

    /**
     * Returns whether leaving the cell in {@code direction} is forbidden.
     */
    public boolean isBlocked(Direction direction) {
        return switch (Objects.requireNonNull(direction, "direction")) {
            case NORTH -> northBlocked;
            case SOUTH -> southBlocked;
            case EAST -> eastBlocked;
            case WEST -> westBlocked;
        };
    }

    /**
     * A cell is passable when at least one of its four flags is open.
     * Bounds are not considered here.
     */
    public boolean isPassable() {
        return !(northBlocked && southBlocked && eastBlocked && westBlocked);
    }
}
