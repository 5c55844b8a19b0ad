package org.gridmaze.grid;

import java.util.Objects;

/**
 * Fixed start and goal coordinates a maze is expected to use.
 *
 * <p>The classic assignment maze starts in the bottom-left corner {@code (4,0)} and ends in
 * the top-right corner {@code (0,4)}. Deployments can move the fixed coordinates through
 * system properties, and callers building other maze sizes pass explicit endpoints.</p>
 *
 * @param start fixed start coordinate.
 * @param goal fixed goal coordinate.
 */
public record MazeEndpoints(Position start, Position goal) {
    public static final Position DEFAULT_START = new Position(4, 0);
    public static final Position DEFAULT_GOAL = new Position(0, 4);

    static final String PROP_START_ROW = "gridmaze.maze.startRow";
    static final String PROP_START_COL = "gridmaze.maze.startCol";
    static final String PROP_GOAL_ROW = "gridmaze.maze.goalRow";
    static final String PROP_GOAL_COL = "gridmaze.maze.goalCol";

    public MazeEndpoints {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
    }

    /**
     * Shorthand for {@code new MazeEndpoints(new Position(sr, sc), new Position(gr, gc))}.
     */
    public static MazeEndpoints of(int startRow, int startCol, int goalRow, int goalCol) {
        return new MazeEndpoints(new Position(startRow, startCol), new Position(goalRow, goalCol));
    }

    /**
     * Loads fixed endpoints from system properties, falling back per coordinate to
     * {@link #DEFAULT_START} / {@link #DEFAULT_GOAL}.
     */
    public static MazeEndpoints defaults() {
        return of(
                readCoordinate(PROP_START_ROW, DEFAULT_START.row()),
                readCoordinate(PROP_START_COL, DEFAULT_START.col()),
                readCoordinate(PROP_GOAL_ROW, DEFAULT_GOAL.row()),
                readCoordinate(PROP_GOAL_COL, DEFAULT_GOAL.col())
        );
    }

    private static int readCoordinate(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value < 0 ? fallback : value;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
