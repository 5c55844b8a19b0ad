package org.gridmaze.testutil;

import org.gridmaze.grid.CellWalls;
import org.gridmaze.grid.Direction;
import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.MazeEndpoints;
import org.gridmaze.grid.Position;

import java.util.Random;

/**
 * Shared maze fixtures for grid and planner tests.
 */
public final class MazeFixtures {

    private MazeFixtures() {
    }

    /**
     * 3x3 open grid where (1,1) cannot move east and (0,1) cannot move north.
     * Start (2,0), goal (0,2).
     */
    public static GridGraph threeByThreeWithWalls() {
        return GridGraph.builder(3, 3)
                .fill(CellWalls.open())
                .cell(1, 1, CellWalls.blocking(Direction.EAST))
                .cell(0, 1, CellWalls.blocking(Direction.NORTH))
                .endpoints(MazeEndpoints.of(2, 0, 0, 2))
                .build();
    }

    /**
     * 1x2 grid: A=(0,0) may move east to B=(0,1), B may not move west to A.
     */
    public static GridGraph oneWay(Position start, Position goal) {
        return GridGraph.builder(1, 2)
                .cell(0, 0, CellWalls.open())
                .cell(0, 1, CellWalls.blocking(Direction.WEST))
                .endpoints(new MazeEndpoints(start, goal))
                .build();
    }

    /**
     * 3x3 open grid whose start cell (2,0) has every direction blocked.
     */
    public static GridGraph walledStart() {
        return GridGraph.builder(3, 3)
                .fill(CellWalls.open())
                .cell(2, 0, CellWalls.closed())
                .endpoints(MazeEndpoints.of(2, 0, 0, 2))
                .build();
    }

    /**
     * Fully open grid with start bottom-left and goal top-right.
     */
    public static GridGraph open(int rows, int cols) {
        return GridGraph.builder(rows, cols)
                .fill(CellWalls.open())
                .endpoints(cornerEndpoints(rows, cols))
                .build();
    }

    /**
     * 5x5 serpentine corridor at the default endpoints (4,0) -> (0,4). The single route
     * runs east along row 4, north one row, west along row 3 and so on: 24 moves.
     */
    public static GridGraph serpentine() {
        GridGraph.Builder builder = GridGraph.builder(5, 5);
        for (int r = 0; r < 5; r++) {
            for (int c = 0; c < 5; c++) {
                builder.cell(r, c, CellWalls.closed());
            }
        }
        for (int r = 4; r >= 0; r--) {
            boolean eastward = (4 - r) % 2 == 0;
            for (int c = 0; c < 5; c++) {
                boolean turnCell = eastward ? c == 4 : c == 0;
                boolean north = turnCell && r > 0;
                boolean south = (eastward ? c == 0 : c == 4) && r < 4;
                boolean east = c < 4;
                boolean west = c > 0;
                builder.cell(r, c, CellWalls.of(!north, !south, !east, !west));
            }
        }
        return builder.endpoints(MazeEndpoints.of(4, 0, 0, 4)).build();
    }

    /**
     * Random maze whose walls are symmetric: the boundary between two adjacent cells is
     * either open both ways or blocked both ways.
     */
    public static GridGraph randomSymmetric(int rows, int cols, double wallProbability, long seed) {
        Random random = new Random(seed);
        boolean[][] eastWall = new boolean[rows][cols];
        boolean[][] southWall = new boolean[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                eastWall[r][c] = random.nextDouble() < wallProbability;
                southWall[r][c] = random.nextDouble() < wallProbability;
            }
        }

        GridGraph.Builder builder = GridGraph.builder(rows, cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                boolean north = r > 0 && southWall[r - 1][c];
                boolean south = southWall[r][c];
                boolean east = eastWall[r][c];
                boolean west = c > 0 && eastWall[r][c - 1];
                builder.cell(r, c, CellWalls.of(north, south, east, west));
            }
        }
        return builder.endpoints(cornerEndpoints(rows, cols)).build();
    }

    /**
     * Random maze whose flags are drawn independently per cell and direction.
     */
    public static GridGraph randomDirected(int rows, int cols, double wallProbability, long seed) {
        Random random = new Random(seed);
        GridGraph.Builder builder = GridGraph.builder(rows, cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                builder.cell(r, c, CellWalls.of(
                        random.nextDouble() < wallProbability,
                        random.nextDouble() < wallProbability,
                        random.nextDouble() < wallProbability,
                        random.nextDouble() < wallProbability
                ));
            }
        }
        return builder.endpoints(cornerEndpoints(rows, cols)).build();
    }

    private static MazeEndpoints cornerEndpoints(int rows, int cols) {
        return MazeEndpoints.of(rows - 1, 0, 0, cols - 1);
    }
}
