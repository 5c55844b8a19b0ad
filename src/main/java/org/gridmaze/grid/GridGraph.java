package org.gridmaze.grid;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Immutable rectangular maze graph with per-cell directional permissions.
 * <p>
 * ARCHITECTURAL NOTE:
 * Adjacency is directed. A move from cell A in direction D is permitted only when A's own
 * flag for D is open and the shifted coordinate is inside the grid. The flags of the
 * target cell are never consulted, so {@code A -> B} being legal does not make
 * {@code B -> A} legal.
 * <p>
 * Features:
 * - Dense cell index ({@code row * cols + col}) for planners working on primitive ids.
 * - Zero-allocation {@link NeighborCursor} plus a lazy {@link Iterable} view over positions.
 * - Fixed N, S, E, W neighbor order, which is the tie-break order of every search.
 * <p>
 * Instances are built once through {@link #builder(int, int)} and are safe to share
 * read-only between threads.
 */
public final class GridGraph {
    private static final Logger log = LoggerFactory.getLogger(GridGraph.class);

    public static final String REASON_INVALID_DIMENSIONS = "GRID_INVALID_DIMENSIONS";
    public static final String REASON_CELL_OUT_OF_BOUNDS = "GRID_CELL_OUT_OF_BOUNDS";
    public static final String REASON_CELL_WALLS_REQUIRED = "GRID_CELL_WALLS_REQUIRED";
    public static final String REASON_MISSING_CELL = "GRID_MISSING_CELL";
    public static final String REASON_ENDPOINT_OUT_OF_BOUNDS = "GRID_ENDPOINT_OUT_OF_BOUNDS";
    public static final String REASON_START_MISMATCH = "GRID_START_MISMATCH";
    public static final String REASON_GOAL_MISMATCH = "GRID_GOAL_MISMATCH";
    public static final String REASON_INVALID_STEP = "GRID_INVALID_STEP";

    /** Uniform cost of every permitted move. */
    public static final int UNIT_STEP_COST = 1;

    private static final Direction[] DIRECTIONS = Direction.values();

    @Getter
    @Accessors(fluent = true)
    private final int rows;
    @Getter
    @Accessors(fluent = true)
    private final int cols;
    private final CellWalls[] cells;
    private final Position start;
    private final Position goal;

    private GridGraph(int rows, int cols, CellWalls[] cells, Position start, Position goal) {
        this.rows = rows;
        this.cols = cols;
        this.cells = cells;
        this.start = start;
        this.goal = goal;
    }

    /**
     * Starts a builder for a {@code rows x cols} maze using {@link MazeEndpoints#defaults()}.
     */
    public static Builder builder(int rows, int cols) {
        return new Builder(rows, cols);
    }

    // ========================================================================
    // CORE ACCESSORS
    // ========================================================================

    /**
     * @return fixed start coordinate.
     */
    public Position start() {
        return start;
    }

    /**
     * @return fixed goal coordinate.
     */
    public Position goal() {
        return goal;
    }

    public int cellCount() {
        return rows * cols;
    }

    public boolean inBounds(Position pos) {
        return pos != null && inBounds(pos.row(), pos.col());
    }

    private boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    /**
     * Returns the walls stored for {@code pos}.
     *
     * @throws IndexOutOfBoundsException when {@code pos} lies outside the grid.
     */
    public CellWalls wallsAt(Position pos) {
        return cells[indexOf(pos)];
    }

    /**
     * Display label of a cell. Never used for search control flow.
     */
    public char labelAt(Position pos) {
        return wallsAt(pos).label();
    }

    /**
     * Returns whether the cell has at least one open flag.
     */
    public boolean isPassable(Position pos) {
        return wallsAt(pos).isPassable();
    }

    /**
     * Dense index of a position.
     *
     * @throws IndexOutOfBoundsException when {@code pos} lies outside the grid.
     */
    public int indexOf(Position pos) {
        Objects.requireNonNull(pos, "pos");
        if (!inBounds(pos.row(), pos.col())) {
            throw new IndexOutOfBoundsException("Position " + pos + " outside " + rows + "x" + cols + " grid");
        }
        return pos.row() * cols + pos.col();
    }

    public Position positionOf(int cellIndex) {
        if (cellIndex < 0 || cellIndex >= cells.length) {
            throw new IndexOutOfBoundsException("Cell " + cellIndex + " out of bounds [0, " + cells.length + ")");
        }
        return new Position(cellIndex / cols, cellIndex % cols);
    }

    // ========================================================================
    // ADJACENCY
    // ========================================================================

    /**
     * Returns the legal moves out of {@code pos} in N, S, E, W order.
     * <p>
     * The view is lazy: each iteration re-reads the cell flags and allocates positions
     * only as they are consumed.
     */
    public Iterable<Position> neighbors(Position pos) {
        int cellIndex = indexOf(pos);
        return () -> new PositionIterator(cursor().reset(cellIndex));
    }

    /**
     * Returns whether {@code from -> to} is a single permitted move.
     */
    public boolean isPermitted(Position from, Position to) {
        if (!inBounds(from) || !inBounds(to)) {
            return false;
        }
        return isPermitted(indexOf(from), indexOf(to));
    }

    private boolean isPermitted(int fromIndex, int toIndex) {
        CellWalls walls = cells[fromIndex];
        int row = fromIndex / cols;
        int col = fromIndex % cols;
        for (Direction direction : DIRECTIONS) {
            int nextRow = row + direction.rowDelta();
            int nextCol = col + direction.colDelta();
            if (!walls.isBlocked(direction)
                    && inBounds(nextRow, nextCol)
                    && nextRow * cols + nextCol == toIndex) {
                return true;
            }
        }
        return false;
    }

    /**
     * Cost of the single move {@code from -> to}.
     *
     * @return {@link #UNIT_STEP_COST}.
     * @throws GridGraphException with kind {@code INVALID_STEP} when the move is not permitted.
     */
    public int stepCost(Position from, Position to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!isPermitted(from, to)) {
            throw invalidStep(from, to);
        }
        return UNIT_STEP_COST;
    }

    /**
     * Index-space variant of {@link #stepCost(Position, Position)}.
     */
    public int stepCost(int fromIndex, int toIndex) {
        if (fromIndex < 0 || fromIndex >= cells.length
                || toIndex < 0 || toIndex >= cells.length
                || !isPermitted(fromIndex, toIndex)) {
            throw invalidStep(
                    fromIndex >= 0 && fromIndex < cells.length ? positionOf(fromIndex) : null,
                    toIndex >= 0 && toIndex < cells.length ? positionOf(toIndex) : null
            );
        }
        return UNIT_STEP_COST;
    }

    /**
     * Sums step costs along a path. An empty path costs 0, as does a single-cell path.
     *
     * @throws GridGraphException with kind {@code INVALID_STEP} if two consecutive
     * positions are not a permitted move.
     */
    public int pathCost(List<Position> path) {
        Objects.requireNonNull(path, "path");
        int total = 0;
        for (int i = 1; i < path.size(); i++) {
            total += stepCost(path.get(i - 1), path.get(i));
        }
        return total;
    }

    /**
     * Returns a reusable zero-allocation neighbor cursor.
     */
    public NeighborCursor cursor() {
        return new NeighborCursor(this);
    }

    /**
     * Functional-style iteration over the legal moves of one cell, in N, S, E, W order.
     */
    public void forEachNeighbor(int cellIndex, IntConsumer action) {
        NeighborCursor cursor = cursor().reset(cellIndex);
        while (cursor.hasNext()) {
            action.accept(cursor.next());
        }
    }

    private GridGraphException invalidStep(Position from, Position to) {
        return new GridGraphException(
                GridGraphException.Kind.INVALID_STEP,
                REASON_INVALID_STEP,
                "no permitted move from " + from + " to " + to
        );
    }

    /**
     * Cursor over the permitted moves of one cell.
     * Does not hold an implicit reference to an enclosing instance.
     */
    public static final class NeighborCursor {
        private final GridGraph graph;
        private int row;
        private int col;
        private CellWalls walls;
        private int directionIndex;
        private int pending = -1;

        NeighborCursor(GridGraph graph) {
            this.graph = graph;
        }

        /**
         * Positions the cursor on the moves out of {@code cellIndex}.
         */
        public NeighborCursor reset(int cellIndex) {
            if (cellIndex < 0 || cellIndex >= graph.cells.length) {
                throw new IndexOutOfBoundsException(
                        "Cell " + cellIndex + " out of bounds [0, " + graph.cells.length + ")");
            }
            this.row = cellIndex / graph.cols;
            this.col = cellIndex % graph.cols;
            this.walls = graph.cells[cellIndex];
            this.directionIndex = 0;
            this.pending = -1;
            return this;
        }

        public boolean hasNext() {
            if (pending >= 0) {
                return true;
            }
            while (walls != null && directionIndex < DIRECTIONS.length) {
                Direction direction = DIRECTIONS[directionIndex++];
                if (walls.isBlocked(direction)) {
                    continue;
                }
                int nextRow = row + direction.rowDelta();
                int nextCol = col + direction.colDelta();
                if (graph.inBounds(nextRow, nextCol)) {
                    pending = nextRow * graph.cols + nextCol;
                    return true;
                }
            }
            return false;
        }

        /**
         * @return dense index of the next reachable cell.
         */
        public int next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int result = pending;
            pending = -1;
            return result;
        }
    }

    private final class PositionIterator implements Iterator<Position> {
        private final NeighborCursor cursor;

        private PositionIterator(NeighborCursor cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            return cursor.hasNext();
        }

        @Override
        public Position next() {
            return positionOf(cursor.next());
        }
    }

    // ========================================================================
    // DEBUG & RENDERING
    // ========================================================================

    /**
     * Renders the grid with {@code S}/{@code G} on the endpoints, {@code o} on intermediate
     * path cells and {@code .} elsewhere. Rows are separated by {@code '\n'}.
     *
     * @throws IndexOutOfBoundsException when a path position lies outside the grid.
     */
    public String renderPath(List<Position> path) {
        Objects.requireNonNull(path, "path");
        char[][] out = new char[rows][cols];
        for (char[] line : out) {
            Arrays.fill(line, '.');
        }
        for (Position pos : path) {
            int index = indexOf(pos);
            if (!pos.equals(start) && !pos.equals(goal)) {
                out[index / cols][index % cols] = 'o';
            }
        }
        out[start.row()][start.col()] = 'S';
        out[goal.row()][goal.col()] = 'G';

        StringBuilder sb = new StringBuilder(rows * (cols + 1));
        for (int r = 0; r < rows; r++) {
            if (r > 0) {
                sb.append('\n');
            }
            sb.append(out[r]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("GridGraph[rows=%d, cols=%d, start=%s, goal=%s]", rows, cols, start, goal);
    }

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    /**
     * Collects the cell mapping and endpoint claims, then validates everything at once in
     * {@link #build()}. No partially valid graph is ever returned.
     */
    public static final class Builder {
        private final int rows;
        private final int cols;
        private final Map<Position, CellWalls> cells = new LinkedHashMap<>();
        private MazeEndpoints endpoints;
        private Position markedStart;
        private Position markedGoal;

        private Builder(int rows, int cols) {
            this.rows = rows;
            this.cols = cols;
        }

        /**
         * Defines (or redefines) one cell.
         */
        public Builder cell(Position pos, CellWalls walls) {
            cells.put(Objects.requireNonNull(pos, "pos"), walls);
            return this;
        }

        public Builder cell(int row, int col, CellWalls walls) {
            return cell(new Position(row, col), walls);
        }

        /**
         * Defines every cell of a source mapping.
         */
        public Builder cells(Map<Position, CellWalls> mapping) {
            Objects.requireNonNull(mapping, "mapping");
            for (Map.Entry<Position, CellWalls> entry : mapping.entrySet()) {
                cell(entry.getKey(), entry.getValue());
            }
            return this;
        }

        /**
         * Defines every cell of the rectangle with the same walls; later {@code cell} calls
         * override individual cells.
         */
        public Builder fill(CellWalls walls) {
            for (int r = 0; r < Math.max(rows, 0); r++) {
                for (int c = 0; c < Math.max(cols, 0); c++) {
                    cell(new Position(r, c), walls);
                }
            }
            return this;
        }

        /**
         * Overrides the fixed endpoints. Defaults to {@link MazeEndpoints#defaults()}.
         */
        public Builder endpoints(MazeEndpoints endpoints) {
            this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
            return this;
        }

        /**
         * Records a documentary start marker found in the source encoding.
         */
        public Builder markedStart(Position pos) {
            this.markedStart = pos;
            return this;
        }

        /**
         * Records a documentary goal marker found in the source encoding.
         */
        public Builder markedGoal(Position pos) {
            this.markedGoal = pos;
            return this;
        }

        /**
         * Validates the collected description and produces the immutable graph.
         *
         * @throws GridGraphException on bad dimensions, holes, out-of-bounds cells, null walls,
         * out-of-bounds endpoints or endpoint marker mismatch.
         */
        public GridGraph build() {
            if (rows <= 0 || cols <= 0) {
                throw malformed(REASON_INVALID_DIMENSIONS,
                        "grid dimensions must be positive, got " + rows + "x" + cols);
            }
            if ((long) rows * cols > Integer.MAX_VALUE) {
                throw malformed(REASON_INVALID_DIMENSIONS,
                        "grid too large: " + rows + "x" + cols);
            }

            CellWalls[] dense = new CellWalls[rows * cols];
            for (Map.Entry<Position, CellWalls> entry : cells.entrySet()) {
                Position pos = entry.getKey();
                if (pos.row() < 0 || pos.row() >= rows || pos.col() < 0 || pos.col() >= cols) {
                    throw malformed(REASON_CELL_OUT_OF_BOUNDS,
                            "cell " + pos + " outside " + rows + "x" + cols + " grid");
                }
                if (entry.getValue() == null) {
                    throw malformed(REASON_CELL_WALLS_REQUIRED,
                            "cell " + pos + " has no directional flags");
                }
                dense[pos.row() * cols + pos.col()] = entry.getValue();
            }
            for (int i = 0; i < dense.length; i++) {
                if (dense[i] == null) {
                    throw malformed(REASON_MISSING_CELL,
                            "cell (" + (i / cols) + "," + (i % cols) + ") is undefined; grid must be a complete rectangle");
                }
            }

            MazeEndpoints fixed = endpoints != null ? endpoints : MazeEndpoints.defaults();
            requireEndpointInBounds("start", fixed.start());
            requireEndpointInBounds("goal", fixed.goal());
            if (markedStart != null && !markedStart.equals(fixed.start())) {
                throw new GridGraphException(
                        GridGraphException.Kind.START_GOAL_MISMATCH,
                        REASON_START_MISMATCH,
                        "start marker at " + markedStart + " but maze start is fixed at " + fixed.start()
                );
            }
            if (markedGoal != null && !markedGoal.equals(fixed.goal())) {
                throw new GridGraphException(
                        GridGraphException.Kind.START_GOAL_MISMATCH,
                        REASON_GOAL_MISMATCH,
                        "goal marker at " + markedGoal + " but maze goal is fixed at " + fixed.goal()
                );
            }

            GridGraph graph = new GridGraph(rows, cols, dense, fixed.start(), fixed.goal());
            log.debug("Built {}", graph);
            return graph;
        }

        private void requireEndpointInBounds(String name, Position pos) {
            if (pos.row() < 0 || pos.row() >= rows || pos.col() < 0 || pos.col() >= cols) {
                throw malformed(REASON_ENDPOINT_OUT_OF_BOUNDS,
                        name + " " + pos + " outside " + rows + "x" + cols + " grid");
            }
        }

        private static GridGraphException malformed(String reasonCode, String message) {
            return new GridGraphException(GridGraphException.Kind.MALFORMED_GRAPH, reasonCode, message);
        }
    }
}
