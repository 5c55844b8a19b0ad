package org.gridmaze.grid;

import java.util.Objects;

/**
 * Zero-based grid coordinate.
 *
 * @param row row index, growing southwards.
 * @param col column index, growing eastwards.
 */
public record Position(int row, int col) {

    /**
     * Returns the coordinate one step away in {@code direction}.
     *
     * <p>No bounds check is applied; the result may lie outside any grid.</p>
     */
    public Position shifted(Direction direction) {
        Objects.requireNonNull(direction, "direction");
        return new Position(row + direction.rowDelta(), col + direction.colDelta());
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
