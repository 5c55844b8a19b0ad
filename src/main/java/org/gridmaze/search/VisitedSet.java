package org.gridmaze.search;

import java.util.BitSet;

/**
 * A memory-efficient set of visited grid cells.
 * <p>
 * Wraps a {@link java.util.BitSet} for O(1) membership tests (~1 bit per cell) and keeps
 * a running cardinality so planners can report explored-set size without rescanning.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single search invocation.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;
    private int size;

    /**
     * @param cellCount number of cells in the grid being searched.
     */
    public VisitedSet(int cellCount) {
        if (cellCount < 0) {
            throw new IllegalArgumentException("cellCount must be non-negative");
        }
        this.visited = new BitSet(cellCount);
    }

    /**
     * Marks a cell as visited if it hasn't been visited already.
     *
     * @param cellIndex dense cell index.
     * @return {@code true} if the cell was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int cellIndex) {
        if (visited.get(cellIndex)) {
            return false;
        }
        visited.set(cellIndex);
        size++;
        return true;
    }

    public boolean isVisited(int cellIndex) {
        return visited.get(cellIndex);
    }

    /**
     * @return number of distinct cells marked so far.
     */
    public int size() {
        return size;
    }

    /**
     * Resets the set for reuse.
     */
    public void clear() {
        visited.clear();
        size = 0;
    }
}
