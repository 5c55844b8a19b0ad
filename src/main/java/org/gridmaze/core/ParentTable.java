package org.gridmaze.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parent pointers by dense cell index, used to backtrack the found path.
 */
final class ParentTable {
    static final int NO_PARENT = -1;

    private final int[] parentByCell;

    ParentTable(int cellCount) {
        this.parentByCell = new int[cellCount];
        Arrays.fill(parentByCell, NO_PARENT);
    }

    void link(int cellIndex, int parentIndex) {
        parentByCell[cellIndex] = parentIndex;
    }

    /**
     * Walks parent pointers from {@code goalIndex} back to {@code startIndex} and returns the
     * positions in start-to-goal order.
     *
     * @throws IllegalStateException if the chain breaks before reaching the start.
     */
    List<Position> pathTo(GridGraph graph, int startIndex, int goalIndex) {
        IntArrayList reversed = new IntArrayList();
        int cursor = goalIndex;
        reversed.add(cursor);
        while (cursor != startIndex) {
            cursor = parentByCell[cursor];
            if (cursor == NO_PARENT || reversed.size() > parentByCell.length) {
                throw new IllegalStateException("parent chain from " + graph.positionOf(goalIndex)
                        + " does not reach start " + graph.positionOf(startIndex));
            }
            reversed.add(cursor);
        }

        List<Position> path = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            path.add(graph.positionOf(reversed.getInt(i)));
        }
        return path;
    }
}
