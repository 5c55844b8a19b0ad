package org.gridmaze.core;

import lombok.Getter;

/**
 * Search strategy selector used by {@link MazeSearchEngine}.
 */
@Getter
public enum SearchAlgorithm {
    BFS("BFS", false),        // FIFO, shortest path in edges
    DFS("DFS", false),        // LIFO, first path found
    A_STAR("A*", true),       // f = g + h
    GREEDY("Greedy", true);   // f = h (ignores cost so far)

    private final String displayName;
    private final boolean informed;

    SearchAlgorithm(String displayName, boolean informed) {
        this.displayName = displayName;
        this.informed = informed;
    }
}
