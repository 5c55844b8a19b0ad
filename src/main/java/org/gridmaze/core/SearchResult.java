package org.gridmaze.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.gridmaze.grid.Position;
import org.gridmaze.heuristic.HeuristicType;

import java.util.List;

/**
 * Outcome of one search invocation.
 *
 * <p>When {@code found()} is false, {@code path} is empty. {@code metrics} is {@code null}
 * unless metrics or an optimality check were requested.</p>
 */
@Value
@Builder
public class SearchResult {
    /** Strategy that produced this result. */
    SearchAlgorithm algorithm;
    /** Heuristic that guided the search ({@code NONE} for BFS/DFS). */
    HeuristicType heuristicType;
    /** Positions from start to goal inclusive. */
    @Singular("pathPosition")
    List<Position> path;
    /** Instrumentation for this run, or {@code null}. */
    SearchMetrics metrics;

    public boolean found() {
        return !path.isEmpty();
    }

    /**
     * @return number of moves on the path, or 0 when nothing was found.
     */
    public int cost() {
        return path.isEmpty() ? 0 : path.size() - 1;
    }
}
