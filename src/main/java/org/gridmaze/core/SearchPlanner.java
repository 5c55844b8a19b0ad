package org.gridmaze.core;

import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.gridmaze.heuristic.Heuristic;

import java.util.List;

/**
 * Internal planner abstraction shared by the four search strategies.
 */
interface SearchPlanner {
    /**
     * Searches from {@code graph.start()} to {@code graph.goal()}.
     *
     * <p>Implementations update the counters and peaks of {@code metrics} at the common
     * instrumentation points; timing and path summary fields are owned by the caller.</p>
     *
     * @param graph immutable maze.
     * @param heuristic goal estimate; ignored by uninformed planners.
     * @param metrics fresh per-invocation recorder.
     * @return path from start to goal inclusive, or an empty list when the goal is unreachable.
     */
    List<Position> plan(GridGraph graph, Heuristic heuristic, SearchMetrics metrics);
}
