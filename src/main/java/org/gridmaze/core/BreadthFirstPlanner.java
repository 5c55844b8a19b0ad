package org.gridmaze.core;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.gridmaze.heuristic.Heuristic;
import org.gridmaze.search.VisitedSet;

import java.util.List;

/**
 * Breadth-first planner.
 *
 * <p>Cells are marked visited when they are generated (pushed), not when they are
 * expanded, so each cell enters the FIFO at most once and the first time the goal is
 * dequeued its parent chain has the minimum number of moves. This planner is also the
 * ground truth used by {@link OptimalityOracle}.</p>
 */
final class BreadthFirstPlanner implements SearchPlanner {

    @Override
    public List<Position> plan(GridGraph graph, Heuristic heuristic, SearchMetrics metrics) {
        int startIndex = graph.indexOf(graph.start());
        int goalIndex = graph.indexOf(graph.goal());

        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        VisitedSet visited = new VisitedSet(graph.cellCount());
        ParentTable parents = new ParentTable(graph.cellCount());
        GridGraph.NeighborCursor cursor = graph.cursor();

        queue.enqueue(startIndex);
        visited.markVisited(startIndex);
        metrics.recordGenerated();
        metrics.observeFrontier(queue.size());
        metrics.observeExplored(visited.size());

        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            metrics.observeFrontier(queue.size());
            if (current == goalIndex) {
                return parents.pathTo(graph, startIndex, goalIndex);
            }

            metrics.recordExpanded();
            cursor.reset(current);
            while (cursor.hasNext()) {
                int next = cursor.next();
                if (!visited.markVisited(next)) {
                    continue;
                }
                parents.link(next, current);
                queue.enqueue(next);
                metrics.recordGenerated();
                metrics.observeFrontier(queue.size());
                metrics.observeExplored(visited.size());
            }
        }
        return List.of();
    }
}
