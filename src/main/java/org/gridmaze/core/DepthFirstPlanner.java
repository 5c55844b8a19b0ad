package org.gridmaze.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.gridmaze.heuristic.Heuristic;
import org.gridmaze.search.VisitedSet;

import java.util.List;

/**
 * Iterative depth-first planner.
 *
 * <p>Neighbors are pushed in reverse N, S, E, W order so that the first direction in the
 * fixed order is popped first. Cells are marked visited at generation. No optimality
 * guarantee: the result is the first path the stack discipline reaches.</p>
 */
final class DepthFirstPlanner implements SearchPlanner {

    @Override
    public List<Position> plan(GridGraph graph, Heuristic heuristic, SearchMetrics metrics) {
        int startIndex = graph.indexOf(graph.start());
        int goalIndex = graph.indexOf(graph.goal());

        IntArrayList stack = new IntArrayList();
        IntArrayList ordered = new IntArrayList(4);
        VisitedSet visited = new VisitedSet(graph.cellCount());
        ParentTable parents = new ParentTable(graph.cellCount());
        GridGraph.NeighborCursor cursor = graph.cursor();

        stack.push(startIndex);
        visited.markVisited(startIndex);
        metrics.recordGenerated();
        metrics.observeFrontier(stack.size());
        metrics.observeExplored(visited.size());

        while (!stack.isEmpty()) {
            int current = stack.popInt();
            metrics.observeFrontier(stack.size());
            if (current == goalIndex) {
                return parents.pathTo(graph, startIndex, goalIndex);
            }

            metrics.recordExpanded();
            ordered.clear();
            cursor.reset(current);
            while (cursor.hasNext()) {
                ordered.add(cursor.next());
            }
            for (int i = ordered.size() - 1; i >= 0; i--) {
                int next = ordered.getInt(i);
                if (!visited.markVisited(next)) {
                    continue;
                }
                parents.link(next, current);
                stack.push(next);
                metrics.recordGenerated();
                metrics.observeFrontier(stack.size());
                metrics.observeExplored(visited.size());
            }
        }
        return List.of();
    }
}
