package org.gridmaze.core;

import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.gridmaze.heuristic.Heuristic;
import org.gridmaze.search.PriorityFrontier;
import org.gridmaze.search.VisitedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Best-first planner shared by A* and greedy best-first search.
 *
 * <p>The two strategies differ only in the frontier key, supplied as a {@link PriorityKey}:</p>
 * <ul>
 * <li>A*: {@code g + h}.</li>
 * <li>Greedy: {@code h}.</li>
 * </ul>
 *
 * <p>Expanded cells are closed and never reopened. When a cheaper {@code g} reaches a cell
 * still in the frontier, its parent is updated; if that changes the key, the old entry is
 * invalidated in the {@link PriorityFrontier} and a new one is pushed.</p>
 *
 * <p>The explored figure reported to {@link SearchMetrics} is the set of generated cells, the
 * same set BFS and DFS report. The closed set only drives the never-reopen rule.</p>
 */
final class BestFirstPlanner implements SearchPlanner {
    private static final Logger log = LoggerFactory.getLogger(BestFirstPlanner.class);

    private static final int UNREACHED = Integer.MAX_VALUE;
    private static final int NO_ENTRY = -1;

    /**
     * Frontier key as a function of cost-so-far and heuristic estimate.
     */
    @FunctionalInterface
    interface PriorityKey {
        double of(int costSoFar, double estimate);
    }

    static final PriorityKey A_STAR_KEY = (g, h) -> g + h;
    static final PriorityKey GREEDY_KEY = (g, h) -> h;

    private final PriorityKey priorityKey;

    BestFirstPlanner(PriorityKey priorityKey) {
        this.priorityKey = Objects.requireNonNull(priorityKey, "priorityKey");
    }

    static BestFirstPlanner aStar() {
        return new BestFirstPlanner(A_STAR_KEY);
    }

    static BestFirstPlanner greedy() {
        return new BestFirstPlanner(GREEDY_KEY);
    }

    @Override
    public List<Position> plan(GridGraph graph, Heuristic heuristic, SearchMetrics metrics) {
        Objects.requireNonNull(heuristic, "heuristic");
        Position goal = graph.goal();
        int startIndex = graph.indexOf(graph.start());
        int goalIndex = graph.indexOf(goal);
        int cellCount = graph.cellCount();

        int[] bestG = new int[cellCount];
        int[] liveEntry = new int[cellCount];
        Arrays.fill(bestG, UNREACHED);
        Arrays.fill(liveEntry, NO_ENTRY);

        PriorityFrontier frontier = new PriorityFrontier(cellCount);
        VisitedSet closed = new VisitedSet(cellCount);
        VisitedSet generated = new VisitedSet(cellCount);
        Clamp clamp = new Clamp();
        ParentTable parents = new ParentTable(cellCount);
        GridGraph.NeighborCursor cursor = graph.cursor();

        bestG[startIndex] = 0;
        liveEntry[startIndex] = frontier.push(startIndex, priority(graph, heuristic, startIndex, 0, goal, clamp));
        generated.markVisited(startIndex);
        metrics.recordGenerated();
        metrics.observeFrontier(frontier.size());
        metrics.observeExplored(generated.size());

        while (!frontier.isEmpty()) {
            int current = frontier.pollCell();
            liveEntry[current] = NO_ENTRY;
            metrics.observeFrontier(frontier.size());
            if (current == goalIndex) {
                clamp.report(graph);
                return parents.pathTo(graph, startIndex, goalIndex);
            }

            closed.markVisited(current);
            metrics.recordExpanded();

            int currentG = bestG[current];
            cursor.reset(current);
            while (cursor.hasNext()) {
                int next = cursor.next();
                if (closed.isVisited(next)) {
                    continue;
                }
                int tentativeG = currentG + graph.stepCost(current, next);
                if (tentativeG >= bestG[next]) {
                    continue;
                }

                boolean discovered = bestG[next] == UNREACHED;
                bestG[next] = tentativeG;
                parents.link(next, current);
                double key = priority(graph, heuristic, next, tentativeG, goal, clamp);

                if (discovered) {
                    liveEntry[next] = frontier.push(next, key);
                    generated.markVisited(next);
                    metrics.recordGenerated();
                    metrics.observeExplored(generated.size());
                } else if (Double.compare(frontier.priorityOf(liveEntry[next]), key) != 0) {
                    // Lazy decrease-key: the stale entry is skipped when it surfaces.
                    frontier.invalidate(liveEntry[next]);
                    liveEntry[next] = frontier.push(next, key);
                }
                metrics.observeFrontier(frontier.size());
            }
        }
        clamp.report(graph);
        return List.of();
    }

    /**
     * Computes the frontier key, clamping invalid heuristic output to zero so queue
     * ordering stays numerically safe.
     */
    private double priority(GridGraph graph, Heuristic heuristic, int cellIndex, int costSoFar, Position goal,
                            Clamp clamp) {
        double estimate = heuristic.estimate(graph.positionOf(cellIndex), goal);
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            clamp.record(cellIndex, estimate);
            estimate = 0.0d;
        }
        return priorityKey.of(costSoFar, estimate);
    }

    /**
     * Counts clamped estimates of one search; reported once when the search ends.
     */
    private static final class Clamp {
        private int count;
        private int firstCell = -1;
        private double firstValue;

        void record(int cellIndex, double estimate) {
            if (count++ == 0) {
                firstCell = cellIndex;
                firstValue = estimate;
            }
        }

        void report(GridGraph graph) {
            if (count > 0) {
                log.debug("Clamped {} invalid heuristic estimate(s) to 0 on {}; first was {} at {}",
                        count, graph, firstValue, graph.positionOf(firstCell));
            }
        }
    }
}
