package org.gridmaze.core;

import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Judges another search run against breadth-first ground truth.
 *
 * <p>Each evaluation runs a fresh BFS with its own metrics instance, so the extra cost is
 * paid only when a caller opts in.</p>
 * <ul>
 * <li><strong>complete</strong>: the run found a path exactly when ground truth says one exists.</li>
 * <li><strong>optimal</strong>: both found a path and the costs match. {@code false} when
 * reachability disagrees, {@code null} when neither side found a path.</li>
 * </ul>
 */
public final class OptimalityOracle {
    private static final Logger log = LoggerFactory.getLogger(OptimalityOracle.class);

    private final SearchPlanner referencePlanner = new BreadthFirstPlanner();

    /**
     * Ground-truth reachability and shortest cost.
     *
     * @param reachable whether any path from start to goal exists.
     * @param cost shortest path cost, or {@code -1} when unreachable.
     */
    public record GroundTruth(boolean reachable, int cost) {
    }

    /**
     * Runs the reference search on {@code graph}.
     */
    public GroundTruth groundTruth(GridGraph graph) {
        Objects.requireNonNull(graph, "graph");
        List<Position> path = referencePlanner.plan(graph, null, new SearchMetrics());
        if (path.isEmpty()) {
            return new GroundTruth(false, -1);
        }
        return new GroundTruth(true, graph.pathCost(path));
    }

    /**
     * Fills {@code complete} and {@code optimal} of a finished run.
     *
     * @param graph graph the run searched.
     * @param metrics metrics of the run, with {@code found} and {@code pathCost} already recorded.
     * @return the ground truth used for the verdict.
     */
    public GroundTruth evaluate(GridGraph graph, SearchMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics");
        GroundTruth truth = groundTruth(graph);

        boolean complete = truth.reachable() == metrics.found();
        Boolean optimal;
        if (truth.reachable() && metrics.found()) {
            optimal = metrics.pathCost() == truth.cost();
        } else if (!truth.reachable() && !metrics.found()) {
            optimal = null;
        } else {
            optimal = Boolean.FALSE;
        }
        metrics.recordEvaluation(complete, optimal);

        if (!complete) {
            log.warn("Reachability disagreement on {}: ground truth reachable={}, run found={}",
                    graph, truth.reachable(), metrics.found());
        }
        return truth;
    }
}
