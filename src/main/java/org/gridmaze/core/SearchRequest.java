package org.gridmaze.core;

import lombok.Builder;
import lombok.Value;
import org.gridmaze.heuristic.Heuristic;
import org.gridmaze.heuristic.HeuristicType;

/**
 * Client-facing search request.
 *
 * <p>Informed algorithms take either a {@code heuristicType} or a caller-supplied
 * {@code heuristic} (reported as {@link HeuristicType#CUSTOM}). Unset instrumentation
 * flags fall back to the engine's {@link SearchOptions}.</p>
 */
@Value
@Builder
public class SearchRequest {
    /** Search algorithm to execute. */
    SearchAlgorithm algorithm;
    /** Stock heuristic to use (A* and Greedy only). */
    HeuristicType heuristicType;
    /** Custom heuristic; takes precedence over {@code heuristicType}. */
    Heuristic heuristic;
    /** Return metrics with the result; {@code null} uses the engine default. */
    Boolean withMetrics;
    /** Judge the result against BFS; {@code null} uses the engine default. */
    Boolean computeOptimality;
}
