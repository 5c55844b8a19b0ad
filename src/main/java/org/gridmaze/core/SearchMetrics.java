package org.gridmaze.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Performance and quality counters for one search invocation.
 *
 * <p>A fresh instance is created per call and owned by that call only. Planners update it
 * at fixed instrumentation points:</p>
 * <ul>
 * <li>{@code generated}: a cell is newly placed into the frontier (the seeded start counts).</li>
 * <li>{@code expanded}: a cell is taken from the frontier and its neighbors are inspected.</li>
 * <li>peaks: observed after every frontier insertion/removal and every growth of the explored
 * (generated-cell) set, which is the same set for all four strategies.</li>
 * </ul>
 *
 * <p>{@link #peakStructures()} is the sum of the frontier and explored peaks, each tracked
 * independently. The two peaks need not occur at the same moment.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SearchMetrics {
    private long elapsedNanos;
    private int expanded;
    private int generated;
    private int peakFrontier;
    private int peakExplored;
    private boolean found;
    /** {@code null} until an oracle evaluation ran. */
    private Boolean complete;
    /** {@code null} until an oracle evaluation ran, and when neither side found a path. */
    private Boolean optimal;
    private int pathCost;
    /** Number of moves on the path; 0 when nothing was found. */
    private int pathLength;

    void recordGenerated() {
        generated++;
    }

    void recordExpanded() {
        expanded++;
    }

    void observeFrontier(int frontierSize) {
        if (frontierSize > peakFrontier) {
            peakFrontier = frontierSize;
        }
    }

    void observeExplored(int exploredSize) {
        if (exploredSize > peakExplored) {
            peakExplored = exploredSize;
        }
    }

    void recordElapsed(long nanos) {
        this.elapsedNanos = Math.max(0L, nanos);
    }

    void recordOutcome(boolean found, int pathCost, int pathLength) {
        this.found = found;
        this.pathCost = pathCost;
        this.pathLength = pathLength;
    }

    void recordEvaluation(Boolean complete, Boolean optimal) {
        this.complete = complete;
        this.optimal = optimal;
    }

    public int peakStructures() {
        return peakFrontier + peakExplored;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0d;
    }

    /**
     * Returns whether every counter except elapsed time matches {@code other}.
     */
    public boolean sameCounters(SearchMetrics other) {
        return other != null
                && expanded == other.expanded
                && generated == other.generated
                && peakFrontier == other.peakFrontier
                && peakExplored == other.peakExplored
                && found == other.found
                && Objects.equals(complete, other.complete)
                && Objects.equals(optimal, other.optimal)
                && pathCost == other.pathCost
                && pathLength == other.pathLength;
    }

    @Override
    public String toString() {
        return "SearchMetrics{" +
                "timeMs=" + String.format("%.3f", elapsedMillis()) +
                ", expanded=" + expanded +
                ", generated=" + generated +
                ", peakFrontier=" + peakFrontier +
                ", peakExplored=" + peakExplored +
                ", peakStructures=" + peakStructures() +
                ", found=" + found +
                ", complete=" + complete +
                ", optimal=" + optimal +
                ", cost=" + pathCost +
                ", length=" + pathLength +
                '}';
    }
}
