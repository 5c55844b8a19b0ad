package org.gridmaze.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables guidance (zero estimate).</p>
 * <p>{@code MANHATTAN} and {@code EUCLIDEAN} are grid distances between coordinates.</p>
 * <p>{@code CUSTOM} marks a caller-supplied {@link Heuristic} instance.</p>
 */
public enum HeuristicType {
    NONE,
    MANHATTAN,
    EUCLIDEAN,
    CUSTOM
}
