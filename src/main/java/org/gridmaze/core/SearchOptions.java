package org.gridmaze.core;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Engine-wide defaults for requests that leave instrumentation flags unset.
 */
@Value
@Builder
public class SearchOptions {
    public static final String PROP_WITH_METRICS = "gridmaze.search.withMetrics";
    public static final String PROP_COMPUTE_OPTIMALITY = "gridmaze.search.computeOptimality";

    /** Collect {@link SearchMetrics} for every run. */
    boolean withMetrics;
    /** Run the BFS oracle after every run. Implies metrics. */
    boolean computeOptimality;

    /**
     * Loads defaults from system properties. Unset or malformed values mean {@code false}.
     */
    public static SearchOptions defaults() {
        return SearchOptions.builder()
                .withMetrics(readFlag(PROP_WITH_METRICS))
                .computeOptimality(readFlag(PROP_COMPUTE_OPTIMALITY))
                .build();
    }

    private static boolean readFlag(String property) {
        String raw = System.getProperty(property);
        if (raw == null) {
            return false;
        }
        return "true".equals(raw.trim().toLowerCase(Locale.ROOT));
    }
}
