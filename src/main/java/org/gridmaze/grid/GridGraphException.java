package org.gridmaze.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Grid construction and adjacency contract failure with deterministic reason codes.
 */
@Getter
@Accessors(fluent = true)
public final class GridGraphException extends RuntimeException {

    /**
     * Failure families surfaced by the grid layer.
     */
    public enum Kind {
        /** Incomplete rectangle, bad dimensions or bad directional encoding. */
        MALFORMED_GRAPH,
        /** Documentary start/goal markers disagree with the fixed maze endpoints. */
        START_GOAL_MISMATCH,
        /** Step cost queried for a pair that is not a permitted move. */
        INVALID_STEP
    }

    private final Kind kind;
    private final String reasonCode;

    /**
     * Creates a reason-coded grid failure.
     *
     * @param kind failure family.
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GridGraphException(Kind kind, String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
