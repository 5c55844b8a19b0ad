package org.gridmaze.search;

/**
 * Thrown when attempting to poll an exhausted {@link PriorityFrontier}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
