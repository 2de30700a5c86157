package org.sweep.search;

/**
 * Thrown when polling an empty {@link SweepFrontier}.
 */
public class EmptyFrontierException extends IllegalStateException {
    public EmptyFrontierException(String message) {
        super(message);
    }
}
