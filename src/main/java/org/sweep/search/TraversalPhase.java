package org.sweep.search;

/**
 * Lifecycle of one traversal.
 *
 * <p>{@code EXPLORING} is the only non-terminal phase. {@code FOUND} means a state holding
 * every collectible was dequeued; {@code EXHAUSTED} means the frontier drained first.</p>
 */
public enum TraversalPhase {
    EXPLORING,
    FOUND,
    EXHAUSTED
}
