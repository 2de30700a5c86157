package org.sweep.search;

import org.sweep.grid.GridCoordinate;

import java.util.List;

/**
 * Terminal result of one traversal.
 *
 * @param phase terminal phase ({@link TraversalPhase#FOUND} or {@link TraversalPhase#EXHAUSTED}).
 * @param moves minimal move count, or {@link TraversalScheduler#UNREACHABLE}.
 * @param expandedStates number of frontier entries dequeued.
 * @param peakFrontierSize high-water mark of the frontier.
 * @param dominanceEntries distinct states recorded in the dominance table.
 * @param path visited cells from start to the final cell (empty when exhausted).
 */
public record TraversalOutcome(
        TraversalPhase phase,
        int moves,
        int expandedStates,
        int peakFrontierSize,
        int dominanceEntries,
        List<GridCoordinate> path
) {
    public TraversalOutcome {
        if (phase == null || phase == TraversalPhase.EXPLORING) {
            throw new IllegalArgumentException("outcome phase must be terminal, got " + phase);
        }
        path = List.copyOf(path);
    }

    /**
     * Creates a canonical exhausted outcome.
     */
    static TraversalOutcome exhausted(int expandedStates, int peakFrontierSize, int dominanceEntries) {
        return new TraversalOutcome(
                TraversalPhase.EXHAUSTED,
                TraversalScheduler.UNREACHABLE,
                expandedStates,
                peakFrontierSize,
                dominanceEntries,
                List.of()
        );
    }

    public boolean found() {
        return phase == TraversalPhase.FOUND;
    }
}
