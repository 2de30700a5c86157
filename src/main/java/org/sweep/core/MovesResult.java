package org.sweep.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.sweep.grid.GridCoordinate;
import org.sweep.search.TraversalPhase;

import java.util.List;

/**
 * Client-facing planning response.
 *
 * <p>When unreachable, {@code moves} is {@link #UNREACHABLE} and {@code path} is empty.</p>
 */
@Value
@Builder
public class MovesResult {
    public static final int UNREACHABLE = -1;

    /** Minimal move count, or {@link #UNREACHABLE}. */
    int moves;
    /** Terminal traversal phase. */
    TraversalPhase phase;
    /** Number of collectibles on the grid. */
    int collectibleCount;
    /** Number of dequeued frontier entries. */
    int expandedStates;
    /** Frontier high-water mark. */
    int peakFrontierSize;
    /** Distinct {@code (cell, mask)} states recorded. */
    int dominanceEntries;
    /** Cells visited from start to the last collectible, {@code moves + 1} entries. */
    @Singular("pathCell")
    List<GridCoordinate> path;

    public boolean isReachable() {
        return moves != UNREACHABLE;
    }
}
