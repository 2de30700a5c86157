package org.sweep.search;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Per-search best-energy table keyed by {@link SweepState}.
 *
 * <p>An arrival is accepted only when it carries strictly more energy than any earlier
 * arrival at the same {@code (cell, mask)}. Since recorded energy per state only grows and is
 * bounded by the maximum energy, every state accepts at most {@code maxEnergy + 1} arrivals,
 * which is what makes the search terminate.</p>
 *
 * <p>Not thread-safe; owned by a single {@link TraversalScheduler#run(int)} call.</p>
 */
public final class DominanceTable {
    /** Recorded energy for states that were never reached. */
    public static final int UNKNOWN = Integer.MIN_VALUE;

    private final Object2IntOpenHashMap<SweepState> bestEnergyByState;

    /**
     * Creates an empty table.
     *
     * @param expectedStates sizing hint for the backing map.
     */
    public DominanceTable(int expectedStates) {
        this.bestEnergyByState = new Object2IntOpenHashMap<>(Math.max(expectedStates, 16));
        this.bestEnergyByState.defaultReturnValue(UNKNOWN);
    }

    /**
     * Records {@code energy} for {@code state} when it beats the recorded best.
     *
     * @return {@code true} when the arrival improves the table and must be explored,
     * {@code false} when it is dominated.
     */
    public boolean consider(SweepState state, int energy) {
        requireState(state);
        if (energy <= bestEnergyByState.getInt(state)) {
            return false;
        }
        bestEnergyByState.put(state, energy);
        return true;
    }

    /**
     * Unconditionally records the seed arrival of a search. Any energy is accepted, including a
     * negative one, which leaves the seed without affordable moves.
     */
    public void seed(SweepState state, int energy) {
        requireState(state);
        bestEnergyByState.put(state, energy);
    }

    /**
     * Returns the best recorded energy, or {@link #UNKNOWN}.
     */
    public int bestEnergy(SweepState state) {
        return bestEnergyByState.getInt(state);
    }

    /**
     * Number of distinct states recorded so far.
     */
    public int size() {
        return bestEnergyByState.size();
    }

    private static void requireState(SweepState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must be non-null");
        }
    }
}
