package org.sweep.search;

/**
 * Search state: a grid position plus the set of collectibles gathered so far.
 *
 * <p>Energy is deliberately not part of the state; it is tracked per arrival and compared
 * through {@link DominanceTable}.</p>
 *
 * @param row grid row.
 * @param col grid column.
 * @param mask collection mask, bit {@code i} set once collectible {@code i} was gathered.
 */
public record SweepState(int row, int col, long mask) {

    /**
     * Returns whether every bit of {@code fullMask} is collected.
     */
    public boolean collectedAll(long fullMask) {
        return mask == fullMask;
    }
}
