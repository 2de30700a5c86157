package org.sweep.search;

/**
 * Orthogonal unit moves, declared in the order successors are generated.
 */
public enum Direction {
    /** Increase row. */
    DOWN(1, 0),
    /** Decrease row. */
    UP(-1, 0),
    /** Increase column. */
    RIGHT(0, 1),
    /** Decrease column. */
    LEFT(0, -1);

    private static final Direction[] EXPANSION_ORDER = values();

    /** Row delta when moving in this direction. */
    public final int dRow;

    /** Column delta when moving in this direction. */
    public final int dCol;

    Direction(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }

    /**
     * Shared expansion order. Callers must not mutate the returned array.
     */
    static Direction[] expansionOrder() {
        return EXPANSION_ORDER;
    }
}
