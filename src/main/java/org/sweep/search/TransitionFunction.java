package org.sweep.search;

import org.sweep.grid.Cell;
import org.sweep.grid.SweepGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pure successor generator for {@code (row, col, mask, energy)} states.
 *
 * <p>Per direction, in {@link Direction} declaration order:</p>
 * <ul>
 * <li>Out-of-bounds and obstacle destinations are dropped.</li>
 * <li>Energy is decremented by one; a move that would end below zero is dropped,
 * even when the destination is a recharge cell.</li>
 * <li>Recharge destinations then reset energy to the configured maximum.</li>
 * <li>Collectible destinations set their bit in the mask (idempotent).</li>
 * </ul>
 */
public final class TransitionFunction {
    private final SweepGrid grid;
    private final int maxEnergy;

    /**
     * Binds the transition rules to one grid and energy ceiling.
     *
     * @param grid immutable grid.
     * @param maxEnergy energy restored by recharge cells. A negative ceiling is accepted;
     * such a search simply has no affordable move.
     */
    public TransitionFunction(SweepGrid grid, int maxEnergy) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.maxEnergy = maxEnergy;
    }

    /**
     * Returns all valid successors of one state.
     *
     * @param state current position and collection mask.
     * @param energy energy held on arrival at the current state.
     * @return up to four candidates in expansion order.
     */
    public List<StateTransition> successors(SweepState state, int energy) {
        Objects.requireNonNull(state, "state");
        List<StateTransition> out = new ArrayList<>(4);
        for (Direction direction : Direction.expansionOrder()) {
            int nextRow = state.row() + direction.dRow;
            int nextCol = state.col() + direction.dCol;
            if (!grid.inBounds(nextRow, nextCol)) {
                continue;
            }
            Cell cell = grid.cellAt(nextRow, nextCol);
            if (cell.isObstacle()) {
                continue;
            }

            int nextEnergy = energy - 1;
            if (nextEnergy < 0) {
                continue;
            }
            if (cell.isRecharge()) {
                nextEnergy = maxEnergy;
            }

            long nextMask = state.mask();
            if (cell.isCollectible()) {
                nextMask |= 1L << cell.collectibleIndex();
            }
            out.add(new StateTransition(direction, new SweepState(nextRow, nextCol, nextMask), nextEnergy));
        }
        return out;
    }

    public int maxEnergy() {
        return maxEnergy;
    }
}
