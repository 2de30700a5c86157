package org.sweep.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Append-only per-search storage of accepted arrivals for path reconstruction.
 *
 * <p>Label ids are dense indexes and stay stable for predecessor chains even after a later
 * arrival dominates the state a label belongs to.</p>
 */
final class PathLabelStore {
    static final int NO_LABEL = -1;

    private final IntArrayList cellIndexByLabel = new IntArrayList();
    private final IntArrayList predecessorLabelByLabel = new IntArrayList();

    /**
     * Appends one label and returns its id.
     */
    int add(int cellIndex, int predecessorLabelId) {
        int labelId = cellIndexByLabel.size();
        cellIndexByLabel.add(cellIndex);
        predecessorLabelByLabel.add(predecessorLabelId);
        return labelId;
    }

    int size() {
        return cellIndexByLabel.size();
    }

    int cellIndex(int labelId) {
        return cellIndexByLabel.getInt(labelId);
    }

    int predecessorLabelId(int labelId) {
        return predecessorLabelByLabel.getInt(labelId);
    }

    /**
     * Returns cell indexes from the chain root to {@code terminalLabelId}.
     */
    int[] cellPath(int terminalLabelId) {
        IntArrayList reversed = new IntArrayList();
        int cursor = terminalLabelId;
        while (cursor != NO_LABEL) {
            reversed.add(cellIndex(cursor));
            cursor = predecessorLabelId(cursor);
        }
        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(reversed.size() - 1 - i);
        }
        return path;
    }
}
