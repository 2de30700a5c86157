package org.sweep.grid;

import java.util.Objects;

/**
 * Immutable grid cell.
 *
 * @param type terrain type.
 * @param collectibleIndex dense collectible index, or {@link #NO_INDEX} for non-collectible cells.
 */
public record Cell(CellType type, int collectibleIndex) {
    public static final int NO_INDEX = -1;

    public static final Cell EMPTY = new Cell(CellType.EMPTY, NO_INDEX);
    public static final Cell START = new Cell(CellType.START, NO_INDEX);
    public static final Cell OBSTACLE = new Cell(CellType.OBSTACLE, NO_INDEX);
    public static final Cell RECHARGE = new Cell(CellType.RECHARGE, NO_INDEX);

    public Cell {
        Objects.requireNonNull(type, "type");
        if (type == CellType.COLLECTIBLE) {
            if (collectibleIndex < 0) {
                throw new IllegalArgumentException("collectible index must be >= 0, got " + collectibleIndex);
            }
        } else if (collectibleIndex != NO_INDEX) {
            throw new IllegalArgumentException(type + " cell cannot carry a collectible index");
        }
    }

    /**
     * Creates a collectible cell with the given dense index.
     */
    public static Cell collectible(int index) {
        return new Cell(CellType.COLLECTIBLE, index);
    }

    public boolean isObstacle() {
        return type == CellType.OBSTACLE;
    }

    public boolean isRecharge() {
        return type == CellType.RECHARGE;
    }

    public boolean isCollectible() {
        return type == CellType.COLLECTIBLE;
    }
}
