package org.sweep.grid;

/**
 * Zero-based {@code (row, col)} position inside a grid.
 */
public record GridCoordinate(int row, int col) {

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
