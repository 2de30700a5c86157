package org.sweep.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Immutable rectangular terrain grid.
 *
 * <p>Cells are stored row-major in a flat array; {@link #cellIndex(int, int)} exposes the same
 * dense {@code row * columnCount + col} numbering the search uses for path labels.
 * Collectibles receive indices {@code [0, k)} in row-major discovery order.</p>
 *
 * <p>Instances are only produced by {@link #parse(List)}, which validates all structural
 * invariants before anything is returned.</p>
 */
@Accessors(fluent = true)
public final class SweepGrid {
    public static final String REASON_ROWS_REQUIRED = "GRID_ROWS_REQUIRED";
    public static final String REASON_EMPTY = "GRID_EMPTY";
    public static final String REASON_RAGGED_ROWS = "GRID_RAGGED_ROWS";
    public static final String REASON_UNKNOWN_SYMBOL = "GRID_UNKNOWN_SYMBOL";
    public static final String REASON_START_MISSING = "GRID_START_MISSING";
    public static final String REASON_START_DUPLICATE = "GRID_START_DUPLICATE";
    public static final String REASON_TOO_MANY_COLLECTIBLES = "GRID_TOO_MANY_COLLECTIBLES";

    /**
     * Largest supported collectible count. Masks are {@code long} bitsets using bits 0..62.
     */
    public static final int MAX_COLLECTIBLES = Long.SIZE - 1;

    @Getter
    private final int rowCount;
    @Getter
    private final int columnCount;
    @Getter
    private final GridCoordinate start;
    private final Cell[] cells;
    private final List<GridCoordinate> collectibles;

    private SweepGrid(int rowCount, int columnCount, GridCoordinate start, Cell[] cells, List<GridCoordinate> collectibles) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.start = start;
        this.cells = cells;
        this.collectibles = collectibles;
    }

    /**
     * Parses and validates textual grid rows.
     *
     * @param rows ordered rows of terrain symbols ({@code S . X R L}).
     * @return validated immutable grid.
     * @throws GridConfigurationException when rows are missing, ragged, contain unknown symbols,
     * do not hold exactly one start cell, or hold more than {@link #MAX_COLLECTIBLES} collectibles.
     */
    public static SweepGrid parse(List<String> rows) {
        if (rows == null) {
            throw new GridConfigurationException(REASON_ROWS_REQUIRED, "grid rows must be non-null");
        }
        if (rows.isEmpty()) {
            throw new GridConfigurationException(REASON_EMPTY, "grid must contain at least one row");
        }
        String firstRow = requireRow(rows, 0);
        int columnCount = firstRow.length();
        if (columnCount == 0) {
            throw new GridConfigurationException(REASON_EMPTY, "grid rows must contain at least one column");
        }

        int rowCount = rows.size();
        Cell[] cells = new Cell[rowCount * columnCount];
        List<GridCoordinate> collectibles = new ArrayList<>();
        GridCoordinate start = null;

        for (int row = 0; row < rowCount; row++) {
            String line = requireRow(rows, row);
            if (line.length() != columnCount) {
                throw new GridConfigurationException(
                        REASON_RAGGED_ROWS,
                        "row " + row + " has " + line.length() + " columns, expected " + columnCount
                );
            }
            for (int col = 0; col < columnCount; col++) {
                char symbol = line.charAt(col);
                CellType type = CellType.fromSymbol(symbol);
                if (type == null) {
                    throw new GridConfigurationException(
                            REASON_UNKNOWN_SYMBOL,
                            "unknown symbol '" + symbol + "' at (" + row + "," + col + ")"
                    );
                }
                Cell cell = switch (type) {
                    case EMPTY -> Cell.EMPTY;
                    case OBSTACLE -> Cell.OBSTACLE;
                    case RECHARGE -> Cell.RECHARGE;
                    case START -> {
                        if (start != null) {
                            throw new GridConfigurationException(
                                    REASON_START_DUPLICATE,
                                    "second start cell at (" + row + "," + col + "), first at " + start
                            );
                        }
                        start = new GridCoordinate(row, col);
                        yield Cell.START;
                    }
                    case COLLECTIBLE -> {
                        if (collectibles.size() == MAX_COLLECTIBLES) {
                            throw new GridConfigurationException(
                                    REASON_TOO_MANY_COLLECTIBLES,
                                    "at most " + MAX_COLLECTIBLES + " collectibles are supported"
                            );
                        }
                        Cell collectible = Cell.collectible(collectibles.size());
                        collectibles.add(new GridCoordinate(row, col));
                        yield collectible;
                    }
                };
                cells[row * columnCount + col] = cell;
            }
        }

        if (start == null) {
            throw new GridConfigurationException(REASON_START_MISSING, "grid has no start cell");
        }
        return new SweepGrid(rowCount, columnCount, start, cells, Collections.unmodifiableList(collectibles));
    }

    private static String requireRow(List<String> rows, int row) {
        String line = rows.get(row);
        if (line == null) {
            throw new GridConfigurationException(REASON_ROWS_REQUIRED, "row " + row + " must be non-null");
        }
        return line;
    }

    /**
     * Returns whether {@code (row, col)} lies inside the grid.
     */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < rowCount && col >= 0 && col < columnCount;
    }

    /**
     * Returns the cell at {@code (row, col)}.
     *
     * @throws IndexOutOfBoundsException when the coordinate is outside the grid.
     */
    public Cell cellAt(int row, int col) {
        return cells[checkedIndex(row, col)];
    }

    /**
     * Returns the collectible index at {@code (row, col)}, or empty for any other cell.
     */
    public OptionalInt collectibleIndex(int row, int col) {
        Cell cell = cellAt(row, col);
        return cell.isCollectible() ? OptionalInt.of(cell.collectibleIndex()) : OptionalInt.empty();
    }

    /**
     * Returns the dense row-major index of {@code (row, col)}.
     */
    public int cellIndex(int row, int col) {
        return checkedIndex(row, col);
    }

    /**
     * Inverse of {@link #cellIndex(int, int)}.
     */
    public GridCoordinate coordinateOf(int cellIndex) {
        if (cellIndex < 0 || cellIndex >= cells.length) {
            throw new IndexOutOfBoundsException("cell index " + cellIndex + " out of bounds (size: " + cells.length + ")");
        }
        return new GridCoordinate(cellIndex / columnCount, cellIndex % columnCount);
    }

    public int cellCount() {
        return cells.length;
    }

    public int collectibleCount() {
        return collectibles.size();
    }

    /**
     * Returns collectible coordinates ordered by collectible index.
     */
    public List<GridCoordinate> collectibles() {
        return collectibles;
    }

    /**
     * Mask with one bit set per collectible: {@code (1 << k) - 1}.
     */
    public long fullMask() {
        return (1L << collectibles.size()) - 1;
    }

    private int checkedIndex(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IndexOutOfBoundsException(
                    "(" + row + "," + col + ") outside " + rowCount + "x" + columnCount + " grid"
            );
        }
        return row * columnCount + col;
    }
}
