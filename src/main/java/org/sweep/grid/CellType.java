package org.sweep.grid;

/**
 * Terrain classification of one grid cell.
 *
 * <p>Each constant owns the single symbol used for it in textual grid rows.</p>
 */
public enum CellType {
    EMPTY('.'),
    START('S'),
    OBSTACLE('X'),
    RECHARGE('R'),
    COLLECTIBLE('L');

    private final char symbol;

    CellType(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the textual symbol for this terrain type.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Resolves a terrain symbol.
     *
     * @param symbol raw grid character.
     * @return matching terrain type, or {@code null} when the symbol is unknown.
     */
    static CellType fromSymbol(char symbol) {
        return switch (symbol) {
            case '.' -> EMPTY;
            case 'S' -> START;
            case 'X' -> OBSTACLE;
            case 'R' -> RECHARGE;
            case 'L' -> COLLECTIBLE;
            default -> null;
        };
    }
}
