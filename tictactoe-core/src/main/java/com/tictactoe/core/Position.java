package com.tictactoe.core;

/**
 * Zero-based board coordinate.
 */
public record Position(int row, int col) {

    public Position {
        if (row < 0 || row >= Board.SIZE || col < 0 || col >= Board.SIZE) {
            throw new IllegalArgumentException("Position out of range: (" + row + ", " + col + ")");
        }
    }

    /**
     * Maps a console move number in {@code 1..9} to its coordinate.
     */
    public static Position fromMoveNumber(int moveNumber) {
        if (moveNumber < 1 || moveNumber > Board.CELL_COUNT) {
            throw new IllegalArgumentException("Move number must be between 1 and " + Board.CELL_COUNT
                    + ": " + moveNumber);
        }
        int index = moveNumber - 1;
        return new Position(index / Board.SIZE, index % Board.SIZE);
    }

    /**
     * Returns the console move number in {@code 1..9}.
     */
    public int toMoveNumber() {
        return index() + 1;
    }

    /**
     * Returns the row-major index in {@code 0..8}.
     */
    public int index() {
        return row * Board.SIZE + col;
    }
}
