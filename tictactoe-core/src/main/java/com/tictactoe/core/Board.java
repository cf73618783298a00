package com.tictactoe.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 3×3 tic-tac-toe grid stored in row-major order.
 * Every update returns a new instance, so boards can be shared freely between search branches.
 */
public final class Board {

    public static final int SIZE = 3;
    public static final int CELL_COUNT = SIZE * SIZE;

    private final Cell[] cells;

    /**
     * Creates an empty board.
     */
    public Board() {
        this(emptyCells());
    }

    private Board(Cell[] cells) {
        this.cells = cells;
    }

    /**
     * Builds a board from three row strings. {@code O} marks the maximizer, {@code X} the minimizer,
     * and {@code .} or a blank an empty cell.
     */
    public static Board of(String... rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows but got " + rows.length);
        }
        Cell[] cells = new Cell[CELL_COUNT];
        for (int row = 0; row < SIZE; row++) {
            String line = Objects.requireNonNull(rows[row], "row");
            if (line.length() != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have " + SIZE + " cells: '" + line + "'");
            }
            for (int col = 0; col < SIZE; col++) {
                cells[row * SIZE + col] = parseCell(line.charAt(col));
            }
        }
        return new Board(cells);
    }

    /**
     * Returns the content of the cell at the provided coordinate.
     */
    public Cell get(int row, int col) {
        return cells[new Position(row, col).index()];
    }

    public Cell get(Position position) {
        return cells[position.index()];
    }

    /**
     * Returns {@code true} if the cell at the provided coordinate is empty.
     */
    public boolean isEmpty(Position position) {
        return get(position) == Cell.EMPTY;
    }

    /**
     * Returns a copy of this board with {@code player}'s mark placed on {@code position}.
     */
    public Board withCell(Position position, Cell player) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(player, "player");
        if (!player.isPlayer()) {
            throw new IllegalArgumentException("Cannot place an empty mark");
        }
        if (!isEmpty(position)) {
            throw new IllegalArgumentException("Cell " + position + " is already occupied");
        }
        Cell[] updated = cells.clone();
        updated[position.index()] = player;
        return new Board(updated);
    }

    /**
     * Returns the number of cells holding {@code cell}.
     */
    public int count(Cell cell) {
        int count = 0;
        for (Cell value : cells) {
            if (value == cell) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns {@code true} if no empty cell remains.
     */
    public boolean isFull() {
        return count(Cell.EMPTY) == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        return Arrays.equals(cells, ((Board) other).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(CELL_COUNT + SIZE);
        for (int index = 0; index < CELL_COUNT; index++) {
            if (index > 0 && index % SIZE == 0) {
                builder.append('/');
            }
            Cell cell = cells[index];
            builder.append(cell == Cell.EMPTY ? '.' : cell.symbol());
        }
        return builder.toString();
    }

    private static Cell parseCell(char symbol) {
        switch (symbol) {
            case 'O':
                return Cell.MAXIMIZER;
            case 'X':
                return Cell.MINIMIZER;
            case '.':
            case ' ':
                return Cell.EMPTY;
            default:
                throw new IllegalArgumentException("Unknown cell symbol: '" + symbol + "'");
        }
    }

    private static Cell[] emptyCells() {
        Cell[] cells = new Cell[CELL_COUNT];
        Arrays.fill(cells, Cell.EMPTY);
        return cells;
    }
}
