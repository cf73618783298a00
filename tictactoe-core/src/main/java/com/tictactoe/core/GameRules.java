package com.tictactoe.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pure queries over a {@link Board}: winning lines, terminal detection, evaluation and move
 * generation. None of the methods modify their argument.
 */
public final class GameRules {

    public static final int LINE_COUNT = 8;

    public static final int MAXIMIZER_WIN_SCORE = 1;
    public static final int MINIMIZER_WIN_SCORE = -1;
    public static final int DRAW_SCORE = 0;

    private static final List<List<Position>> LINES;

    static {
        List<List<Position>> lines = new ArrayList<>(LINE_COUNT);
        for (int row = 0; row < Board.SIZE; row++) {
            lines.add(collectLine(row, 0, 0, 1));
        }
        for (int col = 0; col < Board.SIZE; col++) {
            lines.add(collectLine(0, col, 1, 0));
        }
        lines.add(collectLine(0, 0, 1, 1));
        lines.add(collectLine(Board.SIZE - 1, 0, -1, 1));

        if (lines.size() != LINE_COUNT) {
            throw new IllegalStateException("Expected " + LINE_COUNT + " lines but built " + lines.size());
        }
        LINES = Collections.unmodifiableList(lines);
    }

    private GameRules() {
    }

    /**
     * Returns the eight winning lines: rows first, then columns, then the two diagonals.
     */
    public static List<List<Position>> getLines() {
        return LINES;
    }

    /**
     * Returns {@code true} if one of the winning lines is entirely filled by {@code player}.
     */
    public static boolean winner(Board board, Cell player) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        if (!player.isPlayer()) {
            throw new IllegalArgumentException("Only players can win");
        }
        for (List<Position> line : LINES) {
            if (isCompletedBy(board, line, player)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if either player has won or no empty cell remains. A board on which both
     * players own a line cannot be reached by legal play and is reported as terminal like any other.
     */
    public static boolean isTerminal(Board board) {
        return winner(board, Cell.MAXIMIZER) || winner(board, Cell.MINIMIZER) || board.isFull();
    }

    /**
     * Scores the board from the maximizer's point of view: {@code +1} for a maximizer win,
     * {@code -1} for a minimizer win and {@code 0} otherwise. Only meaningful on terminal boards.
     */
    public static int evaluate(Board board) {
        if (winner(board, Cell.MAXIMIZER)) {
            return MAXIMIZER_WIN_SCORE;
        }
        if (winner(board, Cell.MINIMIZER)) {
            return MINIMIZER_WIN_SCORE;
        }
        return DRAW_SCORE;
    }

    /**
     * Returns the coordinates of all empty cells in row-major order.
     */
    public static List<Position> emptyCells(Board board) {
        Objects.requireNonNull(board, "board");
        List<Position> empty = new ArrayList<>(Board.CELL_COUNT);
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Position position = new Position(row, col);
                if (board.isEmpty(position)) {
                    empty.add(position);
                }
            }
        }
        return empty;
    }

    /**
     * Returns one child board per empty cell with {@code player}'s mark placed on it, in the same
     * order as {@link #emptyCells(Board)}. Each child is an independent board.
     */
    public static List<Board> legalMoves(Board board, Cell player) {
        List<Position> empty = emptyCells(board);
        List<Board> children = new ArrayList<>(empty.size());
        for (Position position : empty) {
            children.add(board.withCell(position, player));
        }
        return children;
    }

    /**
     * Derives the outcome of the game shown on {@code board}.
     */
    public static Outcome outcome(Board board) {
        if (winner(board, Cell.MAXIMIZER)) {
            return Outcome.MAXIMIZER_WIN;
        }
        if (winner(board, Cell.MINIMIZER)) {
            return Outcome.MINIMIZER_WIN;
        }
        return board.isFull() ? Outcome.DRAW : Outcome.IN_PROGRESS;
    }

    private static boolean isCompletedBy(Board board, List<Position> line, Cell player) {
        for (Position position : line) {
            if (board.get(position) != player) {
                return false;
            }
        }
        return true;
    }

    private static List<Position> collectLine(int startRow, int startCol, int rowStep, int colStep) {
        List<Position> cells = new ArrayList<>(Board.SIZE);
        int row = startRow;
        int col = startCol;
        for (int i = 0; i < Board.SIZE; i++) {
            cells.add(new Position(row, col));
            row += rowStep;
            col += colStep;
        }
        return List.copyOf(cells);
    }
}
