package com.tictactoe.core;

import java.util.Objects;

/**
 * Immutable representation of the current state of a match: the board and the side to move.
 */
public final class GameState {

    private final Board board;
    private final Cell sideToMove;

    /**
     * Creates the initial empty game state with the human (minimizer) to move.
     */
    public GameState() {
        this(new Board(), Cell.MINIMIZER);
    }

    private GameState(Board board, Cell sideToMove) {
        this.board = board;
        this.sideToMove = sideToMove;
    }

    /**
     * Creates an empty game state where {@code opener} makes the first move.
     */
    public static GameState startingWith(Cell opener) {
        Objects.requireNonNull(opener, "opener");
        if (!opener.isPlayer()) {
            throw new IllegalArgumentException("Opener must be a player");
        }
        return new GameState(new Board(), opener);
    }

    /**
     * Returns the board associated with this state.
     */
    public Board getBoard() {
        return board;
    }

    /**
     * Returns the player whose turn it is.
     */
    public Cell getSideToMove() {
        return sideToMove;
    }

    /**
     * Returns the move number starting from zero.
     */
    public int getMoveNumber() {
        return Board.CELL_COUNT - board.count(Cell.EMPTY);
    }

    public Outcome getOutcome() {
        return GameRules.outcome(board);
    }

    /**
     * Returns {@code true} once a player has won or the board is full.
     */
    public boolean isGameOver() {
        return GameRules.isTerminal(board);
    }

    /**
     * Places the mark of the side to move and returns the resulting state.
     */
    public GameState applyMove(Position position) {
        Objects.requireNonNull(position, "position");
        if (isGameOver()) {
            throw new IllegalStateException("Game is already over: " + getOutcome());
        }
        if (!board.isEmpty(position)) {
            throw new IllegalArgumentException("Cell " + position + " is already occupied");
        }
        return new GameState(board.withCell(position, sideToMove), sideToMove.opponent());
    }
}
