package com.tictactoe.core;

/**
 * Content of a single board cell. The search engine plays as {@link #MAXIMIZER} unless told
 * otherwise; numeric scores are only derived in {@link GameRules#evaluate(Board)}.
 */
public enum Cell {
    EMPTY(' '),
    MAXIMIZER('O'),
    MINIMIZER('X');

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the character used by the console front-end.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Returns {@code true} for the two player marks.
     */
    public boolean isPlayer() {
        return this != EMPTY;
    }

    /**
     * Returns the other player.
     */
    public Cell opponent() {
        switch (this) {
            case MAXIMIZER:
                return MINIMIZER;
            case MINIMIZER:
                return MAXIMIZER;
            default:
                throw new IllegalStateException("Empty cell has no opponent");
        }
    }
}
