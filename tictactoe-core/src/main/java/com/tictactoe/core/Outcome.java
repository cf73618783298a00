package com.tictactoe.core;

/**
 * Result of a game as derived from its board.
 */
public enum Outcome {
    MAXIMIZER_WIN,
    MINIMIZER_WIN,
    DRAW,
    IN_PROGRESS;

    public boolean isFinished() {
        return this != IN_PROGRESS;
    }
}
