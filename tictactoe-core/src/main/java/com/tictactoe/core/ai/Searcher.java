package com.tictactoe.core.ai;

import com.tictactoe.core.Board;
import com.tictactoe.core.Cell;
import java.util.Optional;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Searches for the best move {@code player} can make on {@code board}.
     *
     * @param board the position to analyse
     * @param player the side to move
     * @return the chosen move, or an empty result if the board has no empty cell
     */
    Optional<SearchResult> search(Board board, Cell player);
}
