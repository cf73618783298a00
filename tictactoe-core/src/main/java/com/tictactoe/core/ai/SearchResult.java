package com.tictactoe.core.ai;

import com.tictactoe.core.Board;
import com.tictactoe.core.Position;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move         the cell the searching player should take
 * @param board        the board after {@code move} has been played
 * @param score        the minimax value of {@code board}, from the maximizer's point of view
 * @param visitedNodes the number of minimax calls made during the search
 * @param cutoffs      the number of alpha-beta prunes during the search
 */
public record SearchResult(Position move, Board board, int score, long visitedNodes, long cutoffs) {

    public SearchResult {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(board, "board");
    }
}
