package com.tictactoe.core.ai;

import com.tictactoe.core.Board;
import com.tictactoe.core.Cell;
import com.tictactoe.core.GameRules;
import com.tictactoe.core.GameState;
import com.tictactoe.core.Position;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Full-depth minimax searcher with alpha-beta pruning. Scores are always expressed from the
 * maximizer's point of view.
 *
 * <p>Instances keep per-search counters and are not thread-safe.
 */
public final class MinimaxAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(MinimaxAI.class.getName());

    public static final int NEGATIVE_INFINITY = Integer.MIN_VALUE / 2;
    public static final int POSITIVE_INFINITY = Integer.MAX_VALUE / 2;

    private long visitedNodes;
    private long cutoffs;
    private long lastVisitedNodes;
    private long lastCutoffs;

    /**
     * Returns the board the maximizer should move to, or an empty result on a full board.
     */
    public Optional<Board> selectBestMove(Board board) {
        return selectBestMove(board, Cell.MAXIMIZER);
    }

    /**
     * Returns the board {@code player} should move to, or an empty result on a full board. Among
     * equally scored moves the earliest empty cell in row-major order wins.
     */
    public Optional<Board> selectBestMove(Board board, Cell player) {
        return search(board, player).map(SearchResult::board);
    }

    /**
     * Returns the cell the side to move should take.
     *
     * @throws IllegalStateException if the game is already over
     */
    public Position findBestMove(GameState state) {
        Objects.requireNonNull(state, "state");
        if (state.isGameOver()) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }
        return search(state.getBoard(), state.getSideToMove())
                .map(SearchResult::move)
                .orElseThrow(() -> new IllegalStateException("No legal moves available"));
    }

    @Override
    public Optional<SearchResult> search(Board board, Cell player) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        if (!player.isPlayer()) {
            throw new IllegalArgumentException("Search requires a player, got " + player);
        }

        visitedNodes = 0L;
        cutoffs = 0L;

        boolean maximizing = player == Cell.MAXIMIZER;
        int depth = GameRules.emptyCells(board).size();
        List<Board> candidates = GameRules.legalMoves(board, player);

        Board bestBoard = null;
        int bestScore = maximizing ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        for (Board candidate : candidates) {
            int score = minimax(candidate, depth, NEGATIVE_INFINITY, POSITIVE_INFINITY, !maximizing);
            if (bestBoard == null || (maximizing ? score > bestScore : score < bestScore)) {
                bestScore = score;
                bestBoard = candidate;
            }
        }

        lastVisitedNodes = visitedNodes;
        lastCutoffs = cutoffs;

        if (bestBoard == null) {
            LOGGER.fine(() -> String.format("No move available for %s on %s", player, board));
            return Optional.empty();
        }

        final Board chosen = bestBoard;
        final int score = bestScore;
        LOGGER.fine(() -> String.format("Minimax explored %d nodes with %d cutoffs (player=%s, move=%s, score=%d)",
                lastVisitedNodes, lastCutoffs, player, chosen, score));
        return Optional.of(new SearchResult(moveBetween(board, chosen), chosen, score, lastVisitedNodes,
                lastCutoffs));
    }

    /**
     * Evaluates {@code board} with alpha-beta pruning.
     *
     * @param board      the position to evaluate
     * @param depth      remaining plies; the search stops at zero or on a terminal board
     * @param alpha      the best score the maximizer can already guarantee on this path
     * @param beta       the best score the minimizer can already guarantee on this path
     * @param maximizing {@code true} if the maximizer moves next on {@code board}
     * @return the minimax value of {@code board}
     */
    public int minimax(Board board, int depth, int alpha, int beta, boolean maximizing) {
        visitedNodes++;

        if (depth == 0 || GameRules.isTerminal(board)) {
            return GameRules.evaluate(board);
        }

        if (maximizing) {
            int best = NEGATIVE_INFINITY;
            for (Board child : GameRules.legalMoves(board, Cell.MAXIMIZER)) {
                int score = minimax(child, depth - 1, alpha, beta, false);
                best = Math.max(best, score);
                alpha = Math.max(alpha, best);
                if (beta <= alpha) {
                    cutoffs++;
                    break;
                }
            }
            return best;
        }

        int best = POSITIVE_INFINITY;
        for (Board child : GameRules.legalMoves(board, Cell.MINIMIZER)) {
            int score = minimax(child, depth - 1, alpha, beta, true);
            best = Math.min(best, score);
            beta = Math.min(beta, best);
            if (beta <= alpha) {
                cutoffs++;
                break;
            }
        }
        return best;
    }

    /**
     * Returns the single cell that differs between {@code before} and {@code after}.
     *
     * @throws IllegalArgumentException unless exactly one cell went from empty to occupied
     */
    public static Position moveBetween(Board before, Board after) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        Position move = null;
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                if (before.get(row, col) == after.get(row, col)) {
                    continue;
                }
                if (move != null || before.get(row, col) != Cell.EMPTY) {
                    throw new IllegalArgumentException("Boards " + before + " and " + after
                            + " do not differ by a single move");
                }
                move = new Position(row, col);
            }
        }
        if (move == null) {
            throw new IllegalArgumentException("Boards " + before + " and " + after + " are identical");
        }
        return move;
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public long getLastCutoffCount() {
        return lastCutoffs;
    }
}
