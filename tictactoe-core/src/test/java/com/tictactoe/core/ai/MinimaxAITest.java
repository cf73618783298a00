package com.tictactoe.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tictactoe.core.Board;
import com.tictactoe.core.Cell;
import com.tictactoe.core.GameRules;
import com.tictactoe.core.GameState;
import com.tictactoe.core.Outcome;
import com.tictactoe.core.Position;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MinimaxAITest {

    private static final int UNPRUNED_TREE_SIZE_FROM_EMPTY_BOARD = 549_945;

    private final MinimaxAI ai = new MinimaxAI();

    @Test
    void opensWithASingleMarkOnTheFirstCell() {
        Board board = new Board();

        Board chosen = ai.selectBestMove(board).orElseThrow();

        assertEquals(1, chosen.count(Cell.MAXIMIZER));
        assertEquals(0, chosen.count(Cell.MINIMIZER));
        assertEquals(new Position(0, 0), MinimaxAI.moveBetween(board, chosen));
    }

    @Test
    void completesItsOwnRow() {
        Board board = Board.of("OO.", "XX.", "...");

        SearchResult result = ai.search(board, Cell.MAXIMIZER).orElseThrow();

        assertEquals(new Position(0, 2), result.move());
        assertEquals(GameRules.MAXIMIZER_WIN_SCORE, result.score());
        assertEquals(Board.of("OOO", "XX.", "..."), result.board());
    }

    @Test
    void blocksTheOpponentsDiagonal() {
        Board board = Board.of("X.O", ".X.", "...");

        SearchResult result = ai.search(board, Cell.MAXIMIZER).orElseThrow();

        assertEquals(new Position(2, 2), result.move());
        assertEquals(GameRules.DRAW_SCORE, result.score());
    }

    @Test
    void playsTheMinimizerSideWhenAsked() {
        Board board = Board.of("XX.", "OO.", "...");

        SearchResult result = ai.search(board, Cell.MINIMIZER).orElseThrow();

        assertEquals(new Position(0, 2), result.move());
        assertEquals(GameRules.MINIMIZER_WIN_SCORE, result.score());
        assertEquals(Cell.MINIMIZER, result.board().get(0, 2));
    }

    @Test
    void returnsNoMoveOnAFullBoard() {
        Board board = Board.of("OXO", "OXX", "XOO");

        assertEquals(Optional.empty(), ai.selectBestMove(board));
        assertEquals(Optional.empty(), ai.search(board, Cell.MINIMIZER));
    }

    @Test
    void findBestMoveRejectsFinishedGames() {
        GameState state = new GameState();
        for (int moveNumber : new int[] {1, 4, 2, 5, 3}) {
            state = state.applyMove(Position.fromMoveNumber(moveNumber));
        }
        GameState finished = state;

        assertThrows(IllegalStateException.class, () -> ai.findBestMove(finished));
    }

    @Test
    void findBestMoveSearchesForTheSideToMove() {
        GameState state = new GameState()
                .applyMove(new Position(0, 0))
                .applyMove(new Position(2, 2))
                .applyMove(new Position(0, 1));

        assertEquals(Cell.MAXIMIZER, state.getSideToMove());
        assertEquals(new Position(0, 2), ai.findBestMove(state));
    }

    @Test
    void rejectsEmptyPlayer() {
        assertThrows(IllegalArgumentException.class, () -> ai.search(new Board(), Cell.EMPTY));
    }

    @Test
    void pruningSkipsPartOfTheTree() {
        ai.selectBestMove(new Board());

        assertTrue(ai.getLastVisitedNodeCount() > 0, "The search should inspect at least one node");
        assertTrue(ai.getLastVisitedNodeCount() < UNPRUNED_TREE_SIZE_FROM_EMPTY_BOARD,
                "Alpha-beta should visit fewer nodes than plain minimax");
        assertTrue(ai.getLastCutoffCount() > 0, "The search should prune at least once");
    }

    @Test
    void prunedValueMatchesPlainMinimaxOnEveryReachableBoard() {
        Set<Board> reachable = new HashSet<>();
        collectReachable(new Board(), Cell.MAXIMIZER, reachable);
        collectReachable(new Board(), Cell.MINIMIZER, reachable);
        Map<Board, Integer> maximizingCache = new HashMap<>();
        Map<Board, Integer> minimizingCache = new HashMap<>();

        for (Board board : reachable) {
            int depth = GameRules.emptyCells(board).size();
            for (boolean maximizing : new boolean[] {true, false}) {
                int expected = plainMinimax(board, maximizing, maximizing ? maximizingCache : minimizingCache,
                        maximizing ? minimizingCache : maximizingCache);
                int actual = ai.minimax(board, depth, MinimaxAI.NEGATIVE_INFINITY, MinimaxAI.POSITIVE_INFINITY,
                        maximizing);
                assertEquals(expected, actual, () -> "Value mismatch on " + board);
            }
        }
    }

    @Test
    void neverLosesWhenMovingSecond() {
        assertNoLoss(GameState.startingWith(Cell.MINIMIZER));
    }

    @Test
    void neverLosesWhenMovingFirst() {
        assertNoLoss(GameState.startingWith(Cell.MAXIMIZER));
    }

    @Test
    void neverLosesWhenPlayingTheMinimizer() {
        assertNoLossAsMinimizer(new Board(), Cell.MAXIMIZER);
        assertNoLossAsMinimizer(new Board(), Cell.MINIMIZER);
    }

    @Test
    void moveBetweenRejectsBoardsThatAreNotOneMoveApart() {
        Board board = Board.of("O..", "...", "...");

        assertThrows(IllegalArgumentException.class, () -> MinimaxAI.moveBetween(board, board));
        assertThrows(IllegalArgumentException.class,
                () -> MinimaxAI.moveBetween(board, Board.of("OX.", "X..", "...")));
        assertThrows(IllegalArgumentException.class,
                () -> MinimaxAI.moveBetween(board, Board.of("X..", "...", "...")));
    }

    @Test
    void selectBestMoveLeavesTheInputUntouched() {
        Board board = Board.of("X..", "...", "...");

        Board chosen = ai.selectBestMove(board).orElseThrow();

        assertEquals(Board.of("X..", "...", "..."), board);
        assertNotEquals(board, chosen);
        assertEquals(new Position(1, 1), MinimaxAI.moveBetween(board, chosen));
    }

    private void assertNoLoss(GameState state) {
        if (state.isGameOver()) {
            assertNotEquals(Outcome.MINIMIZER_WIN, state.getOutcome(), () -> "AI lost on " + state.getBoard());
            return;
        }
        if (state.getSideToMove() == Cell.MAXIMIZER) {
            assertNoLoss(state.applyMove(ai.findBestMove(state)));
            return;
        }
        for (Position position : GameRules.emptyCells(state.getBoard())) {
            assertNoLoss(state.applyMove(position));
        }
    }

    private void assertNoLossAsMinimizer(Board board, Cell toMove) {
        if (GameRules.isTerminal(board)) {
            assertNotEquals(Outcome.MAXIMIZER_WIN, GameRules.outcome(board), () -> "AI lost on " + board);
            return;
        }
        if (toMove == Cell.MINIMIZER) {
            Board next = ai.selectBestMove(board, Cell.MINIMIZER).orElseThrow();
            assertNoLossAsMinimizer(next, Cell.MAXIMIZER);
            return;
        }
        for (Board child : GameRules.legalMoves(board, Cell.MAXIMIZER)) {
            assertNoLossAsMinimizer(child, Cell.MINIMIZER);
        }
    }

    private static void collectReachable(Board board, Cell toMove, Set<Board> sink) {
        if (!sink.add(board) || GameRules.isTerminal(board)) {
            return;
        }
        for (Board child : GameRules.legalMoves(board, toMove)) {
            collectReachable(child, toMove.opponent(), sink);
        }
    }

    private static int plainMinimax(Board board, boolean maximizing, Map<Board, Integer> cache,
            Map<Board, Integer> opponentCache) {
        if (GameRules.isTerminal(board)) {
            return GameRules.evaluate(board);
        }
        Integer cached = cache.get(board);
        if (cached != null) {
            return cached;
        }
        int best = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (Board child : GameRules.legalMoves(board, maximizing ? Cell.MAXIMIZER : Cell.MINIMIZER)) {
            int score = plainMinimax(child, !maximizing, opponentCache, cache);
            best = maximizing ? Math.max(best, score) : Math.min(best, score);
        }
        cache.put(board, best);
        return best;
    }
}
