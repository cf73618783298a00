package com.tictactoe.core;

import com.tictactoe.core.ai.MinimaxAI;
import java.io.PrintStream;
import java.util.Scanner;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end for playing a match against the {@link MinimaxAI}.
 */
public final class TicTacToeCLI {

    private static final Logger LOGGER = Logger.getLogger(TicTacToeCLI.class.getName());
    private static final Logger ROOT_LOGGER = Logger.getLogger("com.tictactoe");

    private TicTacToeCLI() {
    }

    public static void main(String[] args) {
        boolean computerFirst = false;
        for (String option : args) {
            if ("--computer-first".equals(option)) {
                computerFirst = true;
            } else if ("--verbose".equals(option)) {
                enableVerboseLogging();
            } else {
                LOGGER.log(Level.SEVERE, "Unrecognised argument: {0}", option);
                printUsage();
                return;
            }
        }

        GameState initial = GameState.startingWith(computerFirst ? Cell.MAXIMIZER : Cell.MINIMIZER);
        play(initial, new MinimaxAI(), new Scanner(System.in), System.out);
    }

    /**
     * Runs the turn loop until the game ends or the input is exhausted and returns the last state.
     */
    static GameState play(GameState initial, MinimaxAI ai, Scanner scanner, PrintStream out) {
        GameState state = initial;
        out.println("Welcome to Tic Tac Toe!");
        printBoard(state.getBoard(), out);

        while (!state.isGameOver()) {
            Position move;
            if (state.getSideToMove() == Cell.MINIMIZER) {
                move = readHumanMove(state.getBoard(), scanner, out);
                if (move == null) {
                    out.println("Input closed, leaving the game.");
                    return state;
                }
            } else {
                move = ai.findBestMove(state);
                out.printf("AI plays %d%n", move.toMoveNumber());
            }
            state = state.applyMove(move);
            printBoard(state.getBoard(), out);
        }

        Outcome outcome = state.getOutcome();
        switch (outcome) {
            case MINIMIZER_WIN:
                out.println("Congratulations, you win!");
                break;
            case MAXIMIZER_WIN:
                out.println("AI wins. Better luck next time!");
                break;
            default:
                out.println("It's a draw!");
                break;
        }
        final int moves = state.getMoveNumber();
        LOGGER.info(() -> String.format("Game finished after %d moves (outcome=%s)", moves, outcome));
        return state;
    }

    private static Position readHumanMove(Board board, Scanner scanner, PrintStream out) {
        while (true) {
            out.print("Choose your move (1-9): ");
            if (!scanner.hasNextLine()) {
                out.println();
                return null;
            }
            String input = scanner.nextLine().trim();
            Position position;
            try {
                position = Position.fromMoveNumber(Integer.parseInt(input));
            } catch (IllegalArgumentException ex) {
                // NumberFormatException is an IllegalArgumentException too.
                out.println("Invalid move. Try again.");
                continue;
            }
            if (!board.isEmpty(position)) {
                out.println("Cell is already occupied. Try again.");
                continue;
            }
            return position;
        }
    }

    static void printBoard(Board board, PrintStream out) {
        out.println();
        StringBuilder header = new StringBuilder(" ");
        for (int col = 0; col < Board.SIZE; col++) {
            header.append(' ').append(col + 1);
        }
        out.println(header);
        for (int row = 0; row < Board.SIZE; row++) {
            StringBuilder line = new StringBuilder().append(row + 1);
            for (int col = 0; col < Board.SIZE; col++) {
                line.append(' ').append(board.get(row, col).symbol());
            }
            out.println(line);
        }
    }

    private static void enableVerboseLogging() {
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.setLevel(Level.FINE);
        ROOT_LOGGER.addHandler(handler);
        ROOT_LOGGER.setUseParentHandlers(false);
    }

    private static void printUsage() {
        System.err.println("Usage: TicTacToeCLI [--computer-first] [--verbose]");
    }
}
