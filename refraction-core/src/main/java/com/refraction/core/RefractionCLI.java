package com.refraction.core;

import com.refraction.core.module.BoardAssembler;
import com.refraction.core.module.CatalogueLoadException;
import com.refraction.core.module.ModuleCatalogue;
import com.refraction.core.solver.Action;
import com.refraction.core.solver.BreadthFirstSolver;
import com.refraction.core.solver.Searcher;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Scanner;

/**
 * Simple console front-end for playing rounds on an assembled board.
 *
 * <p>Optional arguments: a board configuration such as {@code 0:0,2:1,4:0,6:1} and a token
 * layout such as {@code red=0,0;yellow=15,0}.
 */
public final class RefractionCLI {

    private static final String DEFAULT_TOKENS = "red=0,0;yellow=15,0;blue=0,15;green=15,15";

    private RefractionCLI() {
    }

    public static void main(String[] args) {
        BoardConfiguration configuration;
        GameSession session;
        try {
            ModuleCatalogue catalogue = ModuleCatalogue.loadDefault();
            configuration = args.length > 0
                    ? BoardConfiguration.parse(args[0])
                    : catalogue.randomConfiguration(new Random());
            Board board = BoardAssembler.buildBoard(configuration, catalogue);
            TokenLayout layout = TokenLayout.parse(args.length > 1 ? args[1] : DEFAULT_TOKENS);
            session = GameSession.start(board, layout);
        } catch (InvalidPlacementException ex) {
            for (PlacementProblem problem : ex.getProblems()) {
                System.out.println(problem.describe());
            }
            return;
        } catch (BoardConstructionException | CatalogueLoadException | IllegalArgumentException ex) {
            System.out.println("Cannot start game: " + ex.getMessage());
            return;
        }

        Searcher searcher = new BreadthFirstSolver();
        Scanner scanner = new Scanner(System.in);
        System.out.println("Refraction: console edition");
        System.out.println("Board " + configuration);
        printHelp();

        while (true) {
            System.out.printf("Round %d> ", session.nextRoundNumber());
            if (!scanner.hasNextLine()) {
                break;
            }
            String[] words = scanner.nextLine().trim().split("\\s+");
            String command = words[0].toLowerCase(Locale.ROOT);
            if (command.isEmpty()) {
                continue;
            }
            if ("quit".equals(command) || "exit".equals(command)) {
                break;
            }
            switch (command) {
                case "goals" -> printGoals(session);
                case "tokens" -> printTokens(session.layout());
                case "stats" -> printStatistics(session.statistics());
                case "reset" -> {
                    session = session.reset();
                    System.out.println("Tokens returned to their starting cells.");
                }
                case "play" -> session = play(session, words, searcher);
                default -> printHelp();
            }
        }

        printStatistics(session.statistics());
    }

    private static GameSession play(GameSession session, String[] words, Searcher searcher) {
        if (words.length != 3) {
            System.out.println("Usage: play <goalId> <color>");
            return session;
        }
        Color color;
        try {
            color = Color.concreteFromTag(words[2]);
        } catch (IllegalArgumentException ex) {
            System.out.println(ex.getMessage());
            return session;
        }
        GameSession.RoundOutcome outcome;
        try {
            outcome = session.playRound(words[1], color, searcher);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            System.out.println(ex.getMessage());
            return session;
        }
        if (!outcome.isSolved()) {
            System.out.printf("No solution: %s after %d states%n", outcome.result().status(),
                    outcome.result().statesExplored());
            return session;
        }
        System.out.printf("Solved in %d actions (%d states, %d ms)%n", outcome.round().actionCount(),
                outcome.result().statesExplored(), outcome.result().elapsed().toMillis());
        int index = 1;
        for (Action action : outcome.round().actions()) {
            System.out.println("  " + index++ + ". " + action);
        }
        return outcome.session();
    }

    private static void printGoals(GameSession session) {
        List<Goal> goals = session.availableGoals();
        if (goals.isEmpty()) {
            System.out.println("No goals left.");
            return;
        }
        for (Goal goal : goals) {
            System.out.printf("%-24s %-8s %-8s %s tokens %s%n", goal.id(), goal.color().tag(),
                    goal.shape().tag(), goal.position(), session.eligibleColors(goal.id()));
        }
    }

    private static void printTokens(TokenLayout layout) {
        for (Token token : layout.tokens()) {
            System.out.println(token.color().tag() + " " + token.position());
        }
    }

    private static void printStatistics(GameSession.Statistics statistics) {
        System.out.printf("Rounds: %d, actions: %d, average: %.2f%n", statistics.rounds(), statistics.totalActions(),
                statistics.averageActions());
        for (Map.Entry<Color, Integer> entry : statistics.roundsPerColor().entrySet()) {
            System.out.printf("  %s: %d rounds%n", entry.getKey().tag(), entry.getValue());
        }
    }

    private static void printHelp() {
        System.out.println("Commands: goals, tokens, play <goalId> <color>, stats, reset, quit");
    }
}
