package com.refraction.core.solver;

import com.refraction.core.Board;
import com.refraction.core.BoardConfiguration;
import com.refraction.core.BoardConstructionException;
import com.refraction.core.Color;
import com.refraction.core.Goal;
import com.refraction.core.Position;
import com.refraction.core.TokenLayout;
import com.refraction.core.module.BoardAssembler;
import com.refraction.core.module.CatalogueLoadException;
import com.refraction.core.module.ModuleCatalogue;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point that assembles a board from the built-in catalogue and solves a
 * single puzzle on it.
 */
public final class SolverRunner {

    private static final Logger LOGGER = Logger.getLogger(SolverRunner.class.getName());

    private SolverRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 3 || args.length > 5) {
            printUsage();
            return;
        }
        try {
            String configText = null;
            TokenLayout layout = null;
            Color target = null;
            String goalText = null;
            long maxStates = SearchConstraints.DEFAULT_STATE_LIMIT;

            for (String option : args) {
                if (option.startsWith("--config=")) {
                    configText = option.substring("--config=".length());
                } else if (option.startsWith("--tokens=")) {
                    layout = TokenLayout.parse(option.substring("--tokens=".length()));
                } else if (option.startsWith("--target=")) {
                    target = Color.concreteFromTag(option.substring("--target=".length()));
                } else if (option.startsWith("--goal=")) {
                    goalText = option.substring("--goal=".length());
                } else if (option.startsWith("--maxStates=")) {
                    maxStates = Long.parseLong(option.substring("--maxStates=".length()));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }
            if (layout == null || target == null || goalText == null) {
                throw new IllegalArgumentException("--tokens, --target and --goal are required");
            }

            ModuleCatalogue catalogue = ModuleCatalogue.loadDefault();
            BoardConfiguration configuration = configText == null
                    ? catalogue.randomConfiguration(new Random())
                    : BoardConfiguration.parse(configText);
            Board board = BoardAssembler.buildBoard(configuration, catalogue);
            Position goal = resolveGoal(board, goalText);

            SearchResult result = new BreadthFirstSolver().findPath(board, layout, target, goal,
                    new SearchConstraints(maxStates));
            print(configuration, result);
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (BoardConstructionException | CatalogueLoadException ex) {
            LOGGER.log(Level.SEVERE, "Failed to build board", ex);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    /**
     * Accepts either {@code x,y} or the id of a goal on the board.
     */
    static Position resolveGoal(Board board, String text) {
        if (text.indexOf(',') >= 0) {
            return Position.parse(text);
        }
        return board.goalById(text)
                .map(Goal::position)
                .orElseThrow(() -> new IllegalArgumentException("Unknown goal id: " + text));
    }

    private static void print(BoardConfiguration configuration, SearchResult result) {
        System.out.println("Board: " + configuration);
        System.out.println("Status: " + result.status());
        System.out.println("States explored: " + result.statesExplored() + " in " + result.elapsed().toMillis() + " ms");
        if (result.isSolved()) {
            System.out.println("Actions: " + result.actionCount());
            int index = 1;
            for (Action action : result.actions()) {
                System.out.println("  " + index++ + ". " + action);
            }
            System.out.println("Final layout: " + result.finalLayout());
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: SolverRunner --tokens=<color=x,y;...> --target=<color> --goal=<x,y|goalId> "
                        + "[--config=<module:face,module:face,module:face,module:face>] [--maxStates=<value>]");
    }
}
