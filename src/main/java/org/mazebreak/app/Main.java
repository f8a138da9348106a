package org.mazebreak.app;

import org.mazebreak.core.grid.InvalidMazeException;
import org.mazebreak.core.grid.MazeParser;
import org.mazebreak.routing.core.BreachSolver;
import org.mazebreak.routing.core.DirectPathPolicy;
import org.mazebreak.routing.core.ExecutionMode;
import org.mazebreak.routing.core.NoSolutionException;
import org.mazebreak.routing.core.SolveRequest;
import org.mazebreak.routing.core.SolveResponse;
import org.mazebreak.routing.core.SolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 *   Main &lt;maze-file&gt; [--parallel] [--allow-direct-path] [--help | -h]
 * </pre>
 *
 * <p>Prints {@code steps=<n>} and, when a wall was converted, {@code breach=(<row>,<col>)}.
 * Without flags, mode and policy come from the {@code mazebreak.solver.*} system properties.</p>
 */
public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NO_SOLUTION = 2;

    static final String USAGE =
            "Usage: <maze-file> [OPTIONS]\n" +
            "Options:\n" +
            "  --help, -h             Show this help message and exit\n" +
            "  --parallel             Run both corner searches and wall probes in parallel\n" +
            "  --allow-direct-path    Accept a floor-only route when it is not longer than any breach route";

    private Main() {
    }

    /**
     * Launches the solver CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the CLI without exiting the JVM.
     *
     * @return process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Path mazeFile = null;
        // null leaves the choice to SolverConfig.defaults(), i.e. the mazebreak.solver.* properties
        ExecutionMode mode = null;
        DirectPathPolicy policy = null;

        for (String arg : args) {
            switch (arg) {
                case "--help", "-h" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                case "--parallel" -> mode = ExecutionMode.PARALLEL;
                case "--allow-direct-path" -> policy = DirectPathPolicy.ALLOW_DIRECT;
                default -> {
                    if (arg.startsWith("-") || mazeFile != null) {
                        err.println("Argument Error: unexpected argument '" + arg + "'");
                        err.println(USAGE);
                        return EXIT_ERROR;
                    }
                    mazeFile = Path.of(arg);
                }
            }
        }
        if (mazeFile == null) {
            err.println("Argument Error: missing maze file");
            err.println(USAGE);
            return EXIT_ERROR;
        }
        if (!Files.isRegularFile(mazeFile)) {
            err.println("I/O Error: maze file not found: " + mazeFile);
            return EXIT_ERROR;
        }

        try (BreachSolver solver = BreachSolver.builder().build()) {
            int[][] maze = MazeParser.parse(mazeFile);
            SolveResponse response = solver.solve(SolveRequest.builder()
                    .maze(maze)
                    .executionMode(mode)
                    .directPathPolicy(policy)
                    .build());
            out.println("steps=" + response.getSteps());
            if (response.isBreachUsed()) {
                out.println("breach=" + response.getBreachPosition());
            }
            return EXIT_OK;
        } catch (NoSolutionException ex) {
            out.println("no solution");
            LOG.warn("{}", ex.getMessage());
            return EXIT_NO_SOLUTION;
        } catch (InvalidMazeException ex) {
            err.println("Invalid maze: " + ex.getMessage());
            return EXIT_ERROR;
        } catch (IOException ex) {
            LOG.error("failed to read {}", mazeFile, ex);
            err.println("I/O Error: " + ex.getMessage());
            return EXIT_ERROR;
        } catch (SolverException ex) {
            LOG.error("solve failed for {}", mazeFile, ex);
            err.println("Solver Error: " + ex.getMessage());
            return EXIT_ERROR;
        }
    }
}
