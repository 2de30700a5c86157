package org.sweep.app;

import org.sweep.core.MovesResult;
import org.sweep.core.SweepPlanner;
import org.sweep.core.SweepPlannerException;
import org.sweep.core.SweepRequest;
import org.sweep.grid.GridConfigurationException;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Usage: {@code <maxEnergy> <row> [<row> ...]}. Without arguments a built-in
 * two-row scenario is planned.</p>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    static final List<String> DEFAULT_ROWS = List.of("L.S", "RXL");
    static final int DEFAULT_MAX_ENERGY = 5;

    /**
     * Launches the sample CLI routine.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Parses arguments, plans, and prints the result.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> rows = DEFAULT_ROWS;
        int maxEnergy = DEFAULT_MAX_ENERGY;
        if (args.length > 0) {
            if (args.length < 2) {
                return usage(err, "expected a max energy followed by at least one grid row");
            }
            try {
                maxEnergy = Integer.parseInt(args[0]);
            } catch (NumberFormatException ex) {
                return usage(err, "max energy must be an integer: " + args[0]);
            }
            rows = Arrays.asList(args).subList(1, args.length);
        }

        MovesResult result;
        try {
            result = new SweepPlanner().plan(SweepRequest.builder()
                    .rows(rows)
                    .maxEnergy(maxEnergy)
                    .build());
        } catch (GridConfigurationException | SweepPlannerException ex) {
            return usage(err, ex.getMessage());
        }

        out.println("moves = " + result.getMoves());
        if (result.isReachable()) {
            out.println("path = " + result.getPath());
        }
        out.println("expanded = " + result.getExpandedStates());
        return EXIT_OK;
    }

    private static int usage(PrintStream err, String problem) {
        err.println("error: " + problem);
        err.println("usage: Main <maxEnergy> <row> [<row> ...]   (symbols: S . X R L)");
        return EXIT_USAGE;
    }
}
