/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.RunFunPuzz;

import org.tablecp.csp.examples.funpuzz.FunPuzz;
import org.tablecp.csp.examples.funpuzz.FunPuzzModels;
import org.tablecp.csp.examples.funpuzz.FunPuzzReader;
import org.tablecp.csp.propagators.Propagator;
import org.tablecp.csp.propagators.Propagators;
import org.tablecp.search.BacktrackingSearch;
import org.tablecp.search.SearchStatistics;
import org.tablecp.search.VariableOrdering;
import org.tablecp.search.VariableOrderings;
import org.tablecp.util.exception.InvalidModelException;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Solves a FunPuzz instance from the command line.
 * <pre>
 * RunFunPuzz instance.json [BT|FC|GAC] [binary|nary|caged] [static|mrv|degree] [stats.csv]
 * </pre>
 * Defaults: GAC, caged model, mrv ordering, no csv file.
 */
public class RunFunPuzz {

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("usage: RunFunPuzz instance.json [BT|FC|GAC] [binary|nary|caged] [static|mrv|degree] [stats.csv]");
            System.exit(2);
        }
        String instanceFile = args[0];
        String propagatorName = args.length > 1 ? args[1] : "GAC";
        String modelName = args.length > 2 ? args[2] : "caged";
        String orderingName = args.length > 3 ? args[3] : "mrv";

        try {
            FunPuzz puzzle = FunPuzzReader.read(Path.of(instanceFile));
            Propagator propagator = Propagators.byName(propagatorName);
            VariableOrdering ordering = VariableOrderings.byName(orderingName);
            FunPuzzModels.Model model = buildModel(puzzle, modelName);

            System.out.println("Running instance: " + instanceFile + " with " + propagator + ", " + modelName + " model, " + orderingName + " ordering");
            BacktrackingSearch search = new BacktrackingSearch(model.csp());
            search.onSolution(() -> System.out.print(model.gridToString()));
            SearchStatistics stats = search.solve(propagator, ordering);
            if (stats.numberOfSolutions() == 0) {
                System.out.println("No solution");
            }
            System.out.format("Statistics: %s\n", stats);

            if (args.length > 4) {
                saveStatistics(args[4], instanceFile, propagator.toString(), modelName, stats);
            }
        } catch (IOException e) {
            System.err.println("Error reading instance: " + e.getMessage());
            System.exit(1);
        } catch (InvalidModelException | IllegalArgumentException e) {
            System.err.println("Invalid instance or option: " + e.getMessage());
            System.exit(1);
        }
    }

    static FunPuzzModels.Model buildModel(FunPuzz puzzle, String modelName) {
        switch (modelName.toLowerCase(Locale.ROOT)) {
            case "binary":
                return FunPuzzModels.binaryNotEqualGrid(puzzle);
            case "nary":
                return FunPuzzModels.naryAllDifferentGrid(puzzle);
            case "caged":
                return FunPuzzModels.cagedModel(puzzle);
            default:
                throw new IllegalArgumentException("unknown model " + modelName + ", expected binary, nary or caged");
        }
    }

    /**
     * Appends the search statistics to a CSV file.
     * The file is created if it does not exist, and the header is written only once.
     *
     * @param csvFile      the path to the CSV file
     * @param instanceName the name of the instance
     * @param propagator   the name of the propagator
     * @param modelName    the name of the model
     * @param stats        the statistics of the run
     */
    static void saveStatistics(String csvFile, String instanceName, String propagator, String modelName, SearchStatistics stats) {
        boolean fileExists = new File(csvFile).exists();
        try (FileWriter fw = new FileWriter(csvFile, true);
             BufferedWriter bw = new BufferedWriter(fw);
             PrintWriter out = new PrintWriter(bw)) {

            if (!fileExists) {
                out.println("Instance,Propagator,Model,Nodes,Failures,Solutions,Prunings,Completed,TimeMillis");
            }
            out.printf(Locale.US, "%s,%s,%s,%d,%d,%d,%d,%b,%d%n",
                    instanceName,
                    propagator,
                    modelName,
                    stats.numberOfNodes(),
                    stats.numberOfFailures(),
                    stats.numberOfSolutions(),
                    stats.numberOfPrunings(),
                    stats.isCompleted(),
                    stats.timeMillis());
            System.out.println("Statistics saved to: " + csvFile);
        } catch (IOException e) {
            System.err.println("Failed to save statistics for " + instanceName);
            e.printStackTrace();
        }
    }
}
