/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.search;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Variable;
import org.tablecp.csp.propagators.PropagationResult;
import org.tablecp.csp.propagators.Propagator;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth first search over the assignments of a {@link CSP}.
 * <p>
 * The propagator is called once before the search, then after each
 * assignment with the assigned variable. The prunings it reports are
 * undone when the search backtracks over that assignment, which restores
 * exactly the domains that held before the call.
 * <p>
 * When the search stops on a solution the variables keep the values
 * of that solution. When the tree is explored completely every variable
 * is unassigned and has its original domain back.
 * <p>
 * A search object owns all its state; separate instances can run
 * on separate problems.
 */
public class BacktrackingSearch {

    private final CSP csp;
    private final List<Runnable> solutionListeners = new ArrayList<>();
    private SearchStatistics statistics;
    private int solutionLimit;
    private int nUnassigned;

    public BacktrackingSearch(CSP csp) {
        this.csp = csp;
    }

    /**
     * Adds a listener called on each solution, while the
     * variables are assigned to the values of the solution
     *
     * @param listener the closure to call
     */
    public void onSolution(Runnable listener) {
        solutionListeners.add(listener);
    }

    /**
     * Searches for a first solution
     */
    public SearchStatistics solve(Propagator propagator, VariableOrdering ordering) {
        return solve(propagator, ordering, 1);
    }

    /**
     * Enumerates all the solutions
     */
    public SearchStatistics solveAll(Propagator propagator, VariableOrdering ordering) {
        return solve(propagator, ordering, 0);
    }

    /**
     * Searches for solutions, starting from the original domains
     *
     * @param propagator the propagation run after each assignment
     * @param ordering   the variable selection heuristic
     * @param limit      the search stops after that many solutions, 0 or less for no limit
     * @return the statistics of the run
     */
    public SearchStatistics solve(Propagator propagator, VariableOrdering ordering, int limit) {
        csp.reset();
        statistics = new SearchStatistics();
        solutionLimit = limit;
        nUnassigned = csp.allVariables().size();
        long begin = System.currentTimeMillis();

        PropagationResult root = propagator.propagate(csp, null);
        statistics.addPrunings(root.prunings().size());
        boolean stopped = false;
        if (root.consistent()) {
            stopped = dfs(propagator, ordering);
        } else {
            statistics.incrFailures();
        }
        if (!stopped) {
            root.undo();
            statistics.setCompleted();
        }

        statistics.setTimeMillis(System.currentTimeMillis() - begin);
        return statistics;
    }

    /**
     * @return true if the search must stop
     */
    private boolean dfs(Propagator propagator, VariableOrdering ordering) {
        if (nUnassigned == 0) {
            statistics.incrSolutions();
            solutionListeners.forEach(Runnable::run);
            return solutionLimit > 0 && statistics.numberOfSolutions() >= solutionLimit;
        }
        Variable x = ordering.select(csp);
        for (int v : x.currentDomain()) {
            statistics.incrNodes();
            x.assign(v);
            nUnassigned--;
            PropagationResult result = propagator.propagate(csp, x);
            statistics.addPrunings(result.prunings().size());
            if (result.consistent()) {
                if (dfs(propagator, ordering)) {
                    return true;
                }
            } else {
                statistics.incrFailures();
            }
            result.undo();
            x.unassign();
            nUnassigned++;
        }
        return false;
    }

    /**
     * @return the statistics of the last run, null before the first one
     */
    public SearchStatistics statistics() {
        return statistics;
    }
}
