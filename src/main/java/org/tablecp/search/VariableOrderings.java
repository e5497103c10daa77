/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.search;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Constraint;
import org.tablecp.csp.core.Variable;

import java.util.Locale;

/**
 * Variable ordering heuristics.
 * Ties are broken in favor of the variable that comes first in the problem.
 */
public final class VariableOrderings {

    private VariableOrderings() {
    }

    /**
     * @return the first unassigned variable, in the order of the problem
     */
    public static VariableOrdering staticOrder() {
        return csp -> {
            for (Variable x : csp.allVariables()) {
                if (!x.isAssigned()) return x;
            }
            throw new IllegalStateException("all the variables are assigned");
        };
    }

    /**
     * First fail: the unassigned variable with the smallest current domain
     */
    public static VariableOrdering minimumRemainingValues() {
        return csp -> {
            Variable best = null;
            for (Variable x : csp.allVariables()) {
                if (!x.isAssigned() && (best == null || x.currentDomainSize() < best.currentDomainSize())) {
                    best = x;
                }
            }
            if (best == null) throw new IllegalStateException("all the variables are assigned");
            return best;
        };
    }

    /**
     * The unassigned variable involved in the largest number of constraints
     * that have at least one other unassigned variable
     */
    public static VariableOrdering maximumDegree() {
        return csp -> {
            Variable best = null;
            int bestDegree = -1;
            for (Variable x : csp.allVariables()) {
                if (x.isAssigned()) continue;
                int degree = degree(csp, x);
                if (degree > bestDegree) {
                    best = x;
                    bestDegree = degree;
                }
            }
            if (best == null) throw new IllegalStateException("all the variables are assigned");
            return best;
        };
    }

    private static int degree(CSP csp, Variable x) {
        int degree = 0;
        for (Constraint c : csp.constraintsContaining(x)) {
            if (c.unassignedCount() > 1) degree++;
        }
        return degree;
    }

    /**
     * @param name static, mrv or degree
     * @return the corresponding ordering
     * @throws IllegalArgumentException if the name is unknown
     */
    public static VariableOrdering byName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "static":
                return staticOrder();
            case "mrv":
                return minimumRemainingValues();
            case "degree":
                return maximumDegree();
            default:
                throw new IllegalArgumentException("unknown variable ordering " + name + ", expected static, mrv or degree");
        }
    }
}
