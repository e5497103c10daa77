/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Constraint;
import org.tablecp.csp.core.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward checking: every constraint with exactly one unassigned variable x
 * removes from the domain of x the values that, together with the values
 * assigned to the rest of the scope, violate it.
 * <p>
 * Before the search all the constraints are checked, so only the unary ones
 * prune. After an assignment only the constraints containing the assigned
 * variable are checked. The first domain wipeout stops the propagation.
 */
public class ForwardChecking implements Propagator {

    @Override
    public PropagationResult propagate(CSP csp, Variable newVar) {
        List<Constraint> constraints = newVar == null ? csp.allConstraints() : csp.constraintsContaining(newVar);
        List<Pruning> pruned = new ArrayList<>();
        for (Constraint c : constraints) {
            if (c.unassignedCount() == 1) {
                Variable x = c.unassignedVariables().get(0);
                if (!forwardCheck(c, x, pruned)) {
                    return PropagationResult.failure(pruned);
                }
            }
        }
        return PropagationResult.success(pruned);
    }

    /**
     * Prunes the values of x that violate c given the values assigned
     * to the other variables of its scope.
     *
     * @param c      a constraint whose only unassigned variable is x
     * @param x      the unassigned variable
     * @param pruned the list to which the prunings are appended
     * @return false if the domain of x is wiped out
     */
    private static boolean forwardCheck(Constraint c, Variable x, List<Pruning> pruned) {
        List<Variable> scope = c.scope();
        int[] values = new int[scope.size()];
        int pos = -1;
        for (int i = 0; i < values.length; i++) {
            Variable y = scope.get(i);
            if (y == x) {
                pos = i;
            } else {
                values[i] = y.assignedValue();
            }
        }
        for (int v : x.currentDomain()) {
            values[pos] = v;
            if (!c.check(values)) {
                x.pruneValue(v);
                pruned.add(new Pruning(x, v));
                if (x.currentDomainSize() == 0) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "FC";
    }
}
