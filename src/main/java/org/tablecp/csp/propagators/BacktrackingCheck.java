/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Constraint;
import org.tablecp.csp.core.Variable;

import java.util.Collections;
import java.util.List;

/**
 * Plain backtracking: no propagation, only the constraints that
 * became fully assigned with the last assignment are checked.
 * This propagator never prunes.
 */
public class BacktrackingCheck implements Propagator {

    @Override
    public PropagationResult propagate(CSP csp, Variable newVar) {
        if (newVar == null) {
            return PropagationResult.success(Collections.emptyList());
        }
        for (Constraint c : csp.constraintsContaining(newVar)) {
            if (c.unassignedCount() == 0 && !c.check(assignedValues(c))) {
                return PropagationResult.failure(Collections.emptyList());
            }
        }
        return PropagationResult.success(Collections.emptyList());
    }

    private static int[] assignedValues(Constraint c) {
        List<Variable> scope = c.scope();
        int[] values = new int[scope.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = scope.get(i).assignedValue();
        }
        return values;
    }

    @Override
    public String toString() {
        return "BT";
    }
}
