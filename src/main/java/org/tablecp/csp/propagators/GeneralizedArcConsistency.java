/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Constraint;
import org.tablecp.csp.core.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Generalized arc consistency (GAC-3 over table constraints).
 * <p>
 * The constraints to revise are kept on a stack, seeded with all the
 * constraints before the search, or with the constraints containing the
 * assigned variable after an assignment. Revising a constraint removes
 * the values without support in it. Each time the domain of a variable
 * shrinks, the constraints containing that variable are pushed back
 * (unless already on the stack) since their supports may be lost.
 * <p>
 * When the stack is empty every remaining value of every variable in the
 * scope of a revised constraint has a support in all its constraints.
 */
public class GeneralizedArcConsistency implements Propagator {

    @Override
    public PropagationResult propagate(CSP csp, Variable newVar) {
        List<Constraint> seed = newVar == null ? csp.allConstraints() : csp.constraintsContaining(newVar);
        Deque<Constraint> stack = new ArrayDeque<>();
        Set<Constraint> onStack = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Constraint c : seed) {
            if (onStack.add(c)) {
                stack.push(c);
            }
        }
        List<Pruning> pruned = new ArrayList<>();
        boolean consistent = enforce(csp, stack, onStack, pruned);
        return new PropagationResult(consistent, pruned);
    }

    /**
     * Revises the constraints of the stack until it is empty or a domain is wiped out
     *
     * @return false if a domain wipeout occurred
     */
    private static boolean enforce(CSP csp, Deque<Constraint> stack, Set<Constraint> onStack, List<Pruning> pruned) {
        while (!stack.isEmpty()) {
            Constraint c = stack.pop();
            onStack.remove(c);
            for (Variable x : c.scope()) {
                for (int v : x.currentDomain()) {
                    if (!c.hasSupport(x, v)) {
                        x.pruneValue(v);
                        pruned.add(new Pruning(x, v));
                        if (x.currentDomainSize() == 0) {
                            return false;
                        }
                        for (Constraint other : csp.constraintsContaining(x)) {
                            if (onStack.add(other)) {
                                stack.push(other);
                            }
                        }
                    }
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "GAC";
    }
}
