/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.core;

import org.tablecp.util.exception.InvalidModelException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A constraint satisfaction problem: a list of variables and a list of
 * table constraints over them, with an index from each variable to the
 * constraints whose scope contains it.
 */
public class CSP {

    private final String name;
    private final List<Variable> variables = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final Map<Variable, List<Constraint>> constraintsOf = new IdentityHashMap<>();

    public CSP(String name) {
        this.name = name;
    }

    public CSP(String name, List<Variable> variables) {
        this(name);
        for (Variable x : variables) {
            addVariable(x);
        }
    }

    public String name() {
        return name;
    }

    /**
     * Adds a variable to the problem
     *
     * @param x the variable
     * @throws InvalidModelException if x is already part of the problem
     */
    public void addVariable(Variable x) {
        if (constraintsOf.containsKey(x)) {
            throw new InvalidModelException("variable " + x.name() + " added twice to " + name);
        }
        variables.add(x);
        constraintsOf.put(x, new ArrayList<>());
    }

    /**
     * Adds a constraint to the problem
     *
     * @param c the constraint
     * @throws InvalidModelException if a variable of the scope of c is not part of the problem
     */
    public void addConstraint(Constraint c) {
        for (Variable x : c.scope()) {
            if (!constraintsOf.containsKey(x)) {
                throw new InvalidModelException("constraint " + c.name() + " is over " + x.name() + " which is not a variable of " + name);
            }
        }
        constraints.add(c);
        for (Variable x : c.scope()) {
            constraintsOf.get(x).add(c);
        }
    }

    public List<Variable> allVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<Constraint> allConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * @param x a variable of the problem
     * @return the constraints whose scope contains x, in the order they were added
     */
    public List<Constraint> constraintsContaining(Variable x) {
        List<Constraint> res = constraintsOf.get(x);
        if (res == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(res);
    }

    public List<Variable> unassignedVariables() {
        List<Variable> res = new ArrayList<>();
        for (Variable x : variables) {
            if (!x.isAssigned()) res.add(x);
        }
        return res;
    }

    /**
     * Unassigns every variable and restores every original domain
     */
    public void reset() {
        for (Variable x : variables) {
            x.unassign();
            x.restoreAll();
        }
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("CSP ").append(name).append('\n');
        for (Variable x : variables) {
            b.append("  ").append(x).append('\n');
        }
        for (Constraint c : constraints) {
            b.append("  ").append(c).append(' ').append(c.satisfyingTuples().size()).append(" tuples\n");
        }
        return b.toString();
    }
}
