/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.core;

import org.tablecp.util.exception.InvalidModelException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table constraint: an ordered scope of variables and the explicit set
 * of tuples that satisfy it. Position i of every tuple is the value
 * of the i-th variable of the scope.
 * <p>
 * The table is checked and indexed once, at construction. During the
 * search the constraint is read-only: only the domains of the variables
 * in its scope change.
 */
public class Constraint {

    private final String name;
    private final Variable[] scope;
    private final Set<Tuple> tuples;
    // supports.get(i).get(v) = the tuples with value v at position i
    private final List<Map<Integer, List<Tuple>>> supports;

    /**
     * Creates a table constraint
     *
     * @param name   a name for the constraint, used in messages only
     * @param scope  the variables of the constraint, each at most once
     * @param tuples the satisfying tuples, restricted to the original domains
     * @throws InvalidModelException if a variable occurs twice in the scope,
     *                               if the arity of a tuple differs from the size of the scope
     *                               or if a value is not in the original domain of its variable
     */
    public Constraint(String name, List<Variable> scope, Collection<Tuple> tuples) {
        if (scope.isEmpty()) {
            throw new InvalidModelException("constraint " + name + " has an empty scope");
        }
        this.name = name;
        this.scope = scope.toArray(new Variable[0]);
        for (int i = 0; i < this.scope.length; i++) {
            for (int j = i + 1; j < this.scope.length; j++) {
                if (this.scope[i] == this.scope[j]) {
                    throw new InvalidModelException("variable " + this.scope[i].name() + " occurs twice in the scope of " + name);
                }
            }
        }
        this.tuples = new LinkedHashSet<>();
        this.supports = new ArrayList<>(this.scope.length);
        for (int i = 0; i < this.scope.length; i++) {
            supports.add(new HashMap<>());
        }
        for (Tuple t : tuples) {
            addTuple(t);
        }
    }

    private void addTuple(Tuple t) {
        if (t.arity() != scope.length) {
            throw new InvalidModelException("tuple " + t + " of arity " + t.arity() + " in constraint " + name + " over " + scope.length + " variables");
        }
        for (int i = 0; i < scope.length; i++) {
            if (!scope[i].inOriginalDomain(t.get(i))) {
                throw new InvalidModelException("tuple " + t + " of constraint " + name + ": " + t.get(i) + " is not in the domain of " + scope[i].name());
            }
        }
        if (tuples.add(t)) {
            for (int i = 0; i < scope.length; i++) {
                supports.get(i).computeIfAbsent(t.get(i), k -> new ArrayList<>()).add(t);
            }
        }
    }

    public String name() {
        return name;
    }

    public List<Variable> scope() {
        return List.of(scope);
    }

    public int arity() {
        return scope.length;
    }

    public Set<Tuple> satisfyingTuples() {
        return Collections.unmodifiableSet(tuples);
    }

    public int unassignedCount() {
        int n = 0;
        for (Variable x : scope) {
            if (!x.isAssigned()) n++;
        }
        return n;
    }

    /**
     * @return the variables of the scope that are not assigned, in scope order
     */
    public List<Variable> unassignedVariables() {
        List<Variable> res = new ArrayList<>();
        for (Variable x : scope) {
            if (!x.isAssigned()) res.add(x);
        }
        return res;
    }

    /**
     * Tests whether a combination of values satisfies the constraint
     *
     * @param values one value per variable of the scope, in scope order
     * @return true if the values form a satisfying tuple
     */
    public boolean check(int... values) {
        return tuples.contains(new Tuple(values));
    }

    /**
     * Tests whether the value v of x is supported: there exists a satisfying tuple
     * with v at the position of x whose other values are all in the current domains
     * of their variables.
     *
     * @param x a variable of the scope
     * @param v a value
     * @return true if (x, v) has a support in this constraint
     * @throws IllegalArgumentException if x is not in the scope
     */
    public boolean hasSupport(Variable x, int v) {
        int pos = position(x);
        if (pos < 0) {
            throw new IllegalArgumentException(x.name() + " is not in the scope of " + name);
        }
        List<Tuple> candidates = supports.get(pos).get(v);
        if (candidates == null) {
            return false;
        }
        for (Tuple t : candidates) {
            if (isValid(t, pos)) {
                return true;
            }
        }
        return false;
    }

    private boolean isValid(Tuple t, int skip) {
        for (int i = 0; i < scope.length; i++) {
            if (i != skip && !scope[i].inCurrentDomain(t.get(i))) {
                return false;
            }
        }
        return true;
    }

    private int position(Variable x) {
        for (int i = 0; i < scope.length; i++) {
            if (scope[i] == x) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder(name).append('(');
        for (int i = 0; i < scope.length; i++) {
            if (i > 0) b.append(',');
            b.append(scope[i].name());
        }
        return b.append(')').toString();
    }
}
