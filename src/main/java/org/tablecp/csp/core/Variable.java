/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.core;

import org.tablecp.util.exception.InvalidModelException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * A finite domain variable.
 * <p>
 * The domain is conceptually represented by:
 * - the original domain, the ordered values given at construction, never modified
 * - the current domain, the subset of the original values that are not pruned
 * - an optional assigned value, set and cleared by the search driver only
 * <p>
 * While the variable is assigned its current domain is the singleton
 * {assigned value}, or the empty set if that value has been pruned.
 * Values are always reported in the order of the original domain.
 * <p>
 * Propagators shrink the current domain with {@link #pruneValue(int)},
 * the search driver grows it back with {@link #restoreValue(int)}.
 * Variables are compared by identity: a model creates exactly one
 * object per decision variable.
 */
public class Variable {

    private final String name;
    private final int[] domain;
    private final Map<Integer, Integer> indexOf;
    private final boolean[] present; // present[i] iff domain[i] is in the current domain
    private int size; // number of true entries in present
    private boolean assigned;
    private int assignedValue;

    /**
     * Creates a variable with the given original domain
     *
     * @param name   the name of the variable, unique within a CSP
     * @param domain the original domain, without duplicates
     * @throws InvalidModelException if a value appears twice in the domain
     */
    public Variable(String name, int... domain) {
        this.name = name;
        this.domain = domain.clone();
        this.indexOf = new HashMap<>();
        for (int i = 0; i < domain.length; i++) {
            if (indexOf.put(domain[i], i) != null) {
                throw new InvalidModelException("value " + domain[i] + " appears twice in the domain of " + name);
            }
        }
        this.present = new boolean[domain.length];
        Arrays.fill(present, true);
        this.size = domain.length;
    }

    public String name() {
        return name;
    }

    /**
     * Returns a copy of the original domain
     *
     * @return the values given at construction, in their original order
     */
    public int[] originalDomain() {
        return domain.clone();
    }

    public boolean inOriginalDomain(int v) {
        return indexOf.containsKey(v);
    }

    /**
     * Returns a snapshot of the current domain.
     * The array is not affected by later prunings, so it is safe
     * to prune values while iterating over it.
     *
     * @return the current values in the order of the original domain
     */
    public int[] currentDomain() {
        if (assigned) {
            return isPresent(assignedValue) ? new int[]{assignedValue} : new int[0];
        }
        int[] values = new int[size];
        int k = 0;
        for (int i = 0; i < domain.length; i++) {
            if (present[i]) {
                values[k++] = domain[i];
            }
        }
        return values;
    }

    public int currentDomainSize() {
        if (assigned) {
            return isPresent(assignedValue) ? 1 : 0;
        }
        return size;
    }

    public boolean inCurrentDomain(int v) {
        if (assigned) {
            return v == assignedValue && isPresent(v);
        }
        return isPresent(v);
    }

    /**
     * Removes a value from the current domain.
     * Has no effect if the value is not in the original domain or already pruned.
     *
     * @param v the value to remove
     */
    public void pruneValue(int v) {
        Integer i = indexOf.get(v);
        if (i != null && present[i]) {
            present[i] = false;
            size--;
        }
    }

    /**
     * Puts back a previously pruned value in the current domain.
     * Has no effect if the value is already present.
     *
     * @param v the value to restore, it must belong to the original domain
     * @throws IllegalArgumentException if the value is not in the original domain
     */
    public void restoreValue(int v) {
        Integer i = indexOf.get(v);
        if (i == null) {
            throw new IllegalArgumentException(v + " is not in the original domain of " + name);
        }
        if (!present[i]) {
            present[i] = true;
            size++;
        }
    }

    /**
     * Restores the current domain to the original domain
     */
    public void restoreAll() {
        Arrays.fill(present, true);
        size = domain.length;
    }

    /**
     * Assigns a value to the variable
     *
     * @param v the value, it must be in the current domain
     * @throws IllegalStateException if v is not in the current domain
     */
    public void assign(int v) {
        if (!inCurrentDomain(v)) {
            throw new IllegalStateException("cannot assign " + v + " to " + this);
        }
        assigned = true;
        assignedValue = v;
    }

    public void unassign() {
        assigned = false;
    }

    public boolean isAssigned() {
        return assigned;
    }

    /**
     * Returns the assigned value
     *
     * @return the value set by {@link #assign(int)}
     * @throws IllegalStateException if the variable is not assigned
     */
    public int assignedValue() {
        if (!assigned) {
            throw new IllegalStateException(name + " is not assigned");
        }
        return assignedValue;
    }

    private boolean isPresent(int v) {
        Integer i = indexOf.get(v);
        return i != null && present[i];
    }

    @Override
    public String toString() {
        if (assigned) {
            return name + "=" + assignedValue;
        }
        return name + Arrays.toString(currentDomain());
    }
}
