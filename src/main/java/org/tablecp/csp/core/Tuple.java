/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.core;

import java.util.Arrays;

/**
 * Immutable tuple of values, one per position of a constraint scope.
 */
public final class Tuple {

    private final int[] values;
    private final int hash;

    public Tuple(int... values) {
        this.values = values.clone();
        this.hash = Arrays.hashCode(this.values);
    }

    public int arity() {
        return values.length;
    }

    public int get(int i) {
        return values[i];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple)) return false;
        Tuple other = (Tuple) o;
        return hash == other.hash && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) b.append(',');
            b.append(values[i]);
        }
        return b.append(')').toString();
    }
}
