/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import org.tablecp.csp.core.Variable;

/**
 * A value removed from the current domain of a variable by a propagator.
 * The search driver restores it with {@link Variable#restoreValue(int)} on backtrack.
 */
public record Pruning(Variable variable, int value) {

    /**
     * Puts the pruned value back in the domain of its variable
     */
    public void undo() {
        variable.restoreValue(value);
    }

    @Override
    public String toString() {
        return "(" + variable.name() + "," + value + ")";
    }
}
