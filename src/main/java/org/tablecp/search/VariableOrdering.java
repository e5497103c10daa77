/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.search;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Variable;

/**
 * Chooses the next variable to branch on.
 */
@FunctionalInterface
public interface VariableOrdering {

    /**
     * @param csp the problem, with at least one unassigned variable
     * @return an unassigned variable of csp
     */
    Variable select(CSP csp);
}
