/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Variable;

/**
 * A propagation strategy called by the search driver.
 * <p>
 * Before any assignment the driver calls {@code propagate(csp, null)}.
 * After each assignment it calls {@code propagate(csp, x)} with the variable
 * just assigned. The propagator prunes values with {@link Variable#pruneValue(int)},
 * never restores any, and reports every pruned value exactly once so that
 * the driver can undo the call on backtrack.
 */
public interface Propagator {

    /**
     * Propagates the constraints of the problem
     *
     * @param csp    the problem
     * @param newVar the variable just assigned, or null for the call made before the search
     * @return whether no dead end was found, with the values pruned by the call
     */
    PropagationResult propagate(CSP csp, Variable newVar);
}
