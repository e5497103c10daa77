/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import java.util.List;

/**
 * Outcome of one propagation call.
 * When {@code consistent} is false the prunings are the ones made before
 * the failure was detected; they must be undone all the same.
 *
 * @param consistent false if a violated constraint or a domain wipeout was detected
 * @param prunings   every value removed by the call, in removal order, each exactly once
 */
public record PropagationResult(boolean consistent, List<Pruning> prunings) {

    public PropagationResult {
        prunings = List.copyOf(prunings);
    }

    public static PropagationResult success(List<Pruning> prunings) {
        return new PropagationResult(true, prunings);
    }

    public static PropagationResult failure(List<Pruning> prunings) {
        return new PropagationResult(false, prunings);
    }

    /**
     * Restores every pruned value, latest first
     */
    public void undo() {
        for (int i = prunings.size() - 1; i >= 0; i--) {
            prunings.get(i).undo();
        }
    }
}
