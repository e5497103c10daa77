/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.examples.funpuzz;

import java.util.List;

/**
 * A group of cells whose values combined with the operation give the target.
 * A cage with a single cell fixes that cell to the target, whatever the operation.
 */
public record Cage(List<Cell> cells, int target, CageOperation operation) {

    public Cage {
        cells = List.copyOf(cells);
    }

    public static Cage single(Cell cell, int target) {
        return new Cage(List.of(cell), target, CageOperation.ADD);
    }
}
