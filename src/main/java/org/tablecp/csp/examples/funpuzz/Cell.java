/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.examples.funpuzz;

/**
 * A cell of the grid, 0-based
 */
public record Cell(int row, int col) {

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
