/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.examples.funpuzz;

import org.tablecp.util.exception.InvalidModelException;

import java.util.List;

/**
 * A FunPuzz instance: an n x n grid to fill with 1..n, each value once
 * per row and per column, such that every cage reaches its target.
 */
public record FunPuzz(int size, List<Cage> cages) {

    public FunPuzz {
        if (size < 1) {
            throw new InvalidModelException("grid size must be positive, got " + size);
        }
        cages = List.copyOf(cages);
        for (Cage cage : cages) {
            if (cage.cells().isEmpty()) {
                throw new InvalidModelException("empty cage with target " + cage.target());
            }
            for (Cell cell : cage.cells()) {
                if (cell.row() < 0 || cell.row() >= size || cell.col() < 0 || cell.col() >= size) {
                    throw new InvalidModelException("cell " + cell + " outside of the " + size + "x" + size + " grid");
                }
            }
        }
    }
}
