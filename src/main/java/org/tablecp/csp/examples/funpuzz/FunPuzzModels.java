/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.examples.funpuzz;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Constraint;
import org.tablecp.csp.core.Tuple;
import org.tablecp.csp.core.Variable;
import org.tablecp.util.Combinatorics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Models of a FunPuzz grid as table constraints.
 * <p>
 * Cell (r, c) is the variable {@code V<r+1><c+1>} with domain 1..n.
 * Each model creates one variable object per cell.
 */
public final class FunPuzzModels {

    /**
     * A compiled model with the variables of the cells
     *
     * @param csp  the problem
     * @param grid grid[r][c] is the variable of cell (r, c)
     */
    public record Model(CSP csp, Variable[][] grid) {

        public Variable cell(int row, int col) {
            return grid[row][col];
        }

        /**
         * @return the values assigned to the cells, 0 for an unassigned cell
         */
        public int[][] values() {
            int[][] res = new int[grid.length][];
            for (int r = 0; r < grid.length; r++) {
                res[r] = new int[grid[r].length];
                for (int c = 0; c < grid[r].length; c++) {
                    res[r][c] = grid[r][c].isAssigned() ? grid[r][c].assignedValue() : 0;
                }
            }
            return res;
        }

        public String gridToString() {
            StringBuilder b = new StringBuilder();
            for (int[] row : values()) {
                for (int c = 0; c < row.length; c++) {
                    if (c > 0) b.append(' ');
                    b.append(row[c] == 0 ? "." : String.valueOf(row[c]));
                }
                b.append('\n');
            }
            return b.toString();
        }
    }

    private FunPuzzModels() {
    }

    /**
     * Grid model with a binary not-equal constraint for every pair
     * of cells in the same row or the same column. Cages are ignored.
     */
    public static Model binaryNotEqualGrid(FunPuzz puzzle) {
        int n = puzzle.size();
        Variable[][] grid = makeGrid(n);
        CSP csp = new CSP("binary", flatten(grid));
        addBinaryNotEqual(csp, grid);
        return new Model(csp, grid);
    }

    /**
     * Grid model with one all-different constraint per row and per column,
     * whose tuples are the permutations of 1..n. Cages are ignored.
     */
    public static Model naryAllDifferentGrid(FunPuzz puzzle) {
        int n = puzzle.size();
        Variable[][] grid = makeGrid(n);
        CSP csp = new CSP("n-ary", flatten(grid));

        List<Tuple> permutations = new ArrayList<>();
        Combinatorics.forEachDistinctPermutation(Combinatorics.range(1, n), p -> permutations.add(new Tuple(p)));

        for (int i = 0; i < n; i++) {
            List<Variable> row = new ArrayList<>();
            List<Variable> col = new ArrayList<>();
            for (int j = 0; j < n; j++) {
                row.add(grid[i][j]);
                col.add(grid[j][i]);
            }
            csp.addConstraint(new Constraint("Row " + i, row, permutations));
            csp.addConstraint(new Constraint("Col " + i, col, permutations));
        }
        return new Model(csp, grid);
    }

    /**
     * Binary not-equal grid model together with one table constraint per cage
     */
    public static Model cagedModel(FunPuzz puzzle) {
        Model model = binaryNotEqualGrid(puzzle);
        int i = 0;
        for (Cage cage : puzzle.cages()) {
            List<Variable> scope = new ArrayList<>();
            for (Cell cell : cage.cells()) {
                scope.add(model.cell(cell.row(), cell.col()));
            }
            model.csp().addConstraint(new Constraint("Cage " + i++, scope, cageTuples(cage, scope)));
        }
        return model;
    }

    /**
     * Computes the satisfying tuples of a cage.
     * <p>
     * The operations do not depend on the order of the values, so the
     * predicate is evaluated once per multiset of values, and the accepted
     * multisets are expanded into their distinct arrangements that fit
     * the original domains of the cells.
     *
     * @param cage  the cage
     * @param scope the variables of the cells of the cage, in the order of its cells
     * @return the tuples, in scope order
     */
    public static List<Tuple> cageTuples(Cage cage, List<Variable> scope) {
        List<Tuple> tuples = new ArrayList<>();
        if (scope.size() == 1) {
            if (scope.get(0).inOriginalDomain(cage.target())) {
                tuples.add(new Tuple(cage.target()));
            }
            return tuples;
        }
        TreeSet<Integer> union = new TreeSet<>();
        for (Variable x : scope) {
            for (int v : x.originalDomain()) union.add(v);
        }
        int[] values = union.stream().mapToInt(Integer::intValue).toArray();
        Combinatorics.forEachMultiset(values, scope.size(), multiset -> {
            if (cage.operation().test(multiset, cage.target())) {
                Combinatorics.forEachDistinctPermutation(multiset, p -> {
                    if (fits(p, scope)) {
                        tuples.add(new Tuple(p));
                    }
                });
            }
        });
        return tuples;
    }

    private static boolean fits(int[] values, List<Variable> scope) {
        for (int i = 0; i < values.length; i++) {
            if (!scope.get(i).inOriginalDomain(values[i])) return false;
        }
        return true;
    }

    private static void addBinaryNotEqual(CSP csp, Variable[][] grid) {
        int n = grid.length;
        List<Tuple> notEqual = new ArrayList<>();
        for (int a = 1; a <= n; a++) {
            for (int b = 1; b <= n; b++) {
                if (a != b) notEqual.add(new Tuple(a, b));
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                for (int k = j + 1; k < n; k++) {
                    csp.addConstraint(new Constraint(String.format(Locale.ROOT, "Row %d %d%d", i, j, k),
                            List.of(grid[i][j], grid[i][k]), notEqual));
                    csp.addConstraint(new Constraint(String.format(Locale.ROOT, "Col %d %d%d", i, j, k),
                            List.of(grid[j][i], grid[k][i]), notEqual));
                }
            }
        }
    }

    private static Variable[][] makeGrid(int n) {
        Variable[][] grid = new Variable[n][n];
        int[] domain = Combinatorics.range(1, n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                grid[r][c] = new Variable("V" + (r + 1) + (c + 1), domain);
            }
        }
        return grid;
    }

    private static List<Variable> flatten(Variable[][] grid) {
        List<Variable> res = new ArrayList<>();
        for (Variable[] row : grid) {
            for (Variable x : row) res.add(x);
        }
        return res;
    }
}
