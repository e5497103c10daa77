/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.examples.funpuzz;

import org.tablecp.util.Combinatorics;
import org.tablecp.util.exception.InvalidModelException;

/**
 * Arithmetic operation of a cage.
 * <p>
 * The result of a cage does not depend on how its values are arranged in
 * the cells: for subtraction one of the values minus all the others must
 * equal the target, for division one of the values divided by the product
 * of the others must equal the target exactly.
 */
public enum CageOperation {

    ADD('+', 0) {
        @Override
        public boolean test(int[] values, int target) {
            return Combinatorics.sum(values) == target;
        }
    },
    SUBTRACT('-', 1) {
        @Override
        public boolean test(int[] values, int target) {
            int sum = Combinatorics.sum(values);
            for (int v : values) {
                if (v - (sum - v) == target) return true;
            }
            return false;
        }
    },
    DIVIDE('/', 2) {
        @Override
        public boolean test(int[] values, int target) {
            for (int i = 0; i < values.length; i++) {
                long others = 1;
                for (int j = 0; j < values.length; j++) {
                    if (j != i) others *= values[j];
                }
                if (others != 0 && values[i] == (long) target * others) return true;
            }
            return false;
        }
    },
    MULTIPLY('*', 3) {
        @Override
        public boolean test(int[] values, int target) {
            return Combinatorics.product(values) == target;
        }
    };

    private final char symbol;
    private final int code;

    CageOperation(char symbol, int code) {
        this.symbol = symbol;
        this.code = code;
    }

    /**
     * Tests whether the values of the cells of a cage reach the target
     *
     * @param values the values of the cells, in any order
     * @param target the target of the cage
     * @return true if the operation applied to the values gives the target
     */
    public abstract boolean test(int[] values, int target);

    public static CageOperation fromSymbol(String s) {
        for (CageOperation op : values()) {
            if (s.length() == 1 && s.charAt(0) == op.symbol) return op;
        }
        throw new InvalidModelException("unknown cage operation '" + s + "'");
    }

    public static CageOperation fromCode(int code) {
        for (CageOperation op : values()) {
            if (op.code == code) return op;
        }
        throw new InvalidModelException("unknown cage operation code " + code);
    }
}
