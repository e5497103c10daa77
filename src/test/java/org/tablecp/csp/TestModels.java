/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp;

import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Constraint;
import org.tablecp.csp.core.Tuple;
import org.tablecp.csp.core.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Small models shared by the tests
 */
public class TestModels {

    /**
     * x != y over the original domains
     */
    public static Constraint notEqual(String name, Variable x, Variable y) {
        List<Tuple> tuples = new ArrayList<>();
        for (int a : x.originalDomain()) {
            for (int b : y.originalDomain()) {
                if (a != b) tuples.add(new Tuple(a, b));
            }
        }
        return new Constraint(name, List.of(x, y), tuples);
    }

    /**
     * x < y over the original domains
     */
    public static Constraint lessThan(String name, Variable x, Variable y) {
        List<Tuple> tuples = new ArrayList<>();
        for (int a : x.originalDomain()) {
            for (int b : y.originalDomain()) {
                if (a < b) tuples.add(new Tuple(a, b));
            }
        }
        return new Constraint(name, List.of(x, y), tuples);
    }

    /**
     * Snapshot of the current domains of all the variables
     */
    public static Map<Variable, List<Integer>> domains(CSP csp) {
        Map<Variable, List<Integer>> res = new HashMap<>();
        for (Variable x : csp.allVariables()) {
            List<Integer> values = new ArrayList<>();
            for (int v : x.currentDomain()) values.add(v);
            res.put(x, values);
        }
        return res;
    }
}
