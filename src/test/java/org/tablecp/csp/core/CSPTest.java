/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.core;

import org.junit.jupiter.api.Test;
import org.tablecp.csp.TestModels;
import org.tablecp.util.exception.InvalidModelException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CSPTest {

    @Test
    public void testConstraintIndex() {
        Variable x = new Variable("x", 1, 2);
        Variable y = new Variable("y", 1, 2);
        Variable z = new Variable("z", 1, 2);
        CSP csp = new CSP("test", List.of(x, y, z));
        Constraint xy = TestModels.notEqual("xy", x, y);
        Constraint yz = TestModels.notEqual("yz", y, z);
        csp.addConstraint(xy);
        csp.addConstraint(yz);

        assertEquals(List.of(xy, yz), csp.allConstraints());
        assertEquals(List.of(xy), csp.constraintsContaining(x));
        assertEquals(List.of(xy, yz), csp.constraintsContaining(y));
        assertEquals(List.of(yz), csp.constraintsContaining(z));
        assertEquals(List.of(x, y, z), csp.allVariables());
    }

    @Test
    public void testScopeMustBelongToTheProblem() {
        Variable x = new Variable("x", 1, 2);
        Variable y = new Variable("y", 1, 2);
        CSP csp = new CSP("test", List.of(x));
        assertThrows(InvalidModelException.class, () -> csp.addConstraint(TestModels.notEqual("xy", x, y)));
        assertTrue(csp.allConstraints().isEmpty());
        assertThrows(InvalidModelException.class, () -> csp.addVariable(x));
    }

    @Test
    public void testReset() {
        Variable x = new Variable("x", 1, 2, 3);
        Variable y = new Variable("y", 1, 2, 3);
        CSP csp = new CSP("test", List.of(x, y));
        x.pruneValue(1);
        x.assign(2);
        y.pruneValue(3);
        assertEquals(List.of(y), csp.unassignedVariables());

        csp.reset();
        assertFalse(x.isAssigned());
        assertArrayEquals(new int[]{1, 2, 3}, x.currentDomain());
        assertArrayEquals(new int[]{1, 2, 3}, y.currentDomain());
        assertEquals(List.of(x, y), csp.unassignedVariables());
    }
}
