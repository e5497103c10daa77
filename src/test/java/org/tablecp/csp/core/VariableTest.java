/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.core;

import org.junit.jupiter.api.Test;
import org.tablecp.util.exception.InvalidModelException;

import static org.junit.jupiter.api.Assertions.*;

public class VariableTest {

    @Test
    public void testConstruction() {
        Variable x = new Variable("x", 3, 1, 2);
        assertEquals("x", x.name());
        assertArrayEquals(new int[]{3, 1, 2}, x.originalDomain());
        assertArrayEquals(new int[]{3, 1, 2}, x.currentDomain());
        assertEquals(3, x.currentDomainSize());
        assertFalse(x.isAssigned());
        assertThrows(IllegalStateException.class, x::assignedValue);
        assertThrows(InvalidModelException.class, () -> new Variable("y", 1, 2, 1));
    }

    @Test
    public void testPruneAndRestore() {
        Variable x = new Variable("x", 1, 2, 3, 4);
        x.pruneValue(2);
        x.pruneValue(4);
        assertArrayEquals(new int[]{1, 3}, x.currentDomain());
        assertFalse(x.inCurrentDomain(2));
        assertTrue(x.inOriginalDomain(2));

        x.pruneValue(2); // already pruned
        x.pruneValue(7); // not in the domain
        assertEquals(2, x.currentDomainSize());

        x.restoreValue(4);
        assertArrayEquals(new int[]{1, 3, 4}, x.currentDomain());
        x.restoreValue(4);
        assertEquals(3, x.currentDomainSize());
        assertThrows(IllegalArgumentException.class, () -> x.restoreValue(9));

        x.restoreAll();
        assertArrayEquals(new int[]{1, 2, 3, 4}, x.currentDomain());
    }

    @Test
    public void testSnapshotIsNotAffectedByPruning() {
        Variable x = new Variable("x", 1, 2, 3);
        int[] snapshot = x.currentDomain();
        for (int v : snapshot) {
            x.pruneValue(v);
        }
        assertArrayEquals(new int[]{1, 2, 3}, snapshot);
        assertEquals(0, x.currentDomainSize());
    }

    @Test
    public void testAssignment() {
        Variable x = new Variable("x", 1, 2, 3);
        x.pruneValue(3);
        assertThrows(IllegalStateException.class, () -> x.assign(3));

        x.assign(2);
        assertTrue(x.isAssigned());
        assertEquals(2, x.assignedValue());
        assertArrayEquals(new int[]{2}, x.currentDomain());
        assertEquals(1, x.currentDomainSize());
        assertTrue(x.inCurrentDomain(2));
        assertFalse(x.inCurrentDomain(1));
        assertThrows(IllegalStateException.class, () -> x.assign(1));

        x.unassign();
        assertFalse(x.isAssigned());
        assertArrayEquals(new int[]{1, 2}, x.currentDomain());
    }

    @Test
    public void testPruningTheAssignedValueEmptiesTheDomain() {
        Variable x = new Variable("x", 1, 2);
        x.assign(1);
        x.pruneValue(1);
        assertEquals(0, x.currentDomainSize());
        assertArrayEquals(new int[0], x.currentDomain());
        x.restoreValue(1);
        assertArrayEquals(new int[]{1}, x.currentDomain());
    }
}
