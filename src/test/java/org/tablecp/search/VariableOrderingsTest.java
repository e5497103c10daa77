/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.search;

import org.junit.jupiter.api.Test;
import org.tablecp.csp.TestModels;
import org.tablecp.csp.core.CSP;
import org.tablecp.csp.core.Variable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VariableOrderingsTest {

    private final Variable a = new Variable("a", 1, 2, 3);
    private final Variable b = new Variable("b", 1, 2, 3);
    private final Variable c = new Variable("c", 1, 2, 3);
    private final Variable d = new Variable("d", 1, 2, 3);

    private CSP star() {
        CSP csp = new CSP("star", List.of(a, b, c, d));
        csp.addConstraint(TestModels.notEqual("ab", a, b));
        csp.addConstraint(TestModels.notEqual("bc", b, c));
        csp.addConstraint(TestModels.notEqual("bd", b, d));
        return csp;
    }

    @Test
    public void testStaticOrder() {
        CSP csp = star();
        VariableOrdering ordering = VariableOrderings.staticOrder();
        assertSame(a, ordering.select(csp));
        a.assign(1);
        assertSame(b, ordering.select(csp));
    }

    @Test
    public void testMinimumRemainingValues() {
        CSP csp = star();
        VariableOrdering ordering = VariableOrderings.minimumRemainingValues();
        assertSame(a, ordering.select(csp));
        c.pruneValue(1);
        d.pruneValue(1);
        d.pruneValue(2);
        assertSame(d, ordering.select(csp));
    }

    @Test
    public void testMaximumDegree() {
        CSP csp = star();
        VariableOrdering ordering = VariableOrderings.maximumDegree();
        assertSame(b, ordering.select(csp));
        b.assign(1);
        // no constraint left with two unassigned variables
        assertSame(a, ordering.select(csp));
    }

    @Test
    public void testAllAssigned() {
        CSP csp = new CSP("single", List.of(a));
        a.assign(1);
        assertThrows(IllegalStateException.class, () -> VariableOrderings.staticOrder().select(csp));
        assertThrows(IllegalStateException.class, () -> VariableOrderings.minimumRemainingValues().select(csp));
        assertThrows(IllegalStateException.class, () -> VariableOrderings.maximumDegree().select(csp));
    }

    @Test
    public void testByName() {
        assertNotNull(VariableOrderings.byName("MRV"));
        assertNotNull(VariableOrderings.byName("static"));
        assertNotNull(VariableOrderings.byName("degree"));
        assertThrows(IllegalArgumentException.class, () -> VariableOrderings.byName("random"));
    }
}
