/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.csp.propagators;

import java.util.Locale;

/**
 * Factory for the propagators, looked up by their short name (BT, FC or GAC).
 */
public final class Propagators {

    private Propagators() {
    }

    public static Propagator backtracking() {
        return new BacktrackingCheck();
    }

    public static Propagator forwardChecking() {
        return new ForwardChecking();
    }

    public static Propagator gac() {
        return new GeneralizedArcConsistency();
    }

    /**
     * @param name BT, FC or GAC, case insensitive
     * @return the corresponding propagator
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Propagator byName(String name) {
        switch (name.toUpperCase(Locale.ROOT)) {
            case "BT":
                return backtracking();
            case "FC":
                return forwardChecking();
            case "GAC":
                return gac();
            default:
                throw new IllegalArgumentException("unknown propagator " + name + ", expected BT, FC or GAC");
        }
    }
}
