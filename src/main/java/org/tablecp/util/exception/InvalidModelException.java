/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.util.exception;

/**
 * Raised when a model is malformed: a tuple whose arity does not match its scope,
 * a value outside a variable's original domain, a constraint over a variable
 * that does not belong to the CSP or an unreadable puzzle instance.
 * Models are validated when they are built, never during the search.
 */
public class InvalidModelException extends RuntimeException {

    public InvalidModelException(String message) {
        super(message);
    }

    public InvalidModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
