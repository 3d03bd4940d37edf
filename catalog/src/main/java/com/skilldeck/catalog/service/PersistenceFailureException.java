package com.skilldeck.catalog.service;

/**
 * Thrown when a catalog transaction fails (database down, constraint
 * violation, lock timeout). Nothing from the failed transaction is committed.
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
