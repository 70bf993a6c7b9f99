package com.devcrew.orchestrator.persistence;

/**
 * Thrown when a store cannot read or write a record, e.g. because a JSON
 * column cannot be encoded or decoded.
 *
 * Unchecked: inside an agent turn it becomes an error report, outside a turn
 * it stops the current run.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
