package com.osint.leadtrace.exception;

/**
 * A graph store query or update failed. Scheduler components catch this and
 * degrade to an empty or negative result.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
