package com.osint.leadtrace.exception;

/**
 * One entity lookup failed. Raised by {@code SearchExecutor} implementations.
 */
public class SearchExecutionException extends RuntimeException {

    private final String entityValue;

    public SearchExecutionException(String entityValue, String message) {
        super(message);
        this.entityValue = entityValue;
    }

    public SearchExecutionException(String entityValue, String message, Throwable cause) {
        super(message, cause);
        this.entityValue = entityValue;
    }

    public String getEntityValue() {
        return entityValue;
    }
}
