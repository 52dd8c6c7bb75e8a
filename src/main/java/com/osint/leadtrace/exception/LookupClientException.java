package com.osint.leadtrace.exception;

public class LookupClientException extends RuntimeException {

    private final int statusCode;

    public LookupClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public LookupClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public LookupClientException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
