package com.osint.leadtrace.exception;

public class InvestigationRunNotFoundException extends RuntimeException {

    public InvestigationRunNotFoundException(String message) {
        super(message);
    }
}
