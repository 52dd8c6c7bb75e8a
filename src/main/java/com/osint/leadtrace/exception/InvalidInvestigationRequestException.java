package com.osint.leadtrace.exception;

public class InvalidInvestigationRequestException extends RuntimeException {

    public InvalidInvestigationRequestException(String message) {
        super(message);
    }
}
