package com.evobus.contract;

/**
 * Malformed input from a caller: a change without a type, an out-of-range profile, an
 * empty pattern, an undecodable routing decision.
 */
public class ValidationException extends RuntimeException {

    private final String errorCode;

    public ValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
