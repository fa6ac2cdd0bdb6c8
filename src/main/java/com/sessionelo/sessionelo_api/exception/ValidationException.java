package com.sessionelo.sessionelo_api.exception;

/**
 * Malformed request, rejected before any lock is taken or row is written.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
