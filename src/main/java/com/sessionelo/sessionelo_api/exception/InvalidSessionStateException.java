package com.sessionelo.sessionelo_api.exception;

/**
 * The request is well formed but the session is in the wrong state for it,
 * e.g. submitting a round of a completed session.
 */
public class InvalidSessionStateException extends RuntimeException {

    public InvalidSessionStateException(String message) {
        super(message);
    }
}
