package com.sessionelo.sessionelo_api.exception;

/**
 * Another recalculation holds the session's lock. Callers should retry later;
 * the request is never queued.
 */
public class RecalculationConflictException extends RuntimeException {

    private final String sessionId;

    public RecalculationConflictException(String sessionId) {
        super("A recalculation is already in progress for session " + sessionId + ". Try again later.");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
