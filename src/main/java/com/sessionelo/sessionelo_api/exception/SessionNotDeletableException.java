package com.sessionelo.sessionelo_api.exception;

public class SessionNotDeletableException extends RuntimeException {

    private final String sessionId;

    public SessionNotDeletableException(String sessionId, String reason) {
        super(reason);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
