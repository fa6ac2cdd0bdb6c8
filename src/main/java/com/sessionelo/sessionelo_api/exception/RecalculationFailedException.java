package com.sessionelo.sessionelo_api.exception;

/**
 * The store failed while ratings were being recalculated. The session's lock
 * is left FAILED; the next successful recalculation repairs the state.
 */
public class RecalculationFailedException extends RuntimeException {

    public RecalculationFailedException(String sessionId, Throwable cause) {
        super("Recalculation failed for session " + sessionId, cause);
    }
}
